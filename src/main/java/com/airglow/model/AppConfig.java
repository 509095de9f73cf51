package com.airglow.model;

import java.nio.file.Paths;
import java.util.prefs.Preferences;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    // --- Directories and input tables ---
    private static final String KEY_SPECTRA_DIR = "airglow.spectraDir";
    private static final String KEY_SAVE_DIR = "airglow.saveDir";
    private static final String KEY_METADATA = "airglow.metadataFile";
    private static final String KEY_AIRGLOW_DIR = "airglow.catalogDir";

    // --- Batch behaviour ---
    private static final String KEY_PARALLEL = "airglow.parallel";
    private static final String KEY_POOL_SIZE = "airglow.poolSize";
    private static final String KEY_MAX_PER_PLATE = "airglow.maxSpectraPerPlate";
    private static final String KEY_SEED = "airglow.sampleSeed";

    private static String workDir(String child) {
        return Paths.get(System.getProperty("user.dir"), child).toString();
    }

    // A -D system property wins over the stored preference.
    private static String get(String key, String def) {
        return System.getProperty(key, prefs.get(key, def));
    }

    public static String getSpectraDir() { return get(KEY_SPECTRA_DIR, workDir("sigma_sky_flux")); }
    public static void setSpectraDir(String v) { prefs.put(KEY_SPECTRA_DIR, v); }

    public static String getSaveDir() { return get(KEY_SAVE_DIR, workDir("split_flux")); }
    public static void setSaveDir(String v) { prefs.put(KEY_SAVE_DIR, v); }

    public static String getMetadataFile() { return get(KEY_METADATA, workDir("meta_rich.txt")); }
    public static void setMetadataFile(String v) { prefs.put(KEY_METADATA, v); }

    public static String getAirglowDir() { return get(KEY_AIRGLOW_DIR, workDir("cosby")); }
    public static void setAirglowDir(String v) { prefs.put(KEY_AIRGLOW_DIR, v); }

    public static boolean isParallel() { return Boolean.parseBoolean(get(KEY_PARALLEL, "true")); }
    public static void setParallel(boolean v) { prefs.putBoolean(KEY_PARALLEL, v); }

    public static int getPoolSize() { return Integer.parseInt(get(KEY_POOL_SIZE, "32")); }
    public static void setPoolSize(int v) { prefs.putInt(KEY_POOL_SIZE, v); }

    public static int getMaxSpectraPerPlate() { return Integer.parseInt(get(KEY_MAX_PER_PLATE, "10")); }
    public static void setMaxSpectraPerPlate(int v) { prefs.putInt(KEY_MAX_PER_PLATE, v); }

    /** Seed for spectrum sampling; {@code null} means a fresh, non-reproducible draw per plate. */
    public static Long getSampleSeed() {
        String v = get(KEY_SEED, "");
        return v.isBlank() ? null : Long.valueOf(v.trim());
    }
    public static void setSampleSeed(long v) { prefs.putLong(KEY_SEED, v); }
}
