package com.airglow.service;

import com.airglow.model.AirglowLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

// Whitespace tables; header must name obs_wave (air, nm) and obs_eint
public class AirglowCatalogService {

    private static final Logger log = LoggerFactory.getLogger(AirglowCatalogService.class);

    static final String COL_WAVE = "obs_wave";
    static final String COL_INTENSITY = "obs_eint";

    public List<AirglowLine> loadDirectory(File dir) throws IOException {
        File[] files = dir.listFiles((d, name) -> name.endsWith(".txt"));
        if (files == null) throw new IOException("Airglow catalog directory not readable: " + dir);
        Arrays.sort(files);

        List<AirglowLine> all = new ArrayList<>();
        for (File f : files) all.addAll(loadFile(f));
        if (all.isEmpty()) throw new IllegalStateException("No airglow lines found in " + dir);

        log.info("Loaded {} airglow lines from {} files", all.size(), files.length);
        return Collections.unmodifiableList(all);
    }

    public List<AirglowLine> loadFile(File f) throws IOException {
        List<String> lines = Files.readAllLines(f.toPath());
        List<AirglowLine> out = new ArrayList<>();
        int waveCol = -1, eintCol = -1;

        for (int n = 0; n < lines.size(); n++) {
            String l = lines.get(n).trim();
            if (l.isEmpty() || l.startsWith("#")) continue;
            String[] parts = l.split("\\s+");

            if (waveCol < 0) {
                List<String> header = Arrays.asList(parts);
                waveCol = header.indexOf(COL_WAVE);
                eintCol = header.indexOf(COL_INTENSITY);
                if (waveCol < 0 || eintCol < 0) {
                    throw new IOException(f + ": header must contain " + COL_WAVE + " and " + COL_INTENSITY);
                }
                continue;
            }
            try {
                out.add(new AirglowLine(Double.parseDouble(parts[waveCol]), Double.parseDouble(parts[eintCol])));
            } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                throw new IOException(f + ":" + (n + 1) + ": malformed line '" + l + "'", e);
            }
        }
        return out;
    }
}
