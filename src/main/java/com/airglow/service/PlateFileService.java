package com.airglow.service;

import com.airglow.model.PlateBatch;
import com.airglow.model.Spectrum;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.util.BufferedFile;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Image extensions WAVE, SKY, SIGMA, DISP as [spectrum][sample]; specno = row index.
public class PlateFileService {

    static final String EXT_WAVE = "WAVE";
    static final String EXT_SKY = "SKY";
    static final String EXT_SIGMA = "SIGMA";
    static final String EXT_DISP = "DISP";

    private static final Pattern PLATE_ID = Pattern.compile("(\\d{4,})");

    public static int plateIdOf(File f) {
        Matcher m = PLATE_ID.matcher(f.getName());
        if (!m.find()) throw new IllegalArgumentException("No plate number in file name: " + f.getName());
        return Integer.parseInt(m.group(1));
    }

    public PlateBatch read(File f) throws IOException, FitsException {
        Map<String, double[][]> ext = new HashMap<>();
        try (Fits fits = new Fits(f)) {
            for (BasicHDU<?> hdu : fits.read()) {
                String name = hdu.getHeader().getStringValue("EXTNAME");
                if (name != null) {
                    String key = name.trim().toUpperCase();
                    ext.put(key, toDouble(hdu.getKernel(), f.getName() + "[" + key + "]"));
                }
            }
        }

        double[][] wave = require(ext, EXT_WAVE, f);
        double[][] sky = require(ext, EXT_SKY, f);
        double[][] sigma = require(ext, EXT_SIGMA, f);
        double[][] disp = require(ext, EXT_DISP, f);
        if (sky.length != wave.length || sigma.length != wave.length || disp.length != wave.length) {
            throw new FitsException(f + ": extensions hold different numbers of spectra");
        }

        List<Spectrum> spectra = new ArrayList<>(wave.length);
        for (int i = 0; i < wave.length; i++) {
            spectra.add(new Spectrum(wave[i], sky[i], sigma[i], disp[i]));
        }
        return new PlateBatch(plateIdOf(f), spectra);
    }

    public void write(PlateBatch batch, File f) throws IOException, FitsException {
        int n = batch.size();
        double[][] wave = new double[n][], sky = new double[n][], sigma = new double[n][], disp = new double[n][];
        for (int i = 0; i < n; i++) {
            Spectrum s = batch.spectrum(i);
            wave[i] = s.wave;
            sky[i] = s.flux;
            sigma[i] = s.sigma;
            disp[i] = s.disp;
        }

        Files.deleteIfExists(f.toPath());
        try (Fits fits = new Fits()) {
            BasicHDU<?> primary = BasicHDU.getDummyHDU();
            primary.getHeader().addValue("PLATE", batch.plate, "plate number");
            fits.addHDU(primary);
            addImage(fits, EXT_WAVE, wave);
            addImage(fits, EXT_SKY, sky);
            addImage(fits, EXT_SIGMA, sigma);
            addImage(fits, EXT_DISP, disp);
            try (BufferedFile out = new BufferedFile(f, "rw")) {
                fits.write(out);
            }
        }
    }

    private void addImage(Fits fits, String name, double[][] data) throws FitsException {
        BasicHDU<?> hdu = Fits.makeHDU(data);
        Header h = hdu.getHeader();
        h.addValue("EXTNAME", name, "spectrum array");
        fits.addHDU(hdu);
    }

    private double[][] require(Map<String, double[][]> ext, String name, File f) throws FitsException {
        double[][] d = ext.get(name);
        if (d == null) throw new FitsException(f + ": missing extension " + name);
        return d;
    }

    static double[][] toDouble(Object k, String ext) throws FitsException {
        if (k instanceof double[][]) return (double[][]) k;
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            double[][] d = new double[f.length][];
            for (int i = 0; i < f.length; i++) {
                d[i] = new double[f[i].length];
                for (int j = 0; j < f[i].length; j++) d[i][j] = f[i][j];
            }
            return d;
        }
        if (k instanceof long[][]) {
            long[][] l = (long[][]) k;
            double[][] d = new double[l.length][];
            for (int i = 0; i < l.length; i++) {
                d[i] = new double[l[i].length];
                for (int j = 0; j < l[i].length; j++) d[i][j] = l[i][j];
            }
            return d;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            double[][] d = new double[s.length][];
            for (int i = 0; i < s.length; i++) {
                d[i] = new double[s[i].length];
                for (int j = 0; j < s[i].length; j++) d[i][j] = s[i][j];
            }
            return d;
        }
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            double[][] d = new double[s.length][];
            for (int i = 0; i < s.length; i++) {
                d[i] = new double[s[i].length];
                for (int j = 0; j < s[i].length; j++) d[i][j] = s[i][j];
            }
            return d;
        }
        if (k instanceof byte[][]) {
            // BITPIX 8 is unsigned
            byte[][] b = (byte[][]) k;
            double[][] d = new double[b.length][];
            for (int i = 0; i < b.length; i++) {
                d[i] = new double[b[i].length];
                for (int j = 0; j < b[i].length; j++) d[i][j] = b[i][j] & 0xFF;
            }
            return d;
        }
        String type = k == null ? "no data" : k.getClass().getSimpleName();
        throw new FitsException("Extension " + ext + " must be a 2-D [spectrum][sample] array, found " + type);
    }
}
