package com.airglow.model;

public class Spectrum {
    public final double[] wave;
    public final double[] flux;
    public final double[] sigma;
    public final double[] disp;

    public Spectrum(double[] wave, double[] flux, double[] sigma, double[] disp) {
        int n = wave.length;
        if (flux.length != n || sigma.length != n || disp.length != n) {
            throw new IllegalArgumentException(String.format(
                "Misaligned spectrum arrays: wave=%d flux=%d sigma=%d disp=%d",
                n, flux.length, sigma.length, disp.length));
        }
        this.wave = wave;
        this.flux = flux;
        this.sigma = sigma;
        this.disp = disp;
    }

    public int length() {
        return wave.length;
    }

    /** Drops every sample whose flux is NaN or infinite, keeping the four arrays aligned. */
    public Spectrum clean() {
        int ok = 0;
        for (double f : flux) if (Double.isFinite(f)) ok++;
        if (ok == flux.length) return this;

        double[] w = new double[ok], f = new double[ok], s = new double[ok], d = new double[ok];
        int j = 0;
        for (int i = 0; i < flux.length; i++) {
            if (!Double.isFinite(flux[i])) continue;
            w[j] = wave[i];
            f[j] = flux[i];
            s[j] = sigma[i];
            d[j] = disp[i];
            j++;
        }
        return new Spectrum(w, f, s, d);
    }
}
