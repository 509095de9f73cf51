package com.airglow.model;

public class SeparatedSpectrum {
    public final double[] continuum;
    public final double[] lines;
    public final double[] residual;

    public SeparatedSpectrum(double[] continuum, double[] lines, double[] residual) {
        this.continuum = continuum;
        this.lines = lines;
        this.residual = residual;
    }
}
