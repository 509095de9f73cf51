package com.airglow.model;

public class FitResult {
    public enum Status { FITTED, UNRECOGNIZED_CAMERA }

    public final Status status;
    public final double[] wave;
    public final double[] lines;
    public final double[] continuum;
    public final double[] residual;
    public final double rSquared;

    public FitResult(Status status, double[] wave, double[] lines, double[] continuum, double[] residual, double rSquared) {
        this.status = status;
        this.wave = wave;
        this.lines = lines;
        this.continuum = continuum;
        this.residual = residual;
        this.rSquared = rSquared;
    }

    // Placeholder (0,0,0,0,0) for spectra recorded by an unknown camera.
    public static FitResult degenerate() {
        return new FitResult(Status.UNRECOGNIZED_CAMERA,
            new double[]{0}, new double[]{0}, new double[]{0}, new double[]{0}, 0);
    }

    public boolean isDegenerate() {
        return status != Status.FITTED;
    }
}
