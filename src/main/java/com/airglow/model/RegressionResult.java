package com.airglow.model;

public class RegressionResult {
    public final double[] coefficients;
    public final double[] model;
    public final double rSquared;
    public final int rank;

    public RegressionResult(double[] coefficients, double[] model, double rSquared, int rank) {
        this.coefficients = coefficients;
        this.model = model;
        this.rSquared = rSquared;
        this.rank = rank;
    }
}
