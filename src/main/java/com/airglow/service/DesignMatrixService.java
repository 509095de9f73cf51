package com.airglow.service;

import com.airglow.model.DesignMatrix;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialsUtils;

public class DesignMatrixService {

    // Unit-peak Gaussians, width of row i = disp[i]. Off-grid lines keep a zero column.
    public double[][] lineProfiles(double[] lines, double[] wave, double[] disp) {
        double[][] m = new double[wave.length][lines.length];
        for (int i = 0; i < wave.length; i++) {
            double sig = disp[i];
            for (int j = 0; j < lines.length; j++) {
                double z = (wave[i] - lines[j]) / sig;
                m[i][j] = Math.exp(-0.5 * z * z);
            }
        }
        return m;
    }

    // Legendre P0..P(terms-1) on the grid mapped to [-1, 1]
    public double[][] continuum(double[] wave, int terms) {
        double lo = Double.POSITIVE_INFINITY, hi = Double.NEGATIVE_INFINITY;
        for (double w : wave) {
            lo = Math.min(lo, w);
            hi = Math.max(hi, w);
        }
        double mid = (hi + lo) / 2.0;
        double half = (hi - lo) / 2.0;

        PolynomialFunction[] legendre = new PolynomialFunction[terms];
        for (int k = 0; k < terms; k++) legendre[k] = PolynomialsUtils.createLegendrePolynomial(k);

        double[][] m = new double[wave.length][terms];
        for (int i = 0; i < wave.length; i++) {
            double x = half > 0 ? (wave[i] - mid) / half : 0.0;
            for (int k = 0; k < terms; k++) m[i][k] = legendre[k].value(x);
        }
        return m;
    }

    public DesignMatrix build(double[] wave, double[] disp, double[] lines, int continuumTerms) {
        double[][] cont = continuum(wave, continuumTerms);
        double[][] prof = lineProfiles(lines, wave, disp);

        double[][] a = new double[wave.length][continuumTerms + lines.length];
        for (int i = 0; i < wave.length; i++) {
            System.arraycopy(cont[i], 0, a[i], 0, continuumTerms);
            System.arraycopy(prof[i], 0, a[i], continuumTerms, lines.length);
        }
        return new DesignMatrix(a, continuumTerms);
    }
}
