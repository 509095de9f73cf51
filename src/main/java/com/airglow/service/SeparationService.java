package com.airglow.service;

import com.airglow.model.DesignMatrix;
import com.airglow.model.SeparatedSpectrum;

public class SeparationService {

    // residual is the remainder: continuum + lines + residual == flux
    public SeparatedSpectrum separate(DesignMatrix design, double[] coefficients, double[] flux) {
        int nc = design.continuumColumns;
        int cols = design.columns();
        if (coefficients.length != cols) {
            throw new IllegalArgumentException("Expected " + cols + " coefficients, got " + coefficients.length);
        }

        double[] cont = new double[design.rows()];
        double[] lines = new double[design.rows()];
        double[] resid = new double[design.rows()];
        for (int i = 0; i < design.rows(); i++) {
            double[] row = design.data[i];
            double c = 0, l = 0;
            for (int j = 0; j < nc; j++) c += row[j] * coefficients[j];
            for (int j = nc; j < cols; j++) l += row[j] * coefficients[j];
            cont[i] = c;
            lines[i] = l;
            resid[i] = flux[i] - (c + l);
        }
        return new SeparatedSpectrum(cont, lines, resid);
    }
}
