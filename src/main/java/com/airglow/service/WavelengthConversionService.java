package com.airglow.service;

import java.util.Arrays;

// Edlen (1966) index of standard air: vacuum = n * air
public class WavelengthConversionService {

    private static final double BASE = 8342.13;
    private static final double TERM_1 = 2406030.0;
    private static final double RESONANCE_1 = 130.0;
    private static final double TERM_2 = 15997.0;
    private static final double RESONANCE_2 = 38.9; // Edlen's published value, not 389

    // nm in, nm out; positive input only
    public double[] airToVacuum(double[] airNm) {
        return Arrays.stream(airNm).map(this::airToVacuum).toArray();
    }

    public double airToVacuum(double airNm) {
        return refractiveIndex(airNm) * airNm;
    }

    public double refractiveIndex(double airNm) {
        double um = airNm * 0.001;
        double sigma2 = 1.0 / (um * um);
        return 1.0 + 1e-8 * (BASE + TERM_1 / (RESONANCE_1 - sigma2) + TERM_2 / (RESONANCE_2 - sigma2));
    }
}
