package com.airglow.model;

public enum LineBand {
    SHORT(10.0, Double.NEGATIVE_INFINITY, 700.0),
    LONG(3.0, 560.0, Double.POSITIVE_INFINITY);

    public final double minIntensity;
    public final double minVacuumNm;
    public final double maxVacuumNm;

    LineBand(double minIntensity, double minVacuumNm, double maxVacuumNm) {
        this.minIntensity = minIntensity;
        this.minVacuumNm = minVacuumNm;
        this.maxVacuumNm = maxVacuumNm;
    }

    public boolean accepts(double intensity, double vacuumNm) {
        return intensity > minIntensity && vacuumNm > minVacuumNm && vacuumNm < maxVacuumNm;
    }
}
