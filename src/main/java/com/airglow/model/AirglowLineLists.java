package com.airglow.model;

import java.util.Arrays;

// Vacuum Angstrom per band; read-only once built, shared by all workers
public final class AirglowLineLists {
    private final double[] shortBand;
    private final double[] longBand;

    public AirglowLineLists(double[] shortBand, double[] longBand) {
        this.shortBand = shortBand.clone();
        this.longBand = longBand.clone();
    }

    public double[] forBand(LineBand band) {
        return band == LineBand.SHORT ? shortBand.clone() : longBand.clone();
    }

    public double[] forArm(CameraArm arm) {
        return forBand(arm.band);
    }

    public int size(LineBand band) {
        return band == LineBand.SHORT ? shortBand.length : longBand.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AirglowLineLists)) return false;
        AirglowLineLists other = (AirglowLineLists) o;
        return Arrays.equals(shortBand, other.shortBand) && Arrays.equals(longBand, other.longBand);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shortBand) + Arrays.hashCode(longBand);
    }
}
