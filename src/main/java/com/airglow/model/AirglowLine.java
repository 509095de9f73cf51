package com.airglow.model;

public class AirglowLine {
    public final double obsWave;   // air, nm
    public final double intensity;

    public AirglowLine(double obsWave, double intensity) {
        this.obsWave = obsWave;
        this.intensity = intensity;
    }
}
