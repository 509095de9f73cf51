package com.airglow.model;

public class SpectrumMetadata {
    public final int plate;
    public final int specNo;
    public final String camera;

    public SpectrumMetadata(int plate, int specNo, String camera) {
        this.plate = plate;
        this.specNo = specNo;
        this.camera = camera;
    }
}
