package com.airglow.model;

public class FitRecord {
    public final double fitSeconds;
    public final int plate;
    public final String camera;
    public final int specNo;
    public final FitResult result;

    public FitRecord(double fitSeconds, int plate, String camera, int specNo, FitResult result) {
        this.fitSeconds = fitSeconds;
        this.plate = plate;
        this.camera = camera;
        this.specNo = specNo;
        this.result = result;
    }
}
