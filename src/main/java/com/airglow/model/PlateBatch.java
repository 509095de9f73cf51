package com.airglow.model;

import java.util.List;

public class PlateBatch {
    public final int plate;
    private final List<Spectrum> spectra;

    public PlateBatch(int plate, List<Spectrum> spectra) {
        this.plate = plate;
        this.spectra = List.copyOf(spectra);
    }

    public Spectrum spectrum(int specNo) {
        if (specNo < 0 || specNo >= spectra.size()) {
            throw new IndexOutOfBoundsException("Plate " + plate + " has no spectrum " + specNo + " (" + spectra.size() + " stored)");
        }
        return spectra.get(specNo);
    }

    public int size() {
        return spectra.size();
    }
}
