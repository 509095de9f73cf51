package com.airglow.model;

import java.util.Optional;

public enum CameraArm {
    BLUE(LineBand.SHORT, 4, "b1", "b2"),
    RED(LineBand.LONG, 3, "r1", "r2");

    public final LineBand band;
    public final int continuumTerms;
    private final String[] tags;

    CameraArm(LineBand band, int continuumTerms, String... tags) {
        this.band = band;
        this.continuumTerms = continuumTerms;
        this.tags = tags;
    }

    public static Optional<CameraArm> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        String t = tag.trim();
        for (CameraArm arm : values()) {
            for (String known : arm.tags) {
                if (known.equals(t)) return Optional.of(arm);
            }
        }
        return Optional.empty();
    }
}
