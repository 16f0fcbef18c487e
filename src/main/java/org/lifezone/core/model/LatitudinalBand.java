package org.lifezone.core.model;

public enum LatitudinalBand {
    POLAR(1, "polar"),
    SUBPOLAR(2, "subpolar"),
    BOREAL(3, "boreal"),
    COOL_TEMPERATE(4, "cool temperate"),
    WARM_TEMPERATE(5, "warm temperate"),
    SUBTROPICAL(6, "subtropical"),
    TROPICAL(7, "tropical");

    public final int code;
    public final String label;

    LatitudinalBand(int code, String label) {
        this.code = code;
        this.label = label;
    }

    /** null, если код вне 1..7. */
    public static LatitudinalBand fromCode(int code) {
        for (LatitudinalBand b : values()) {
            if (b.code == code) return b;
        }
        return null;
    }
}
