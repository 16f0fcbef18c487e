package org.lifezone.core.model;

public enum AltitudinalBand {
    NIVAL(1, "nival"),
    ALPINE(2, "alpine"),
    SUBALPINE(3, "subalpine"),
    MONTANE(4, "montane"),
    PREMONTANE(5, "premontane"),
    LOWER_MONTANE(6, "lower montane"),
    BASAL(7, "");

    public final int code;
    public final String label;

    AltitudinalBand(int code, String label) {
        this.code = code;
        this.label = label;
    }

    /** Префикс для имени зоны: пустой для базального пояса, иначе с пробелом. */
    public String prefix() {
        return label.isEmpty() ? "" : label + " ";
    }

    public static AltitudinalBand fromCode(int code) {
        for (AltitudinalBand b : values()) {
            if (b.code == code) return b;
        }
        return null;
    }
}
