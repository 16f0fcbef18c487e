package org.lifezone.core.model;

/**
 * Переходная зона. 0 = шестиугольник целиком (без разделения ядро/переход),
 * 1 = ядро, 2..7 = переходные зоны по часовой стрелке от верхнего треугольника.
 */
public enum Ecotone {
    UNDIFFERENTIATED(0, ""),
    CORE(1, " - core life zone"),
    HYPERTHERMAL(2, " - hyperthermal transitional life zone"),
    HYPERHUMID(3, " - hyperhumid transitional life zone"),
    HYPERPLUVIAL(4, " - hyperpluvial transitional life zone"),
    HYPOTHERMAL(5, " - hypothermal transitional life zone"),
    HYPOHUMID(6, " - hypohumid transitional life zone"),
    HYPOPLUVIAL(7, " - hypopluvial transitional life zone");

    public final int code;
    public final String suffix;

    Ecotone(int code, String suffix) {
        this.code = code;
        this.suffix = suffix;
    }

    public static Ecotone fromCode(int code) {
        for (Ecotone e : values()) {
            if (e.code == code) return e;
        }
        return null;
    }
}
