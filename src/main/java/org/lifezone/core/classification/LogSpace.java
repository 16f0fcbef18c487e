package org.lifezone.core.classification;

/**
 * Нормированное log2-пространство решётки Холдриджа.
 * Соседние границы зон отличаются в 2 раза по каждой оси, так что центр
 * шестиугольника - это ребро + 0.5 по log2.
 */
public final class LogSpace {

    private static final double LN2 = Math.log(2.0);

    private LogSpace() {}

    /**
     * log2 с точным результатом для степеней двойки, чтобы центры решётки
     * получались ровными (4.5, 2.5 ...).
     */
    public static double log2(double v) {
        if (v > 0 && !Double.isInfinite(v)) {
            int exp = Math.getExponent(v);
            if (exp >= Double.MIN_EXPONENT && v == Math.scalb(1.0, exp)) {
                return exp;
            }
        }
        return Math.log(v) / LN2;
    }

    /** Центр зоны в исходных единицах: 2^(log2(edge)+0.5). */
    public static double center(double edge) {
        return Math.pow(2.0, log2(edge) + 0.5);
    }

    /** Координата центра на нормированной оси. */
    public static double centerCoordinate(double edge, double norm) {
        return log2(edge / norm) + 0.5;
    }

    public static double coordinate(double value, double norm) {
        return log2(value / norm);
    }
}
