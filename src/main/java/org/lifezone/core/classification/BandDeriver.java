package org.lifezone.core.classification;

import org.lifezone.core.model.AltitudinalBand;
import org.lifezone.core.model.HlzConstants;

/**
 * Пояса по биотемпературе: 1 = polar ... 7 = tropical.
 * Для ячейки считаются дважды: по локальной и по приведённой к уровню моря биотемпературе.
 */
public final class BandDeriver {

    public static final int UNDEFINED = 0;

    private BandDeriver() {}

    /**
     * Монотонная ступенчатая функция. Ровно 1.5 °C попадает в subpolar:
     * правило [1.5, 3) применяется после правила "<= 1.5".
     * NaN -> 0 (пояс не определён).
     */
    public static int band(double biotemp) {
        if (Double.isNaN(biotemp)) return UNDEFINED;
        if (biotemp < HlzConstants.POLAR_BIOTEMP) return 1;
        if (biotemp < 3.0) return 2;
        if (biotemp < 6.0) return 3;
        if (biotemp < HlzConstants.WARM_TEMPERATE_BIOTEMP) return 4;
        if (biotemp < HlzConstants.FROST_LINE) return 5;
        if (biotemp < HlzConstants.TROPICAL_BIOTEMP) return 6;
        return 7;
    }

    /** Широтный пояс - по биотемпературе на уровне моря. */
    public static int latitudinalBand(float seaLevelBiotemp) {
        return band(seaLevelBiotemp);
    }

    /**
     * Высотный пояс: локальный пояс, если высота его сдвинула, иначе базальный (7).
     * Если хотя бы один из поясов не определён - результат тоже не определён.
     */
    public static int altitudinalBand(float localBiotemp, float seaLevelBiotemp) {
        int local = band(localBiotemp);
        int seaLevel = band(seaLevelBiotemp);
        if (local == UNDEFINED || seaLevel == UNDEFINED) return UNDEFINED;
        return local != seaLevel ? local : AltitudinalBand.BASAL.code;
    }
}
