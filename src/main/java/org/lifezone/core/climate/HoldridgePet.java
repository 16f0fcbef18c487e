package org.lifezone.core.climate;

import org.lifezone.core.model.FloatRaster;
import org.lifezone.core.model.HlzConstants;

/**
 * Классическая оценка PET по Холдриджу: PET (мм/год) = 58.93 * биотемпература.
 * Используется при подготовке входов варианта CLASSICAL; классификатор получает
 * уже готовый растр PET.
 */
public final class HoldridgePet {

    private HoldridgePet() {}

    public static float pet(float biotemp) {
        return (float) (biotemp * HlzConstants.HOLDRIDGE_PET_FACTOR);
    }

    public static FloatRaster fromBiotemperature(FloatRaster biotemp) {
        FloatRaster out = new FloatRaster(biotemp.width, biotemp.height);
        int n = biotemp.cellCount();
        for (int i = 0; i < n; i++) {
            out.setAt(i, pet(biotemp.getAt(i)));
        }
        return out;
    }
}
