package org.lifezone.core.classification;

import org.lifezone.core.model.FloatRaster;
import org.lifezone.core.model.MaskRaster;

/**
 * Входные растры одного прогона. Размеры проверяются сразу, без broadcast.
 *
 * @param biotemperature         годовая биотемпература, °C
 * @param seaLevelBiotemperature биотемпература, приведённая к уровню моря, °C
 * @param precipitation          годовые осадки, мм
 * @param pet                    потенциальная эвапотранспирация, мм/год
 * @param noData                 true = нет данных хотя бы в одном слое
 */
public record ClassificationInputs(FloatRaster biotemperature,
                                   FloatRaster seaLevelBiotemperature,
                                   FloatRaster precipitation,
                                   FloatRaster pet,
                                   MaskRaster noData) {

    public ClassificationInputs {
        if (biotemperature == null) {
            throw new IllegalArgumentException("Biotemperature raster is required");
        }
        biotemperature.requireSameShape(seaLevelBiotemperature, "Sea-level biotemperature");
        biotemperature.requireSameShape(precipitation, "Precipitation");
        biotemperature.requireSameShape(pet, "PET");
        biotemperature.requireSameShape(noData, "No-data mask");
    }

    public int width() {
        return biotemperature.width;
    }

    public int height() {
        return biotemperature.height;
    }
}
