package org.lifezone.core.classification;

import org.lifezone.core.model.HlzConstants;
import org.lifezone.core.model.ZoneTable;

/**
 * Тёплый умеренный и субтропический пояса делят одни шестиугольники.
 * Выше линии заморозков индекс сдвигается в субтропический блок таблицы.
 */
public class SubtropicalDisambiguator {

    private final int fromIndex;
    private final int toIndex;
    private final int offset;

    public SubtropicalDisambiguator(ZoneTable table) {
        this.fromIndex = table.warmTemperateDesertIndex();
        this.toIndex = table.warmTemperateRainForestIndex();
        this.offset = table.subtropicalOffset();
    }

    public int vegClass(int zoneIndex, float biotemp) {
        if (zoneIndex >= fromIndex && zoneIndex <= toIndex && biotemp > HlzConstants.FROST_LINE) {
            return zoneIndex + offset;
        }
        return zoneIndex;
    }

    public int[] vegClasses(int[] zoneIndex, float[] biotemp) {
        int[] out = new int[zoneIndex.length];
        for (int i = 0; i < zoneIndex.length; i++) {
            out[i] = vegClass(zoneIndex[i], biotemp[i]);
        }
        return out;
    }
}
