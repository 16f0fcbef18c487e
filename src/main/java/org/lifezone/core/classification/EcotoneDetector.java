package org.lifezone.core.classification;

import org.lifezone.core.model.Ecotone;
import org.lifezone.core.model.ZoneDefinition;
import org.lifezone.core.model.ZoneTable;

/**
 * Переходные зоны. Проверки идут в фиксированном порядке: осадки, PET-ratio, биотемпература;
 * каждая сработавшая перезаписывает предыдущую, так что у биотемпературы последнее слово.
 * Рёбра берутся из строки итогового veg class (после субтропического сдвига).
 */
public class EcotoneDetector {

    private final boolean computeEcotones;
    private final ZoneTable table;

    public EcotoneDetector(boolean computeEcotones, ZoneTable table) {
        this.computeEcotones = computeEcotones;
        this.table = table;
    }

    public boolean isEnabled() {
        return computeEcotones;
    }

    public int ecotone(int vegClass, float biotemp, float precip, float petRatio) {
        if (!computeEcotones || !table.contains(vegClass)) {
            return Ecotone.UNDIFFERENTIATED.code;
        }
        ZoneDefinition z = table.row(vegClass);
        int eco = Ecotone.CORE.code;

        if (precip < z.precipEdge()) eco = Ecotone.HYPOPLUVIAL.code;
        if (precip > z.precipEdge() * 2.0) eco = Ecotone.HYPERPLUVIAL.code;

        if (petRatio < z.petRatioEdge()) eco = Ecotone.HYPERHUMID.code;
        if (petRatio > z.petRatioEdge() * 2.0) eco = Ecotone.HYPOHUMID.code;

        if (biotemp < z.biotempEdge()) eco = Ecotone.HYPERTHERMAL.code;
        if (biotemp > z.biotempEdge() * 2.0) eco = Ecotone.HYPOTHERMAL.code;

        return eco;
    }
}
