package org.lifezone.core.classification;

import org.lifezone.core.model.MaskOutcome;

/**
 * Счётчики прогона. Каждый тайл считает свои, потом они сливаются.
 */
public class ClassificationStats {

    public long cellCount;
    public long noDataCount;
    public long outOfBoundsCount;
    public long polarDesertCount;
    public long degenerateCount;
    public int tileCount;

    // veg class -> число ячеек с этим классом в итоговом коде
    public final long[] vegClassCounts;
    public final long[] ecotoneCounts = new long[8];

    public ClassificationStats(int vegClassCount) {
        this.vegClassCounts = new long[vegClassCount + 1];
    }

    public void countOutcome(MaskOutcome outcome) {
        cellCount++;
        switch (outcome) {
            case NO_DATA -> noDataCount++;
            case OUT_OF_BOUNDS -> outOfBoundsCount++;
            case POLAR_DESERT -> polarDesertCount++;
            default -> {
                // обычная ячейка
            }
        }
    }

    public void countZone(int vegClass, int ecotone) {
        if (vegClass >= 0 && vegClass < vegClassCounts.length) vegClassCounts[vegClass]++;
        if (ecotone >= 0 && ecotone < ecotoneCounts.length) ecotoneCounts[ecotone]++;
    }

    public long classifiedCount() {
        return cellCount - noDataCount - outOfBoundsCount - degenerateCount;
    }

    public ClassificationStats merge(ClassificationStats other) {
        cellCount += other.cellCount;
        noDataCount += other.noDataCount;
        outOfBoundsCount += other.outOfBoundsCount;
        polarDesertCount += other.polarDesertCount;
        degenerateCount += other.degenerateCount;
        tileCount += other.tileCount;
        int n = Math.min(vegClassCounts.length, other.vegClassCounts.length);
        for (int i = 0; i < n; i++) vegClassCounts[i] += other.vegClassCounts[i];
        for (int i = 0; i < ecotoneCounts.length; i++) ecotoneCounts[i] += other.ecotoneCounts[i];
        return this;
    }
}
