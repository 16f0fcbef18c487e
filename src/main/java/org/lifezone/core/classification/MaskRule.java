package org.lifezone.core.classification;

import org.lifezone.core.model.HlzConstants;
import org.lifezone.core.model.MaskOutcome;
import org.lifezone.core.model.ZoneTable;

/**
 * Правила перекрытия в порядке применения. Более позднее правило побеждает,
 * но право на срабатывание может зависеть от результата более раннего.
 */
public enum MaskRule {

    /** biotemp <= 1.5 или полярный шестиугольник, кроме no-data. */
    POLAR_DESERT(MaskOutcome.POLAR_DESERT) {
        @Override
        boolean applies(MaskCell c, MaskOutcome current, ZoneTable table) {
            if (c.noData()) return false;
            return c.biotemp() <= HlzConstants.POLAR_BIOTEMP || table.isPolarRow(c.zoneIndex());
        }
    },

    /** Осадки или PET-ratio вне огибающей модели, кроме полярных и no-data. */
    OUT_OF_BOUNDS(MaskOutcome.OUT_OF_BOUNDS) {
        @Override
        boolean applies(MaskCell c, MaskOutcome current, ZoneTable table) {
            if (c.noData() || current == MaskOutcome.POLAR_DESERT) return false;
            return c.precip() < HlzConstants.MIN_PRECIP
                    || c.precip() >= HlzConstants.MAX_PRECIP
                    || c.petRatio() < HlzConstants.MIN_PET_RATIO
                    || c.petRatio() >= HlzConstants.MAX_PET_RATIO;
        }
    },

    /** Внешняя маска no-data, безусловно и последней. */
    NO_DATA(MaskOutcome.NO_DATA) {
        @Override
        boolean applies(MaskCell c, MaskOutcome current, ZoneTable table) {
            return c.noData();
        }
    };

    public final MaskOutcome outcome;

    MaskRule(MaskOutcome outcome) {
        this.outcome = outcome;
    }

    abstract boolean applies(MaskCell c, MaskOutcome current, ZoneTable table);

    /** Входы одной ячейки, нужные правилам. */
    public record MaskCell(float biotemp, float precip, float petRatio, int zoneIndex, boolean noData) {
    }
}
