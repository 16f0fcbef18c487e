package org.lifezone.core.classification;

import org.lifezone.core.model.Ecotone;
import org.lifezone.core.model.HlzConstants;
import org.lifezone.core.model.MaskOutcome;
import org.lifezone.core.model.ZoneTable;

/**
 * Один проход по ячейке через упорядоченную таблицу правил {@link MaskRule}.
 */
public class MaskApplier {

    private static final MaskRule[] RULES = MaskRule.values();

    private final ZoneTable table;

    public MaskApplier(ZoneTable table) {
        this.table = table;
    }

    public MaskOutcome resolve(MaskRule.MaskCell cell) {
        MaskOutcome outcome = MaskOutcome.NONE;
        for (MaskRule rule : RULES) {
            if (rule.applies(cell, outcome, table)) {
                outcome = rule.outcome;
            }
        }
        return outcome;
    }

    public MaskOutcome resolve(float biotemp, float precip, float petRatio, int zoneIndex, boolean noData) {
        return resolve(new MaskRule.MaskCell(biotemp, precip, petRatio, zoneIndex, noData));
    }

    /**
     * Применяет маски к буферам тайла: полярная пустыня переписывает veg class и экотон,
     * остальные исходы остаются в возвращаемом массиве для сборки кода.
     */
    public MaskOutcome[] apply(float[] biotemp, float[] precip, float[] petRatio, int[] zoneIndex,
                               boolean[] noData, int[] vegClass, int[] ecotone) {
        int n = biotemp.length;
        MaskOutcome[] out = new MaskOutcome[n];
        for (int i = 0; i < n; i++) {
            MaskOutcome o = resolve(biotemp[i], precip[i], petRatio[i], zoneIndex[i], noData[i]);
            if (o == MaskOutcome.POLAR_DESERT) {
                vegClass[i] = HlzConstants.POLAR_DESERT_VEG_CLASS;
                ecotone[i] = Ecotone.UNDIFFERENTIATED.code;
            }
            out[i] = o;
        }
        return out;
    }
}
