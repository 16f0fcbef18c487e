package org.lifezone.core.classification;

import org.lifezone.core.model.HlzConstants;
import org.lifezone.core.model.LifeZoneCode;
import org.lifezone.core.model.MaskOutcome;

/**
 * code = 1000*vegClass + 100*altBand + 10*latBand + ecotone, затем сентинелы масок.
 * Код хранится в int, так что двузначные veg class (до 41 с субтропиками) не наезжают на пояса.
 */
public final class CodeAssembler {

    private CodeAssembler() {}

    public static int pack(int vegClass, int altBand, int latBand, int ecotone) {
        if (vegClass < 0) {
            throw new IllegalArgumentException("vegClass must be >= 0: " + vegClass);
        }
        if (altBand < 1 || altBand > 7) {
            throw new IllegalArgumentException("altBand out of 1..7: " + altBand);
        }
        if (latBand < 1 || latBand > 7) {
            throw new IllegalArgumentException("latBand out of 1..7: " + latBand);
        }
        if (ecotone < 0 || ecotone > 7) {
            throw new IllegalArgumentException("ecotone out of 0..7: " + ecotone);
        }
        if (vegClass > (Integer.MAX_VALUE - 999) / 1000) {
            throw new IllegalArgumentException("vegClass too large for int code: " + vegClass);
        }
        return new LifeZoneCode(vegClass, altBand, latBand, ecotone).toCode();
    }

    public static int assemble(int vegClass, int altBand, int latBand, int ecotone, MaskOutcome outcome) {
        return switch (outcome) {
            case NO_DATA -> HlzConstants.NO_DATA_CODE;
            case OUT_OF_BOUNDS -> HlzConstants.OUT_OF_BOUNDS_CODE;
            default -> pack(vegClass, altBand, latBand, ecotone);
        };
    }

    public static boolean isSentinel(int code) {
        return code == HlzConstants.NO_DATA_CODE || code == HlzConstants.OUT_OF_BOUNDS_CODE;
    }
}
