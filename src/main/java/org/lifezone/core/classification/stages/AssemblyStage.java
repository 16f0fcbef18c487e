package org.lifezone.core.classification.stages;

import org.lifezone.core.classification.BandDeriver;
import org.lifezone.core.classification.ClassificationStage;
import org.lifezone.core.classification.CodeAssembler;
import org.lifezone.core.classification.LogSpaceNearestClassifier;
import org.lifezone.core.classification.StageId;
import org.lifezone.core.classification.TileContext;
import org.lifezone.core.exception.NumericDegeneracyException;
import org.lifezone.core.model.HlzConstants;
import org.lifezone.core.model.MaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Сборка кодов. Ячейка, дошедшая сюда без зоны или пояса (NaN вне маски no-data),
 * не получает правдоподобный код: в strict-режиме прогон прерывается,
 * иначе пишется сентинел out-of-bounds и ячейка считается.
 */
public class AssemblyStage implements ClassificationStage {

    private static final Logger log = LoggerFactory.getLogger(AssemblyStage.class);

    @Override
    public StageId id() {
        return StageId.ASSEMBLY;
    }

    @Override
    public String name() {
        return "Code assembly";
    }

    @Override
    public void apply(TileContext ctx) {
        int n = ctx.cellCount();
        int[] codes = new int[n];
        long degenerate = 0;

        for (int i = 0; i < n; i++) {
            MaskOutcome outcome = ctx.maskOutcome[i];
            String reason = (outcome == MaskOutcome.NONE || outcome == MaskOutcome.POLAR_DESERT)
                    ? degeneracy(ctx, i, outcome) : null;

            if (reason != null) {
                if (ctx.settings.strictNumerics) {
                    throw new NumericDegeneracyException(ctx.rowOf(i), ctx.colOf(i), reason);
                }
                if (degenerate == 0) {
                    log.warn("Undefined classification at row={} col={} ({}), written as out of bounds",
                            ctx.rowOf(i), ctx.colOf(i), reason);
                }
                degenerate++;
                ctx.stats.cellCount++;
                codes[i] = HlzConstants.OUT_OF_BOUNDS_CODE;
                continue;
            }

            ctx.stats.countOutcome(outcome);
            codes[i] = CodeAssembler.assemble(ctx.vegClass[i], ctx.altBand[i], ctx.latBand[i], ctx.ecotone[i], outcome);
            if (!CodeAssembler.isSentinel(codes[i])) {
                ctx.stats.countZone(ctx.vegClass[i], ctx.ecotone[i]);
            }
        }

        if (degenerate > 1) {
            log.warn("Tile {}: {} cells with undefined classification", ctx.window, degenerate);
        }
        ctx.stats.degenerateCount += degenerate;
        ctx.codes = codes;
    }

    private static String degeneracy(TileContext ctx, int i, MaskOutcome outcome) {
        if (outcome == MaskOutcome.NONE && ctx.zoneIndex[i] == LogSpaceNearestClassifier.UNDEFINED) {
            return "no finite distance to any zone center";
        }
        if (ctx.latBand[i] == BandDeriver.UNDEFINED) {
            return "sea-level biotemperature is NaN";
        }
        if (ctx.altBand[i] == BandDeriver.UNDEFINED) {
            return "biotemperature is NaN";
        }
        return null;
    }
}
