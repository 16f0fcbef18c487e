package org.lifezone.core.classification.stages;

import org.lifezone.core.classification.ClassificationStage;
import org.lifezone.core.classification.MaskApplier;
import org.lifezone.core.classification.StageId;
import org.lifezone.core.classification.TileContext;

public class MaskStage implements ClassificationStage {

    private final MaskApplier applier;

    public MaskStage(MaskApplier applier) {
        this.applier = applier;
    }

    @Override
    public StageId id() {
        return StageId.MASKS;
    }

    @Override
    public String name() {
        return "Masks";
    }

    @Override
    public void apply(TileContext ctx) {
        ctx.maskOutcome = applier.apply(ctx.biotemp, ctx.precip, ctx.petRatio, ctx.zoneIndex,
                ctx.noData, ctx.vegClass, ctx.ecotone);
    }
}
