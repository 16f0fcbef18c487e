package org.lifezone.core.classification.stages;

import org.lifezone.core.classification.ClassificationStage;
import org.lifezone.core.classification.RatioComputer;
import org.lifezone.core.classification.StageId;
import org.lifezone.core.classification.TileContext;

public class PetRatioStage implements ClassificationStage {

    @Override
    public StageId id() {
        return StageId.PET_RATIO;
    }

    @Override
    public String name() {
        return "PET ratio";
    }

    @Override
    public void apply(TileContext ctx) {
        ctx.petRatio = RatioComputer.ratio(ctx.pet, ctx.precip);
    }
}
