package org.lifezone.core.classification.stages;

import org.lifezone.core.classification.ClassificationStage;
import org.lifezone.core.classification.StageId;
import org.lifezone.core.classification.SubtropicalDisambiguator;
import org.lifezone.core.classification.TileContext;

public class SubtropicalStage implements ClassificationStage {

    private final SubtropicalDisambiguator disambiguator;

    public SubtropicalStage(SubtropicalDisambiguator disambiguator) {
        this.disambiguator = disambiguator;
    }

    @Override
    public StageId id() {
        return StageId.SUBTROPICAL;
    }

    @Override
    public String name() {
        return "Subtropical split";
    }

    @Override
    public void apply(TileContext ctx) {
        ctx.vegClass = disambiguator.vegClasses(ctx.zoneIndex, ctx.biotemp);
    }
}
