package org.lifezone.core.classification.stages;

import org.lifezone.core.classification.ClassificationStage;
import org.lifezone.core.classification.LogSpaceNearestClassifier;
import org.lifezone.core.classification.StageId;
import org.lifezone.core.classification.TileContext;

public class NearestZoneStage implements ClassificationStage {

    private final LogSpaceNearestClassifier classifier;

    public NearestZoneStage(LogSpaceNearestClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public StageId id() {
        return StageId.NEAREST_ZONE;
    }

    @Override
    public String name() {
        return "Nearest zone";
    }

    @Override
    public void apply(TileContext ctx) {
        ctx.zoneIndex = classifier.classify(ctx.biotemp, ctx.precip, ctx.petRatio);
    }
}
