package org.lifezone.core.classification.stages;

import org.lifezone.core.classification.ClassificationStage;
import org.lifezone.core.classification.EcotoneDetector;
import org.lifezone.core.classification.StageId;
import org.lifezone.core.classification.TileContext;

public class EcotoneStage implements ClassificationStage {

    private final EcotoneDetector detector;

    public EcotoneStage(EcotoneDetector detector) {
        this.detector = detector;
    }

    @Override
    public StageId id() {
        return StageId.ECOTONES;
    }

    @Override
    public String name() {
        return detector.isEnabled() ? "Ecotones" : "Ecotones (disabled)";
    }

    @Override
    public void apply(TileContext ctx) {
        int n = ctx.cellCount();
        int[] eco = new int[n];
        for (int i = 0; i < n; i++) {
            eco[i] = detector.ecotone(ctx.vegClass[i], ctx.biotemp[i], ctx.precip[i], ctx.petRatio[i]);
        }
        ctx.ecotone = eco;
    }
}
