package org.lifezone.core.classification.stages;

import org.lifezone.core.classification.BandDeriver;
import org.lifezone.core.classification.ClassificationStage;
import org.lifezone.core.classification.StageId;
import org.lifezone.core.classification.TileContext;

public class BandStage implements ClassificationStage {

    @Override
    public StageId id() {
        return StageId.BANDS;
    }

    @Override
    public String name() {
        return "Latitudinal/altitudinal bands";
    }

    @Override
    public void apply(TileContext ctx) {
        int n = ctx.cellCount();
        int[] lat = new int[n];
        int[] alt = new int[n];
        for (int i = 0; i < n; i++) {
            lat[i] = BandDeriver.latitudinalBand(ctx.seaLevelBiotemp[i]);
            alt[i] = BandDeriver.altitudinalBand(ctx.biotemp[i], ctx.seaLevelBiotemp[i]);
        }
        ctx.latBand = lat;
        ctx.altBand = alt;
    }
}
