package org.lifezone.core.classification;

import org.lifezone.core.model.GridWindow;
import org.lifezone.core.model.MaskOutcome;
import org.lifezone.core.model.ZoneTable;
import org.lifezone.core.model.config.ClassifierSettings;

/**
 * Контекст одного тайла (один тайл = один контекст).
 * Входы копируются из окна растров, промежуточные слои живут только здесь,
 * поэтому память ограничена размером тайла и между тайлами ничего не делится.
 * Буферы row-major внутри окна.
 */
public class TileContext {

    public final GridWindow window;
    public final ZoneTable table;
    public final ClassifierSettings settings;

    // входы окна
    public final float[] biotemp;
    public final float[] seaLevelBiotemp;
    public final float[] precip;
    public final float[] pet;
    public final boolean[] noData;

    /** Появляется после PET_RATIO. */
    public float[] petRatio;

    /** Индекс ближайшей зоны 1..searchLimit, 0 = не определён. После NEAREST_ZONE. */
    public int[] zoneIndex;

    /** Индекс после субтропического сдвига. */
    public int[] vegClass;

    public int[] latBand;
    public int[] altBand;
    public int[] ecotone;

    public MaskOutcome[] maskOutcome;

    /** Итоговые коды тайла. После ASSEMBLY. */
    public int[] codes;

    public final ClassificationStats stats;

    public TileContext(GridWindow window, ClassificationInputs inputs, ZoneTable table, ClassifierSettings settings) {
        this.window = window;
        this.table = table;
        this.settings = settings;
        this.biotemp = inputs.biotemperature().readWindow(window);
        this.seaLevelBiotemp = inputs.seaLevelBiotemperature().readWindow(window);
        this.precip = inputs.precipitation().readWindow(window);
        this.pet = inputs.pet().readWindow(window);
        this.noData = inputs.noData().readWindow(window);
        this.stats = new ClassificationStats(table.size());
        this.stats.tileCount = 1;
    }

    public int cellCount() {
        return biotemp.length;
    }

    /** Строка растра для локального индекса. */
    public int rowOf(int i) {
        return window.rowStart() + i / window.cols();
    }

    public int colOf(int i) {
        return window.colStart() + i % window.cols();
    }
}
