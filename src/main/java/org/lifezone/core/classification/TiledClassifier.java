package org.lifezone.core.classification;

import org.lifezone.core.exception.TileFailureException;
import org.lifezone.core.model.GridWindow;
import org.lifezone.core.model.IntRaster;
import org.lifezone.core.model.ZoneTable;
import org.lifezone.core.model.config.ClassifierSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/**
 * Режет сетку на тайлы, гоняет {@link TilePipeline} по каждому и пишет коды
 * в непересекающиеся окна заранее выделенного растра.
 * Результат побитно одинаков при любом размере тайла и любом параллелизме.
 * Ошибка любого тайла прерывает весь прогон.
 */
public class TiledClassifier {

    private static final Logger log = LoggerFactory.getLogger(TiledClassifier.class);

    private final ZoneTable table;
    private final ClassifierSettings settings;
    private final TilePipeline pipeline;

    public TiledClassifier(ZoneTable table, ClassifierSettings settings, StageListener listener) {
        this.table = table;
        this.settings = settings;
        this.pipeline = new TilePipeline(table, settings, listener);
    }

    public TiledClassifier(ZoneTable table, ClassifierSettings settings) {
        this(table, settings, new LoggingStageListener());
    }

    public ClassificationResult classify(ClassificationInputs inputs) {
        int width = inputs.width();
        int height = inputs.height();
        IntRaster codes = new IntRaster(width, height);

        List<GridWindow> windows = GridWindow.partition(width, height, settings.tileRows, settings.tileCols);
        ClassificationStats[] perTile = new ClassificationStats[windows.size()];

        long start = System.currentTimeMillis();
        log.info("Classifying {}x{} grid in {} tiles ({})", width, height, windows.size(), settings);

        forEachTile(windows.size(), i -> perTile[i] = runTile(windows.get(i), inputs, codes));

        ClassificationStats stats = new ClassificationStats(table.size());
        for (ClassificationStats s : perTile) {
            stats.merge(s);
        }
        log.info("Classification done in {} ms", System.currentTimeMillis() - start);
        return new ClassificationResult(codes, stats);
    }

    /** Чистая функция одного тайла; пишет только в своё окно. */
    ClassificationStats runTile(GridWindow window, ClassificationInputs inputs, IntRaster codes) {
        try {
            TileContext ctx = new TileContext(window, inputs, table, settings);
            pipeline.run(ctx);
            codes.writeWindow(window, ctx.codes);
            return ctx.stats;
        } catch (RuntimeException e) {
            throw new TileFailureException(window, e);
        }
    }

    private void forEachTile(int n, IntConsumer action) {
        if (settings.parallel && n > 1) {
            IntStream.range(0, n).parallel().forEach(action);
        } else {
            for (int i = 0; i < n; i++) action.accept(i);
        }
    }
}
