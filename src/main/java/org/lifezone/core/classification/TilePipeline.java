package org.lifezone.core.classification;

import org.lifezone.core.classification.stages.AssemblyStage;
import org.lifezone.core.classification.stages.BandStage;
import org.lifezone.core.classification.stages.EcotoneStage;
import org.lifezone.core.classification.stages.MaskStage;
import org.lifezone.core.classification.stages.NearestZoneStage;
import org.lifezone.core.classification.stages.PetRatioStage;
import org.lifezone.core.classification.stages.SubtropicalStage;
import org.lifezone.core.exception.LifeZoneException;
import org.lifezone.core.model.ZoneTable;
import org.lifezone.core.model.config.ClassifierSettings;

import java.util.ArrayList;
import java.util.List;

/**
 * Чистая функция тайла: одни и те же стадии в фиксированном порядке.
 * Стадии без состояния, один экземпляр обслуживает все тайлы.
 */
public class TilePipeline {

    private final List<ClassificationStage> stages = new ArrayList<>();
    private final boolean enableValidation;
    private final StageListener listener;

    public TilePipeline(ZoneTable table, ClassifierSettings settings, StageListener listener) {
        this.enableValidation = settings.enableValidation;
        this.listener = (listener != null) ? listener : new LoggingStageListener();

        // Фиксируем порядок стадий
        stages.add(new PetRatioStage());
        stages.add(new NearestZoneStage(new LogSpaceNearestClassifier(table)));
        stages.add(new SubtropicalStage(new SubtropicalDisambiguator(table)));
        stages.add(new BandStage());
        stages.add(new EcotoneStage(new EcotoneDetector(settings.computeEcotones, table)));
        stages.add(new MaskStage(new MaskApplier(table)));
        stages.add(new AssemblyStage());
    }

    public List<StageId> stageIds() {
        List<StageId> ids = new ArrayList<>(stages.size());
        for (ClassificationStage s : stages) ids.add(s.id());
        return ids;
    }

    public void run(TileContext ctx) {
        for (ClassificationStage stage : stages) {
            long start = System.currentTimeMillis();
            listener.onStageStart(stage.id(), stage.name(), ctx.window);

            try {
                stage.apply(ctx);

                if (enableValidation) {
                    runValidation(stage.id(), ctx);
                }

            } catch (RuntimeException e) {
                throw new LifeZoneException("Classification failed at stage: " + stage.id() + " - " + stage.name(), e);
            } finally {
                long elapsed = System.currentTimeMillis() - start;
                listener.onStageEnd(stage.id(), stage.name(), ctx.window, elapsed);
            }
        }
    }

    private void runValidation(StageId id, TileContext ctx) {
        switch (id) {
            case PET_RATIO -> Validation.afterPetRatio(ctx);
            case NEAREST_ZONE -> Validation.afterNearestZone(ctx);
            case SUBTROPICAL -> Validation.afterSubtropical(ctx);
            case BANDS -> Validation.afterBands(ctx);
            case ECOTONES -> Validation.afterEcotones(ctx);
            case MASKS -> Validation.afterMasks(ctx);
            case ASSEMBLY -> Validation.afterAssembly(ctx);
        }
    }
}
