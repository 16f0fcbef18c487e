package org.lifezone.core.service;

import org.lifezone.core.classification.ClassificationInputs;
import org.lifezone.core.classification.ClassificationResult;
import org.lifezone.core.classification.ClassificationStatsReport;
import org.lifezone.core.classification.CodeDecoder;
import org.lifezone.core.classification.StageListener;
import org.lifezone.core.classification.TiledClassifier;
import org.lifezone.core.climate.HoldridgePet;
import org.lifezone.core.io.ZoneTableLoader;
import org.lifezone.core.model.FloatRaster;
import org.lifezone.core.model.IntRaster;
import org.lifezone.core.model.MaskRaster;
import org.lifezone.core.model.ZoneTable;
import org.lifezone.core.model.config.ClassifierConfigLoader;
import org.lifezone.core.model.config.ClassifierSettings;

import java.util.Collection;
import java.util.SortedMap;

public class LifeZoneClassificationService {

    private final ZoneTable table;
    private final ClassifierSettings settings;
    private final TiledClassifier classifier;
    private final CodeDecoder decoder;

    public LifeZoneClassificationService(ZoneTable table, ClassifierSettings settings, StageListener listener) {
        this.table = table;
        this.settings = settings;
        this.classifier = new TiledClassifier(table, settings, listener);
        this.decoder = CodeDecoder.forTable(table);
    }

    public LifeZoneClassificationService(ZoneTable table, ClassifierSettings settings) {
        this(table, settings, null);
    }

    /**
     * Встроенная таблица зон и настройки из lifezone.properties + системных свойств.
     */
    public static LifeZoneClassificationService fromConfig() {
        return new LifeZoneClassificationService(ZoneTableLoader.loadDefault(), ClassifierConfigLoader.load());
    }

    public ClassificationResult classify(ClassificationInputs inputs) {
        ClassificationResult result = classifier.classify(inputs);
        ClassificationStatsReport.log(result.stats(), table);
        return result;
    }

    /**
     * Классический вариант: PET считается из биотемпературы по Холдриджу.
     */
    public ClassificationResult classifyClassical(FloatRaster biotemp, FloatRaster seaLevelBiotemp,
                                                  FloatRaster precip, MaskRaster noData) {
        FloatRaster pet = HoldridgePet.fromBiotemperature(biotemp);
        return classify(new ClassificationInputs(biotemp, seaLevelBiotemp, precip, pet, noData));
    }

    public String decode(int code) {
        return decoder.decode(code);
    }

    public SortedMap<Integer, String> codeTable(Collection<Integer> distinctCodes) {
        return decoder.decodeAll(distinctCodes);
    }

    public SortedMap<Integer, String> codeTable(IntRaster codes) {
        return decoder.decodeAll(codes.distinctValues());
    }

    public ZoneTable table() {
        return table;
    }

    public ClassifierSettings settings() {
        return settings;
    }
}
