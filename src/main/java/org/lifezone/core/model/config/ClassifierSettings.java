package org.lifezone.core.model.config;

import java.util.Locale;
import java.util.Properties;

public class ClassifierSettings {

    public static final int DEFAULT_TILE_SIZE = 2048;

    public ClassificationVariant variant = ClassificationVariant.CLASSICAL;

    // Переходные зоны (экотоны); по умолчанию берётся из варианта
    public boolean computeEcotones = variant.computeEcotones;

    // Тайлы для ограничения памяти
    public int tileRows = DEFAULT_TILE_SIZE;
    public int tileCols = DEFAULT_TILE_SIZE;

    // Тайлы независимы, порядок обработки на результат не влияет
    public boolean parallel = true;

    // true: вырожденная ячейка (NaN вне маски no-data) прерывает прогон
    public boolean strictNumerics = false;

    public boolean enableValidation = true;

    public static ClassifierSettings defaults() {
        return new ClassifierSettings();
    }

    public static ClassifierSettings forVariant(ClassificationVariant variant) {
        ClassifierSettings s = new ClassifierSettings();
        s.setVariant(variant);
        return s;
    }

    public void setVariant(ClassificationVariant variant) {
        this.variant = variant;
        this.computeEcotones = variant.computeEcotones;
    }

    /** Ключи lifezone.*; пустые значения игнорируются. */
    public void apply(Properties props) {
        String v = pick(props.getProperty("lifezone.variant"));
        if (v != null) {
            setVariant(parseVariant(v));
        }
        computeEcotones = bool(props.getProperty("lifezone.ecotones"), computeEcotones);
        tileRows = positiveInt(props.getProperty("lifezone.tile.rows"), tileRows, "lifezone.tile.rows");
        tileCols = positiveInt(props.getProperty("lifezone.tile.cols"), tileCols, "lifezone.tile.cols");
        parallel = bool(props.getProperty("lifezone.parallel"), parallel);
        strictNumerics = bool(props.getProperty("lifezone.strict"), strictNumerics);
        enableValidation = bool(props.getProperty("lifezone.validation"), enableValidation);
    }

    public void applyOverridesFromSystem() {
        apply(System.getProperties());
    }

    private static ClassificationVariant parseVariant(String v) {
        String norm = v.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return ClassificationVariant.valueOf(norm);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown lifezone.variant: " + v, e);
        }
    }

    private static boolean bool(String raw, boolean fallback) {
        String v = pick(raw);
        return v == null ? fallback : Boolean.parseBoolean(v);
    }

    private static int positiveInt(String raw, int fallback, String key) {
        String v = pick(raw);
        if (v == null) return fallback;
        int parsed;
        try {
            parsed = Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + v, e);
        }
        if (parsed <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + parsed);
        }
        return parsed;
    }

    private static String pick(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public String toString() {
        return "variant=" + variant
                + " ecotones=" + computeEcotones
                + " tile=" + tileRows + "x" + tileCols
                + " parallel=" + parallel
                + " strict=" + strictNumerics
                + " validation=" + enableValidation;
    }
}
