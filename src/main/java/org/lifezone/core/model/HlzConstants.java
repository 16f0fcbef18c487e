package org.lifezone.core.model;

/**
 * Константы модели Холдриджа.
 */
public final class HlzConstants {

    private HlzConstants() {}

    // Нормировка осей лог-пространства (масштаб исходного шестиугольника Холдриджа)
    public static final double BIOTEMP_NORM = 0.75;
    public static final double PRECIP_NORM = 62.5;
    public static final double PET_RATIO_NORM = 0.125;

    // Огибающая модели
    public static final double MIN_PRECIP = 62.5;       // мм/год
    public static final double MAX_PRECIP = 16000.0;    // мм/год, исключительно
    public static final double MIN_PET_RATIO = 0.125;
    public static final double MAX_PET_RATIO = 32.0;    // исключительно
    public static final double POLAR_BIOTEMP = 1.5;     // °C, полярная/нивальная пустыня

    /** Нижняя граница тёплого умеренного пояса, °C. */
    public static final double WARM_TEMPERATE_BIOTEMP = 12.0;
    public static final double TROPICAL_BIOTEMP = 24.0;

    /** Линия заморозков: середина 12 и 24 в log2, ≈16.97 °C. */
    public static final double FROST_LINE = Math.pow(2.0, Math.log(WARM_TEMPERATE_BIOTEMP) / Math.log(2.0) + 0.5);

    public static final int NO_DATA_CODE = 0;
    public static final int OUT_OF_BOUNDS_CODE = 1;

    /** Индекс veg class для полярной пустыни (не код). */
    public static final int POLAR_DESERT_VEG_CLASS = 3;

    /** Минимум строк, участвующих в поиске ближайшего центра (до тропического дождевого леса). */
    public static final int MIN_SEARCH_ROWS = 34;

    /** PET по Холдриджу, мм на °C биотемпературы. */
    public static final double HOLDRIDGE_PET_FACTOR = 58.93;
}
