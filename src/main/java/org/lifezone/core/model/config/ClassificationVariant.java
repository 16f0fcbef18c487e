package org.lifezone.core.model.config;

/**
 * CLASSICAL: PET по Холдриджу (58.93 * биотемпература), с переходными зонами.
 * PENMAN_MONTEITH: внешний растр PET, шестиугольник без разделения на ядро/переход.
 */
public enum ClassificationVariant {
    CLASSICAL(true),
    PENMAN_MONTEITH(false);

    public final boolean computeEcotones;

    ClassificationVariant(boolean computeEcotones) {
        this.computeEcotones = computeEcotones;
    }
}
