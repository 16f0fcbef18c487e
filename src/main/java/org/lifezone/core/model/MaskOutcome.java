package org.lifezone.core.model;

/**
 * Итог применения масок к ячейке.
 */
public enum MaskOutcome {
    NONE,
    POLAR_DESERT,
    OUT_OF_BOUNDS,
    NO_DATA
}
