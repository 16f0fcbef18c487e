package org.lifezone.core.classification;

import org.lifezone.core.model.IntRaster;

/**
 * Растр кодов и счётчики прогона.
 */
public record ClassificationResult(IntRaster codes, ClassificationStats stats) {
}
