package org.lifezone.core.classification;

public enum StageId {
    PET_RATIO,
    NEAREST_ZONE,
    SUBTROPICAL,
    BANDS,
    ECOTONES,
    MASKS,
    ASSEMBLY
}
