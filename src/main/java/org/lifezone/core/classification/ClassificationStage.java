package org.lifezone.core.classification;

public interface ClassificationStage {
    StageId id();
    String name();
    void apply(TileContext ctx);
}
