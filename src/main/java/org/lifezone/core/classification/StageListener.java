package org.lifezone.core.classification;

import org.lifezone.core.model.GridWindow;

public interface StageListener {
    void onStageStart(StageId id, String name, GridWindow window);
    void onStageEnd(StageId id, String name, GridWindow window, long elapsedMs);
}
