package org.lifezone.core.classification;

import org.lifezone.core.model.GridWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Стадии идут на каждый тайл, поэтому только debug.
 */
public class LoggingStageListener implements StageListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingStageListener.class);

    @Override
    public void onStageStart(StageId id, String name, GridWindow window) {
        log.debug("[STAGE START] {} - {} {}", id, name, window);
    }

    @Override
    public void onStageEnd(StageId id, String name, GridWindow window, long elapsedMs) {
        log.debug("[STAGE END]   {} - {} {} ({} ms)", id, name, window, elapsedMs);
    }
}
