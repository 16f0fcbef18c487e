package org.lifezone.core.exception;

import org.lifezone.core.model.GridWindow;

/**
 * Wraps any failure inside one tile; the whole run is aborted.
 */
public class TileFailureException extends LifeZoneException {

    private static final long serialVersionUID = 1L;

    private final transient GridWindow window;

    public TileFailureException(GridWindow window, Throwable cause) {
        super("Classification failed in tile " + window + ": " + cause.getMessage(), cause);
        this.window = window;
    }

    public GridWindow getWindow() {
        return window;
    }
}
