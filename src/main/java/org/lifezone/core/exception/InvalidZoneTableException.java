package org.lifezone.core.exception;

/**
 * Thrown when a zone table cannot back a classification run
 * (too few rows, bad edges, missing subtropical rows, short name list).
 */
public class InvalidZoneTableException extends LifeZoneException {

    private static final long serialVersionUID = 1L;

    public InvalidZoneTableException(String message) {
        super(message);
    }

    public InvalidZoneTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
