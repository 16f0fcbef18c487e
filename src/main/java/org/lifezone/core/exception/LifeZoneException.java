package org.lifezone.core.exception;

/**
 * Base exception for classification failures.
 */
public class LifeZoneException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LifeZoneException(String message) {
        super(message);
    }

    public LifeZoneException(String message, Throwable cause) {
        super(message, cause);
    }
}
