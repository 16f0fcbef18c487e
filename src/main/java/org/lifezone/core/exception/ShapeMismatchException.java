package org.lifezone.core.exception;

/**
 * Thrown when rasters of one run have different dimensions.
 */
public class ShapeMismatchException extends LifeZoneException {

    private static final long serialVersionUID = 1L;

    public ShapeMismatchException(String message) {
        super(message);
    }
}
