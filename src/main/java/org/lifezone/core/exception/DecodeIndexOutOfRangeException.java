package org.lifezone.core.exception;

/**
 * Thrown when a code references a veg class, band or ecotone the decoder has no name for.
 */
public class DecodeIndexOutOfRangeException extends LifeZoneException {

    private static final long serialVersionUID = 1L;

    private final int code;

    public DecodeIndexOutOfRangeException(int code, String message) {
        super("Cannot decode code " + code + ": " + message);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
