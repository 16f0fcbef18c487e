package org.lifezone.core.exception;

/**
 * Thrown in strict mode when a cell outside the no-data mask has no defined
 * zone or band (NaN/Inf coordinates).
 */
public class NumericDegeneracyException extends LifeZoneException {

    private static final long serialVersionUID = 1L;

    private final int row;
    private final int col;

    public NumericDegeneracyException(int row, int col, String reason) {
        super("Undefined classification at row=" + row + " col=" + col + ": " + reason);
        this.row = row;
        this.col = col;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }
}
