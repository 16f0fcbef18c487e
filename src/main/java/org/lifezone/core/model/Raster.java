package org.lifezone.core.model;

import org.lifezone.core.exception.ShapeMismatchException;

/**
 * Плотная сетка width x height, row-major.
 */
public abstract class Raster {

    public final int width;
    public final int height;

    protected Raster(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster dimensions must be positive: " + width + "x" + height);
        }
        if ((long) width * height > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Raster too large for a single array: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    public int cellCount() {
        return width * height;
    }

    public int index(int row, int col) {
        return row * width + col;
    }

    public boolean sameShape(Raster other) {
        return other != null && other.width == width && other.height == height;
    }

    public void requireSameShape(Raster other, String what) {
        if (other == null) {
            throw new ShapeMismatchException(what + " raster is missing");
        }
        if (!sameShape(other)) {
            throw new ShapeMismatchException(what + " raster is " + other.width + "x" + other.height
                    + ", expected " + width + "x" + height);
        }
    }

    protected void requireInside(GridWindow w) {
        if (w.rowEnd() > height || w.colEnd() > width) {
            throw new IllegalArgumentException("Window " + w + " is outside raster " + width + "x" + height);
        }
    }
}
