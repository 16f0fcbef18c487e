package org.lifezone.core.model;

import java.util.Arrays;

/**
 * Климатическая поверхность (float32): биотемпература, осадки, PET.
 */
public class FloatRaster extends Raster {

    private final float[] data;

    public FloatRaster(int width, int height) {
        this(width, height, new float[width * height]);
    }

    public FloatRaster(int width, int height, float[] data) {
        super(width, height);
        if (data.length != width * height) {
            throw new IllegalArgumentException("Data length " + data.length + " does not match " + width + "x" + height);
        }
        this.data = data;
    }

    public static FloatRaster filled(int width, int height, float value) {
        float[] d = new float[width * height];
        Arrays.fill(d, value);
        return new FloatRaster(width, height, d);
    }

    public float get(int row, int col) {
        return data[index(row, col)];
    }

    public void set(int row, int col, float value) {
        data[index(row, col)] = value;
    }

    public float getAt(int index) {
        return data[index];
    }

    public void setAt(int index, float value) {
        data[index] = value;
    }

    /** Копия окна в локальный буфер (row-major внутри окна). */
    public float[] readWindow(GridWindow w) {
        requireInside(w);
        float[] out = new float[w.cellCount()];
        for (int r = 0; r < w.rows(); r++) {
            System.arraycopy(data, index(w.rowStart() + r, w.colStart()), out, r * w.cols(), w.cols());
        }
        return out;
    }
}
