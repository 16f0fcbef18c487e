package org.lifezone.core.model;

/**
 * Булева маска; true = ячейка помечена (например, no-data).
 */
public class MaskRaster extends Raster {

    private final boolean[] data;

    public MaskRaster(int width, int height) {
        this(width, height, new boolean[width * height]);
    }

    public MaskRaster(int width, int height, boolean[] data) {
        super(width, height);
        if (data.length != width * height) {
            throw new IllegalArgumentException("Data length " + data.length + " does not match " + width + "x" + height);
        }
        this.data = data;
    }

    /** Маска без помеченных ячеек. */
    public static MaskRaster none(int width, int height) {
        return new MaskRaster(width, height);
    }

    public boolean get(int row, int col) {
        return data[index(row, col)];
    }

    public void set(int row, int col, boolean value) {
        data[index(row, col)] = value;
    }

    public int countSet() {
        int n = 0;
        for (boolean b : data) {
            if (b) n++;
        }
        return n;
    }

    public boolean[] readWindow(GridWindow w) {
        requireInside(w);
        boolean[] out = new boolean[w.cellCount()];
        for (int r = 0; r < w.rows(); r++) {
            System.arraycopy(data, index(w.rowStart() + r, w.colStart()), out, r * w.cols(), w.cols());
        }
        return out;
    }
}
