package org.lifezone.core.model;

import java.util.Arrays;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Целочисленный растр: коды классификации, индексы зон, пояса.
 */
public class IntRaster extends Raster {

    private final int[] data;

    public IntRaster(int width, int height) {
        this(width, height, new int[width * height]);
    }

    public IntRaster(int width, int height, int[] data) {
        super(width, height);
        if (data.length != width * height) {
            throw new IllegalArgumentException("Data length " + data.length + " does not match " + width + "x" + height);
        }
        this.data = data;
    }

    public int get(int row, int col) {
        return data[index(row, col)];
    }

    public void set(int row, int col, int value) {
        data[index(row, col)] = value;
    }

    public int[] readWindow(GridWindow w) {
        requireInside(w);
        int[] out = new int[w.cellCount()];
        for (int r = 0; r < w.rows(); r++) {
            System.arraycopy(data, index(w.rowStart() + r, w.colStart()), out, r * w.cols(), w.cols());
        }
        return out;
    }

    /**
     * Пишет локальный буфер тайла в его окно. Окна разных тайлов не пересекаются,
     * поэтому параллельная запись без блокировок безопасна.
     */
    public void writeWindow(GridWindow w, int[] local) {
        requireInside(w);
        if (local.length != w.cellCount()) {
            throw new IllegalArgumentException("Buffer length " + local.length + " does not match window " + w);
        }
        for (int r = 0; r < w.rows(); r++) {
            System.arraycopy(local, r * w.cols(), data, index(w.rowStart() + r, w.colStart()), w.cols());
        }
    }

    public SortedSet<Integer> distinctValues() {
        SortedSet<Integer> out = new TreeSet<>();
        for (int v : data) out.add(v);
        return out;
    }

    public boolean contentEquals(IntRaster other) {
        return sameShape(other) && Arrays.equals(data, other.data);
    }
}
