package org.lifezone.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Прямоугольное окно растра (тайл обработки). Строки/колонки от нуля.
 */
public record GridWindow(int rowStart, int colStart, int rows, int cols) {

    public GridWindow {
        if (rowStart < 0 || colStart < 0 || rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Bad window: row=" + rowStart + " col=" + colStart
                    + " rows=" + rows + " cols=" + cols);
        }
    }

    public static GridWindow full(int width, int height) {
        return new GridWindow(0, 0, height, width);
    }

    public int cellCount() {
        return rows * cols;
    }

    public int rowEnd() {
        return rowStart + rows;
    }

    public int colEnd() {
        return colStart + cols;
    }

    /**
     * Режет сетку width x height на непересекающиеся окна tileRows x tileCols.
     * Крайние окна могут быть меньше.
     */
    public static List<GridWindow> partition(int width, int height, int tileRows, int tileCols) {
        if (tileRows <= 0 || tileCols <= 0) {
            throw new IllegalArgumentException("Tile size must be positive: " + tileRows + "x" + tileCols);
        }
        List<GridWindow> out = new ArrayList<>();
        for (int r = 0; r < height; r += tileRows) {
            int rows = Math.min(tileRows, height - r);
            for (int c = 0; c < width; c += tileCols) {
                int cols = Math.min(tileCols, width - c);
                out.add(new GridWindow(r, c, rows, cols));
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "[rows " + rowStart + ".." + (rowEnd() - 1) + ", cols " + colStart + ".." + (colEnd() - 1) + "]";
    }
}
