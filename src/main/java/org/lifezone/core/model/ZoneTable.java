package org.lifezone.core.model;

import org.lifezone.core.exception.InvalidZoneTableException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Неизменяемая таблица зон Холдриджа.
 * <p>
 * Служебные строки (граница поиска, тёплый умеренный пояс, полярные шестиугольники)
 * определяются один раз при создании по значениям рёбер, а не по номерам строк:
 * <ul>
 *   <li>граница поиска - последняя строка префикса с неубывающим ребром биотемпературы
 *       (тропический дождевой лес);</li>
 *   <li>тёплый умеренный пояс - строки префикса с ребром биотемпературы 12 °C
 *       (пустыня ... дождевой лес);</li>
 *   <li>субтропические строки идут сразу за границей поиска в том же порядке;</li>
 *   <li>полярные строки - минимальное ребро биотемпературы и осадки внутри огибающей.</li>
 * </ul>
 */
public final class ZoneTable {

    private final List<ZoneDefinition> rows;
    private final int searchLimit;
    private final int warmTemperateDesert;
    private final int warmTemperateRainForest;
    private final int subtropicalOffset;
    private final boolean[] polarRow;

    public ZoneTable(List<ZoneDefinition> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new InvalidZoneTableException("Zone table is empty");
        }
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));

        for (int i = 0; i < this.rows.size(); i++) {
            ZoneDefinition z = this.rows.get(i);
            if (z.index() != i + 1) {
                throw new InvalidZoneTableException("Row " + (i + 1) + " has index " + z.index() + ", indices must be 1..n in order");
            }
            requireEdge(z, "biotemperature", z.biotempEdge());
            requireEdge(z, "precipitation", z.precipEdge());
            requireEdge(z, "PET ratio", z.petRatioEdge());
            if (z.name() == null) {
                throw new InvalidZoneTableException("Row " + z.index() + " has no name");
            }
        }

        int limit = 1;
        while (limit < this.rows.size()
                && this.rows.get(limit).biotempEdge() >= this.rows.get(limit - 1).biotempEdge()) {
            limit++;
        }
        if (limit < HlzConstants.MIN_SEARCH_ROWS) {
            throw new InvalidZoneTableException("Zone table has " + limit + " usable rows before the subtropical block, need at least "
                    + HlzConstants.MIN_SEARCH_ROWS);
        }
        this.searchLimit = limit;

        int desert = -1;
        int rainForest = -1;
        for (int i = 1; i <= searchLimit; i++) {
            if (row(i).biotempEdge() == HlzConstants.WARM_TEMPERATE_BIOTEMP) {
                if (desert < 0) desert = i;
                rainForest = i;
            }
        }
        if (desert < 0) {
            throw new InvalidZoneTableException("No warm temperate rows (biotemperature edge "
                    + HlzConstants.WARM_TEMPERATE_BIOTEMP + ") in zone table");
        }
        this.warmTemperateDesert = desert;
        this.warmTemperateRainForest = rainForest;
        this.subtropicalOffset = searchLimit + 1 - desert;

        int needed = rainForest + subtropicalOffset;
        if (this.rows.size() < needed) {
            throw new InvalidZoneTableException("Zone table has " + this.rows.size() + " rows, subtropical zones need "
                    + needed);
        }
        if (HlzConstants.POLAR_DESERT_VEG_CLASS > this.rows.size()) {
            throw new InvalidZoneTableException("Polar desert veg class " + HlzConstants.POLAR_DESERT_VEG_CLASS
                    + " is outside the table");
        }

        double minBiotemp = row(1).biotempEdge();
        this.polarRow = new boolean[searchLimit + 1];
        for (int i = 1; i <= searchLimit; i++) {
            ZoneDefinition z = row(i);
            polarRow[i] = z.biotempEdge() == minBiotemp && z.precipEdge() >= HlzConstants.MIN_PRECIP;
        }
    }

    /**
     * Таблица из рёбер и отдельного списка имён (veg class -> имя).
     * Имён должно быть не меньше, чем строк.
     */
    public static ZoneTable fromEdges(List<double[]> edges, List<String> names) {
        if (names == null || names.size() < edges.size()) {
            throw new InvalidZoneTableException("Name table has " + (names == null ? 0 : names.size())
                    + " entries, zone table references " + edges.size() + " veg classes");
        }
        List<ZoneDefinition> rows = new ArrayList<>(edges.size());
        for (int i = 0; i < edges.size(); i++) {
            double[] e = edges.get(i);
            if (e == null || e.length != 3) {
                throw new InvalidZoneTableException("Row " + (i + 1) + " must have exactly 3 edges");
            }
            rows.add(new ZoneDefinition(i + 1, e[0], e[1], e[2], names.get(i)));
        }
        return new ZoneTable(rows);
    }

    private static void requireEdge(ZoneDefinition z, String axis, double v) {
        if (!(v > 0) || Double.isInfinite(v)) {
            throw new InvalidZoneTableException("Row " + z.index() + " has invalid " + axis + " edge " + v);
        }
    }

    /** Строка по veg class (с единицы). */
    public ZoneDefinition row(int index) {
        return rows.get(index - 1);
    }

    public List<ZoneDefinition> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean contains(int index) {
        return index >= 1 && index <= rows.size();
    }

    public String name(int index) {
        return row(index).name();
    }

    public List<String> names() {
        List<String> out = new ArrayList<>(rows.size());
        for (ZoneDefinition z : rows) out.add(z.name());
        return out;
    }

    /** Последний индекс, участвующий в поиске ближайшего центра. */
    public int searchLimit() {
        return searchLimit;
    }

    public int warmTemperateDesertIndex() {
        return warmTemperateDesert;
    }

    public int warmTemperateRainForestIndex() {
        return warmTemperateRainForest;
    }

    public int subtropicalOffset() {
        return subtropicalOffset;
    }

    public boolean isPolarRow(int index) {
        return index >= 1 && index <= searchLimit && polarRow[index];
    }
}
