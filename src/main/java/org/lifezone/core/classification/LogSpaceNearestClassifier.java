package org.lifezone.core.classification;

import org.lifezone.core.model.HlzConstants;
import org.lifezone.core.model.ZoneDefinition;
import org.lifezone.core.model.ZoneTable;

import java.util.Arrays;

/**
 * Ближайший центр зоны в трёхмерном log2-пространстве
 * (биотемпература/0.75, осадки/62.5, PET-ratio/0.125).
 * <p>
 * Онлайн-поиск: для каждого центра по порядку считаем квадрат расстояния до всех ячеек
 * и обновляем текущий минимум только при строгом "меньше". Поэтому при точном равенстве
 * побеждает меньший индекс, а NaN никогда не становится минимумом.
 * Ячейка без конечного расстояния остаётся с индексом 0 (не определена).
 * <p>
 * Результат ячейки зависит только от её входов, так что разбиение на тайлы на него не влияет.
 */
public class LogSpaceNearestClassifier {

    public static final int UNDEFINED = 0;

    // centers[z] = {t, p, r} для индекса z+1
    private final double[][] centers;

    public LogSpaceNearestClassifier(ZoneTable table) {
        int n = table.searchLimit();
        this.centers = new double[n][];
        for (int i = 1; i <= n; i++) {
            ZoneDefinition z = table.row(i);
            centers[i - 1] = new double[]{
                    LogSpace.centerCoordinate(z.biotempEdge(), HlzConstants.BIOTEMP_NORM),
                    LogSpace.centerCoordinate(z.precipEdge(), HlzConstants.PRECIP_NORM),
                    LogSpace.centerCoordinate(z.petRatioEdge(), HlzConstants.PET_RATIO_NORM)
            };
        }
    }

    public int centerCount() {
        return centers.length;
    }

    /** Копия координат центра зоны (индекс с единицы). */
    public double[] center(int index) {
        return centers[index - 1].clone();
    }

    public static double[] coordinates(double biotemp, double precip, double petRatio) {
        return new double[]{
                LogSpace.coordinate(biotemp, HlzConstants.BIOTEMP_NORM),
                LogSpace.coordinate(precip, HlzConstants.PRECIP_NORM),
                LogSpace.coordinate(petRatio, HlzConstants.PET_RATIO_NORM)
        };
    }

    public double squaredDistance(int index, double t, double p, double r) {
        double[] c = centers[index - 1];
        double dt = t - c[0];
        double dp = p - c[1];
        double dr = r - c[2];
        return dt * dt + dp * dp + dr * dr;
    }

    /** Одна точка, уже в лог-координатах. */
    public int classifyPoint(double t, double p, double r) {
        double best = Double.POSITIVE_INFINITY;
        int bestIdx = UNDEFINED;
        for (int z = 1; z <= centers.length; z++) {
            double d = squaredDistance(z, t, p, r);
            if (d < best) {
                best = d;
                bestIdx = z;
            }
        }
        return bestIdx;
    }

    public int classify(float biotemp, float precip, float petRatio) {
        double[] c = coordinates(biotemp, precip, petRatio);
        return classifyPoint(c[0], c[1], c[2]);
    }

    /**
     * Буферы одного тайла одинаковой длины. Возвращает индекс зоны на ячейку (0 = не определена).
     */
    public int[] classify(float[] biotemp, float[] precip, float[] petRatio) {
        int n = biotemp.length;
        if (precip.length != n || petRatio.length != n) {
            throw new IllegalArgumentException("Buffer lengths differ: " + n + "/" + precip.length + "/" + petRatio.length);
        }

        double[] t = new double[n];
        double[] p = new double[n];
        double[] r = new double[n];
        for (int i = 0; i < n; i++) {
            t[i] = LogSpace.coordinate(biotemp[i], HlzConstants.BIOTEMP_NORM);
            p[i] = LogSpace.coordinate(precip[i], HlzConstants.PRECIP_NORM);
            r[i] = LogSpace.coordinate(petRatio[i], HlzConstants.PET_RATIO_NORM);
        }

        double[] minDist2 = new double[n];
        Arrays.fill(minDist2, Double.POSITIVE_INFINITY);
        int[] bestIdx = new int[n];

        for (int z = 0; z < centers.length; z++) {
            double ct = centers[z][0];
            double cp = centers[z][1];
            double cr = centers[z][2];
            int index = z + 1;
            for (int i = 0; i < n; i++) {
                double dt = t[i] - ct;
                double dp = p[i] - cp;
                double dr = r[i] - cr;
                double d = dt * dt + dp * dp + dr * dr;
                if (d < minDist2[i]) {
                    minDist2[i] = d;
                    bestIdx[i] = index;
                }
            }
        }
        return bestIdx;
    }
}
