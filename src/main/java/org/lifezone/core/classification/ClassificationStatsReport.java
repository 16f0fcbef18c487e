package org.lifezone.core.classification;

import org.lifezone.core.model.Ecotone;
import org.lifezone.core.model.ZoneTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

public class ClassificationStatsReport {

    private static final Logger log = LoggerFactory.getLogger(ClassificationStatsReport.class);

    public static void log(ClassificationStats s, ZoneTable table) {
        log.info("========= HLZ STATS =========");
        log.info("Cells: {} in {} tiles", s.cellCount, s.tileCount);
        log.info("No data: {} ({})", s.noDataCount, pct(s.noDataCount, s.cellCount));
        log.info("Out of bounds: {} ({})", s.outOfBoundsCount, pct(s.outOfBoundsCount, s.cellCount));
        log.info("Polar desert: {} ({})", s.polarDesertCount, pct(s.polarDesertCount, s.cellCount));
        if (s.degenerateCount > 0) {
            log.warn("Degenerate (NaN outside no-data mask, written as out of bounds): {}", s.degenerateCount);
        }

        if (log.isDebugEnabled()) {
            for (int v = 1; v < s.vegClassCounts.length; v++) {
                long count = s.vegClassCounts[v];
                if (count <= 0) continue;
                String name = table.contains(v) ? table.name(v) : "?";
                log.debug("  veg {} {} : {}", String.format(Locale.US, "%2d", v), pad(name), count);
            }
            for (Ecotone e : Ecotone.values()) {
                long count = s.ecotoneCounts[e.code];
                if (count <= 0) continue;
                log.debug("  ecotone {} {} : {}", e.code, pad(e.name()), count);
            }
        }
        log.info("=============================");
    }

    private static String pct(long part, long total) {
        if (total <= 0) return "0.000%";
        return String.format(Locale.US, "%.3f%%", 100.0 * part / total);
    }

    private static String pad(String s) {
        return String.format("%-18s", s);
    }
}
