package org.lifezone.core.classification;

public final class Validation {

    private Validation() {}

    public static void afterPetRatio(TileContext ctx) {
        requireLength(ctx.petRatio, ctx, "petRatio");
    }

    public static void afterNearestZone(TileContext ctx) {
        requireLength(ctx.zoneIndex, ctx, "zoneIndex");
        int limit = ctx.table.searchLimit();
        for (int i = 0; i < ctx.zoneIndex.length; i++) {
            int z = ctx.zoneIndex[i];
            if (z < 0 || z > limit) {
                throw new IllegalStateException("Zone index out of range at row=" + ctx.rowOf(i)
                        + " col=" + ctx.colOf(i) + " index=" + z + " limit=" + limit);
            }
        }
    }

    public static void afterSubtropical(TileContext ctx) {
        requireLength(ctx.vegClass, ctx, "vegClass");
        for (int i = 0; i < ctx.vegClass.length; i++) {
            int v = ctx.vegClass[i];
            if (v != 0 && !ctx.table.contains(v)) {
                throw new IllegalStateException("Veg class outside zone table at row=" + ctx.rowOf(i)
                        + " col=" + ctx.colOf(i) + " vegClass=" + v);
            }
        }
    }

    public static void afterBands(TileContext ctx) {
        requireLength(ctx.latBand, ctx, "latBand");
        requireLength(ctx.altBand, ctx, "altBand");
        for (int i = 0; i < ctx.latBand.length; i++) {
            // 0 = не определён (NaN), разбирается при сборке
            if (ctx.latBand[i] < 0 || ctx.latBand[i] > 7 || ctx.altBand[i] < 0 || ctx.altBand[i] > 7) {
                throw new IllegalStateException("Band out of range at row=" + ctx.rowOf(i) + " col=" + ctx.colOf(i)
                        + " lat=" + ctx.latBand[i] + " alt=" + ctx.altBand[i]);
            }
        }
    }

    public static void afterEcotones(TileContext ctx) {
        requireLength(ctx.ecotone, ctx, "ecotone");
        boolean enabled = ctx.settings.computeEcotones;
        for (int i = 0; i < ctx.ecotone.length; i++) {
            int e = ctx.ecotone[i];
            if (e < 0 || e > 7 || (!enabled && e != 0)) {
                throw new IllegalStateException("Unexpected ecotone at row=" + ctx.rowOf(i) + " col=" + ctx.colOf(i)
                        + " ecotone=" + e + " enabled=" + enabled);
            }
        }
    }

    public static void afterMasks(TileContext ctx) {
        if (ctx.maskOutcome == null || ctx.maskOutcome.length != ctx.cellCount()) {
            throw new IllegalStateException("maskOutcome not initialized for tile " + ctx.window);
        }
    }

    public static void afterAssembly(TileContext ctx) {
        requireLength(ctx.codes, ctx, "codes");
        for (int i = 0; i < ctx.codes.length; i++) {
            if (ctx.codes[i] < 0) {
                throw new IllegalStateException("Negative code at row=" + ctx.rowOf(i) + " col=" + ctx.colOf(i));
            }
            if (ctx.noData[i] && ctx.codes[i] != 0) {
                throw new IllegalStateException("No-data cell got code " + ctx.codes[i] + " at row=" + ctx.rowOf(i)
                        + " col=" + ctx.colOf(i));
            }
        }
    }

    private static void requireLength(Object buffer, TileContext ctx, String what) {
        int len;
        if (buffer instanceof int[] a) {
            len = a.length;
        } else if (buffer instanceof float[] a) {
            len = a.length;
        } else {
            throw new IllegalStateException(what + " not initialized for tile " + ctx.window);
        }
        if (len != ctx.cellCount()) {
            throw new IllegalStateException(what + " has " + len + " cells, tile " + ctx.window + " has " + ctx.cellCount());
        }
    }
}
