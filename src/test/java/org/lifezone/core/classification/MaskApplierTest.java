package org.lifezone.core.classification;

import static org.junit.Assert.*;

import org.lifezone.core.io.ZoneTableLoader;
import org.lifezone.core.model.HlzConstants;
import org.lifezone.core.model.MaskOutcome;
import org.junit.Test;

public class MaskApplierTest {

    private final MaskApplier applier = new MaskApplier(ZoneTableLoader.loadDefault());

    @Test
    public void testPlainCell() {
        assertEquals(MaskOutcome.NONE, applier.resolve(20f, 1500f, 1.0f, 24, false));
    }

    @Test
    public void testColdCellIsPolarDesert() {
        assertEquals(MaskOutcome.POLAR_DESERT, applier.resolve(0.5f, 500f, 1.0f, 6, false));
        assertEquals(MaskOutcome.POLAR_DESERT, applier.resolve(1.5f, 500f, 1.0f, 6, false));
    }

    @Test
    public void testPolarRowIsPolarDesert() {
        assertEquals(MaskOutcome.POLAR_DESERT, applier.resolve(1.6f, 500f, 1.0f, 3, false));
        assertEquals(MaskOutcome.NONE, applier.resolve(1.6f, 500f, 1.0f, 5, false));
    }

    @Test
    public void testPolarBeatsOutOfBounds() {
        assertEquals(MaskOutcome.POLAR_DESERT, applier.resolve(0.5f, 50f, 40f, 2, false));
    }

    @Test
    public void testEnvelopeEdges() {
        assertEquals(MaskOutcome.OUT_OF_BOUNDS, applier.resolve(20f, 50f, 1f, 20, false));
        assertEquals(MaskOutcome.NONE, applier.resolve(20f, 62.5f, 1f, 20, false));
        assertEquals(MaskOutcome.OUT_OF_BOUNDS, applier.resolve(20f, 16000f, 1f, 26, false));
        assertEquals(MaskOutcome.OUT_OF_BOUNDS, applier.resolve(20f, 1500f, 0.1f, 26, false));
        assertEquals(MaskOutcome.NONE, applier.resolve(20f, 1500f, 0.125f, 26, false));
        assertEquals(MaskOutcome.OUT_OF_BOUNDS, applier.resolve(20f, 1500f, 32f, 20, false));
    }

    @Test
    public void testNoDataBeatsEverything() {
        assertEquals(MaskOutcome.NO_DATA, applier.resolve(0.5f, 50f, 40f, 2, true));
        assertEquals(MaskOutcome.NO_DATA, applier.resolve(Float.NaN, Float.NaN, Float.NaN, 0, true));
    }

    @Test
    public void testApplyRewritesPolarCells() {
        int[] veg = {24, 6, 20};
        int[] eco = {1, 4, 7};
        MaskOutcome[] out = applier.apply(
                new float[]{20f, 0.5f, 20f},
                new float[]{1500f, 500f, 50f},
                new float[]{1f, 1f, 1f},
                new int[]{24, 6, 20},
                new boolean[]{false, false, false},
                veg, eco);

        assertArrayEquals(new MaskOutcome[]{MaskOutcome.NONE, MaskOutcome.POLAR_DESERT, MaskOutcome.OUT_OF_BOUNDS}, out);
        assertArrayEquals(new int[]{24, HlzConstants.POLAR_DESERT_VEG_CLASS, 20}, veg);
        assertArrayEquals(new int[]{1, 0, 7}, eco);
    }
}
