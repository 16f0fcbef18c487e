package org.lifezone.core.classification;

import static org.junit.Assert.*;

import org.lifezone.core.model.MaskOutcome;
import org.junit.Test;

public class CodeAssemblerTest {

    @Test
    public void testPack() {
        assertEquals(39761, CodeAssembler.pack(39, 7, 6, 1));
        assertEquals(31771, CodeAssembler.pack(31, 7, 7, 1));
        assertEquals(3710, CodeAssembler.pack(3, 7, 1, 0));
    }

    @Test
    public void testSentinelsOverrideFields() {
        assertEquals(0, CodeAssembler.assemble(24, 7, 5, 1, MaskOutcome.NO_DATA));
        assertEquals(1, CodeAssembler.assemble(24, 7, 5, 1, MaskOutcome.OUT_OF_BOUNDS));
        assertEquals(3710, CodeAssembler.assemble(3, 7, 1, 0, MaskOutcome.POLAR_DESERT));
        assertTrue(CodeAssembler.isSentinel(0));
        assertTrue(CodeAssembler.isSentinel(1));
        assertFalse(CodeAssembler.isSentinel(3710));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBandZeroRejected() {
        CodeAssembler.pack(24, 0, 5, 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEcotoneEightRejected() {
        CodeAssembler.pack(24, 7, 5, 8);
    }
}
