package org.lifezone.core.classification;

import static org.junit.Assert.*;

import org.junit.Test;

public class LogSpaceTest {

    @Test
    public void testPowersOfTwoAreExact() {
        assertEquals(4.0, LogSpace.log2(16.0), 0.0);
        assertEquals(-3.0, LogSpace.log2(0.125), 0.0);
        assertEquals(4.0, LogSpace.coordinate(1000.0, 62.5), 0.0);
        assertEquals(4.5, LogSpace.centerCoordinate(12.0, 0.75), 0.0);
    }

    @Test
    public void testCenterIsGeometricMidpoint() {
        assertEquals(12.0 * Math.sqrt(2.0), LogSpace.center(12.0), 1e-9);
    }

    @Test
    public void testNonPositiveValues() {
        assertEquals(Double.NEGATIVE_INFINITY, LogSpace.log2(0.0), 0.0);
        assertTrue(Double.isNaN(LogSpace.log2(-1.0)));
    }
}
