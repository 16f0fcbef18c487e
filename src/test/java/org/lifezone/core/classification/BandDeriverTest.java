package org.lifezone.core.classification;

import static org.junit.Assert.*;

import org.junit.Test;

public class BandDeriverTest {

    @Test
    public void testBandThresholds() {
        assertEquals(1, BandDeriver.band(-5.0));
        assertEquals(1, BandDeriver.band(1.49));
        assertEquals(2, BandDeriver.band(2.9));
        assertEquals(3, BandDeriver.band(3.0));
        assertEquals(4, BandDeriver.band(6.0));
        assertEquals(5, BandDeriver.band(12.0));
        assertEquals(5, BandDeriver.band(16.9));
        assertEquals(6, BandDeriver.band(17.0));
        assertEquals(7, BandDeriver.band(24.0));
        assertEquals(7, BandDeriver.band(40.0));
    }

    @Test
    public void testExactlyOnePointFiveIsSubpolar() {
        assertEquals(2, BandDeriver.band(1.5));
    }

    @Test
    public void testMonotone() {
        int prev = BandDeriver.band(-10.0);
        for (double t = -10.0; t <= 40.0; t += 0.01) {
            int b = BandDeriver.band(t);
            assertTrue("band dropped at " + t, b >= prev);
            prev = b;
        }
    }

    @Test
    public void testNaNIsUndefined() {
        assertEquals(BandDeriver.UNDEFINED, BandDeriver.band(Double.NaN));
        assertEquals(BandDeriver.UNDEFINED, BandDeriver.altitudinalBand(Float.NaN, 20f));
        assertEquals(BandDeriver.UNDEFINED, BandDeriver.altitudinalBand(20f, Float.NaN));
    }

    @Test
    public void testAltitudinalBand() {
        // высота не сдвинула пояс - базальный
        assertEquals(7, BandDeriver.altitudinalBand(25f, 26f));
        assertEquals(7, BandDeriver.altitudinalBand(20f, 20f));
        // тропики на уровне моря, бореальный пояс на высоте
        assertEquals(3, BandDeriver.altitudinalBand(4f, 26f));
        assertEquals(7, BandDeriver.latitudinalBand(26f));
    }
}
