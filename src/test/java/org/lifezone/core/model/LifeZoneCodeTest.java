package org.lifezone.core.model;

import static org.junit.Assert.*;

import org.junit.Test;

public class LifeZoneCodeTest {

    @Test
    public void testFieldsOfTwoDigitVegClass() {
        LifeZoneCode f = LifeZoneCode.fromCode(39761);
        assertEquals(39, f.vegClass());
        assertEquals(7, f.altBand());
        assertEquals(6, f.latBand());
        assertEquals(1, f.ecotone());
        assertEquals(39761, f.toCode());
    }

    @Test
    public void testBandLabels() {
        assertEquals("subtropical", LatitudinalBand.fromCode(6).label);
        assertNull(LatitudinalBand.fromCode(0));
        assertEquals("", AltitudinalBand.BASAL.prefix());
        assertEquals("lower montane ", AltitudinalBand.fromCode(6).prefix());
        assertNull(Ecotone.fromCode(8));
    }
}
