package org.lifezone.core.climate;

import static org.junit.Assert.*;

import org.lifezone.core.model.FloatRaster;
import org.junit.Test;

public class HoldridgePetTest {

    @Test
    public void testPetIsLinearInBiotemperature() {
        assertEquals(589.3f, HoldridgePet.pet(10f), 1e-3f);
        assertEquals(0f, HoldridgePet.pet(0f), 0f);
    }

    @Test
    public void testRasterForm() {
        FloatRaster pet = HoldridgePet.fromBiotemperature(new FloatRaster(2, 1, new float[]{20f, Float.NaN}));
        assertEquals(1178.6f, pet.get(0, 0), 1e-2f);
        assertTrue(Float.isNaN(pet.get(0, 1)));
    }
}
