package org.lifezone.core.model;

import static org.junit.Assert.*;

import org.lifezone.core.exception.ShapeMismatchException;
import org.junit.Test;

public class RasterTest {

    @Test
    public void testWindowReadWriteIsRowMajor() {
        IntRaster raster = new IntRaster(4, 3);
        GridWindow w = new GridWindow(1, 1, 2, 2);
        raster.writeWindow(w, new int[]{1, 2, 3, 4});

        assertEquals(0, raster.get(0, 0));
        assertEquals(1, raster.get(1, 1));
        assertEquals(2, raster.get(1, 2));
        assertEquals(3, raster.get(2, 1));
        assertEquals(4, raster.get(2, 2));
        assertArrayEquals(new int[]{1, 2, 3, 4}, raster.readWindow(w));
    }

    @Test
    public void testFloatWindowCopyIsDetached() {
        FloatRaster raster = FloatRaster.filled(3, 3, 5f);
        float[] local = raster.readWindow(new GridWindow(0, 0, 2, 2));
        local[0] = -1f;
        assertEquals(5f, raster.get(0, 0), 0f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWindowOutsideRasterRejected() {
        new MaskRaster(3, 3).readWindow(new GridWindow(2, 2, 2, 2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBufferLengthMustMatchWindow() {
        new IntRaster(3, 3).writeWindow(new GridWindow(0, 0, 2, 2), new int[3]);
    }

    @Test
    public void testShapeMismatchNamesTheRaster() {
        FloatRaster a = new FloatRaster(4, 3);
        FloatRaster b = new FloatRaster(3, 4);
        try {
            a.requireSameShape(b, "Precipitation");
            fail("Expected ShapeMismatchException");
        } catch (ShapeMismatchException e) {
            assertTrue(e.getMessage().startsWith("Precipitation raster is 3x4"));
        }
    }

    @Test
    public void testDistinctValuesSorted() {
        IntRaster raster = new IntRaster(3, 1, new int[]{24771, 0, 1});
        assertEquals("[0, 1, 24771]", raster.distinctValues().toString());
    }

    @Test
    public void testMaskCount() {
        MaskRaster mask = MaskRaster.none(2, 2);
        assertEquals(0, mask.countSet());
        mask.set(1, 0, true);
        assertTrue(mask.get(1, 0));
        assertEquals(1, mask.countSet());
    }
}
