package com.worldgen.raster;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RgbRaster.
 */
class RgbRasterTest {

    @Test
    @DisplayName("changing the source array should not change the raster")
    void shouldCopyPixelsIn() {
        int[] pixels = {1, 2, 3, 4};
        RgbRaster raster = new RgbRaster(2, 2, pixels);

        pixels[0] = 99;

        assertEquals(1, raster.rgb(0, 0));
    }

    @Test
    @DisplayName("changing the returned pixels should not change the raster")
    void shouldCopyPixelsOut() {
        RgbRaster raster = new RgbRaster(2, 2, new int[]{1, 2, 3, 4});

        raster.pixels()[1] = 77;

        assertEquals(2, raster.rgb(1, 0));
        assertEquals(10, raster.stream().sum());
    }

    @Test
    @DisplayName("rasters with the same size and pixels should be equal")
    void shouldCompareByContent() {
        RgbRaster raster = new RgbRaster(1, 1, new int[]{5});

        assertEquals(new RgbRaster(1, 1, new int[]{5}), raster);
        assertEquals(new RgbRaster(1, 1, new int[]{5}).hashCode(), raster.hashCode());
        assertNotEquals(new RgbRaster(1, 1, new int[]{6}), raster);
        assertNotEquals(new RgbRaster(2, 1, new int[]{5, 5}), new RgbRaster(1, 2, new int[]{5, 5}));
    }

    @Test
    @DisplayName("a size whose area overflows int should be rejected")
    void shouldRejectOverflowingSize() {
        assertThrows(IllegalArgumentException.class, () -> new RgbRaster(65_536, 65_536, new int[0]));
    }
}
