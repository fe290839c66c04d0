package com.worldgen.raster;

import com.worldgen.MapFixture;
import com.worldgen.exception.ErrorKind;
import com.worldgen.exception.MapLoadException;
import com.worldgen.model.scalar.Color;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ImageIoRasterDecoder.
 */
class ImageIoRasterDecoderTest {

    @TempDir
    Path dir;

    private final ImageIoRasterDecoder decoder = new ImageIoRasterDecoder();

    private Path writeImage(String format, String name) throws Exception {
        BufferedImage image = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, 0x0A141E);
        image.setRGB(2, 1, 0x28323C);
        Path file = dir.resolve(name);
        assertTrue(ImageIO.write(image, format, file.toFile()));
        return file;
    }

    @Test
    @DisplayName("should decode a bitmap into packed RGB values")
    void shouldDecodeBmp() throws Exception {
        RgbRaster raster = decoder.decode(writeImage("bmp", "provinces.bmp"));

        assertEquals(3, raster.width());
        assertEquals(2, raster.height());
        assertEquals(new Color(10, 20, 30), raster.colorAt(0, 0));
        assertEquals(0x28323C, raster.rgb(2, 1));
        assertEquals(0, raster.rgb(1, 0));
    }

    @Test
    @DisplayName("should decode other formats ImageIO understands")
    void shouldDecodePng() throws Exception {
        RgbRaster raster = decoder.decode(writeImage("png", "terrain.png"));

        assertEquals(new Color(40, 50, 60), raster.colorAt(2, 1));
    }

    @Test
    @DisplayName("a missing file should be an IO error")
    void shouldFailOnMissingFile() {
        Path missing = dir.resolve("rivers.bmp");

        MapLoadException ex = assertThrows(MapLoadException.class, () -> decoder.decode(missing));

        assertEquals(ErrorKind.IO, ex.getKind());
        assertEquals(missing, ex.getPath());
    }

    @Test
    @DisplayName("a file that is not an image should be an IO error")
    void shouldFailOnNonImage() {
        Path file = dir.resolve("heightmap.bmp");
        MapFixture.writeFile(file, "not an image");

        MapLoadException ex = assertThrows(MapLoadException.class, () -> decoder.decode(file));

        assertEquals(ErrorKind.IO, ex.getKind());
        assertEquals("Unsupported image format", ex.getDetail());
    }

    @Test
    @DisplayName("pixel access outside the raster should fail")
    void shouldRejectOutOfBounds() {
        RgbRaster raster = new RgbRaster(1, 1, new int[]{0});

        assertThrows(IndexOutOfBoundsException.class, () -> raster.rgb(1, 0));
        assertThrows(IllegalArgumentException.class, () -> new RgbRaster(2, 2, new int[3]));
    }
}
