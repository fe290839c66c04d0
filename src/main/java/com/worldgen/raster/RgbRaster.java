package com.worldgen.raster;

import com.worldgen.model.scalar.Color;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * A decoded bitmap: {@code width * height} packed {@code 0xRRGGBB} values, row by row
 * from the top-left corner. The pixel array is copied in and out, so a raster never
 * changes once built.
 */
public record RgbRaster(int width, int height, int[] pixels) {

    public RgbRaster {
        if (width < 0 || height < 0 || pixels.length != (long) width * height) {
            throw new IllegalArgumentException("Raster of " + width + "x" + height
                    + " cannot hold " + pixels.length + " pixels");
        }
        pixels = pixels.clone();
    }

    /**
     * A copy of the packed pixels. Use {@link #stream()} or {@link #rgb(int, int)} to read
     * without copying.
     */
    @Override
    public int[] pixels() {
        return pixels.clone();
    }

    public IntStream stream() {
        return Arrays.stream(pixels);
    }

    public int rgb(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return pixels[y * width + x];
    }

    public Color colorAt(int x, int y) {
        return Color.fromPacked(rgb(x, y));
    }

    public boolean sameSize(RgbRaster other) {
        return width == other.width && height == other.height;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RgbRaster other = (RgbRaster) o;
        return width == other.width && height == other.height && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "RgbRaster{" + width + "x" + height + "}";
    }
}
