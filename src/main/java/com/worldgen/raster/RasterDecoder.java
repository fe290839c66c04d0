package com.worldgen.raster;

import java.nio.file.Path;

/**
 * Turns a bitmap file into a grid of RGB values. Bitmap formats themselves are not this
 * project's concern; the assembly only needs the decoded grid.
 */
public interface RasterDecoder {

    /**
     * @throws com.worldgen.exception.MapLoadException of kind {@code IO} when the file is
     *                                                 missing or cannot be decoded
     */
    RgbRaster decode(Path path);
}
