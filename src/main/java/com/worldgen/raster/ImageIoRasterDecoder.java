package com.worldgen.raster;

import com.worldgen.exception.MapLoadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decodes bitmaps with {@link ImageIO}, which reads the BMP files maps ship with.
 */
@Component
@Slf4j
public class ImageIoRasterDecoder implements RasterDecoder {

    @Override
    public RgbRaster decode(Path path) {
        if (!Files.isRegularFile(path)) {
            throw MapLoadException.fileNotFound(path);
        }
        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException e) {
            throw MapLoadException.io(path, "Unable to decode image", e);
        }
        if (image == null) {
            throw MapLoadException.io(path, "Unsupported image format", null);
        }
        int width = image.getWidth();
        int height = image.getHeight();
        int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] &= 0xFFFFFF;
        }
        log.debug("Decoded {}x{} raster from {}", width, height, path);
        return new RgbRaster(width, height, pixels);
    }
}
