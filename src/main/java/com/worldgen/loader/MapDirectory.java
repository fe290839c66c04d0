package com.worldgen.loader;

import com.worldgen.exception.MapLoadException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Lists the regular files of a map directory in file-name order.
 */
final class MapDirectory {

    private MapDirectory() {
    }

    static List<Path> regularFiles(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw MapLoadException.fileNotFound(directory);
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.filter(Files::isRegularFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw MapLoadException.io(directory, "Unable to list directory", e);
        }
    }
}
