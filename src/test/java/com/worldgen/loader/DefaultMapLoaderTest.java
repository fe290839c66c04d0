package com.worldgen.loader;

import com.worldgen.MapFixture;
import com.worldgen.exception.ErrorKind;
import com.worldgen.exception.MapLoadException;
import com.worldgen.model.DefaultMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DefaultMapLoader.
 */
class DefaultMapLoaderTest {

    @TempDir
    Path dir;

    private final DefaultMapLoader loader = new DefaultMapLoader();

    @Test
    @DisplayName("should read the manifest and resolve assets next to it")
    void shouldLoadManifest() {
        Path manifest = MapFixture.write(dir);

        DefaultMap map = loader.load(manifest);

        assertEquals(manifest, map.manifest());
        assertEquals(dir.resolve("map"), map.directory());
        assertEquals(dir.resolve("map/definition.csv"), map.resolve(map.definitions()));
        assertEquals(List.of(3, 4, 7, 10), map.tree());
        assertTrue(map.climate().isEmpty());
    }

    @Test
    @DisplayName("a missing manifest should be an IO error")
    void shouldFailOnMissingManifest() {
        Path manifest = dir.resolve("map/default.map");

        MapLoadException ex = assertThrows(MapLoadException.class, () -> loader.load(manifest));

        assertEquals(ErrorKind.IO, ex.getKind());
        assertEquals(manifest, ex.getPath());
    }

    @Test
    @DisplayName("a manifest missing a required asset should be a decode error")
    void shouldRejectIncompleteManifest() {
        Path manifest = dir.resolve("default.map");
        MapFixture.writeFile(manifest, MapFixture.DEFAULT_MAP.replace("seasons = \"seasons.txt\"", ""));

        MapLoadException ex = assertThrows(MapLoadException.class, () -> loader.load(manifest));

        assertEquals(ErrorKind.DECODE, ex.getKind());
        assertTrue(ex.getDetail().contains("seasons"));
    }
}
