package com.worldgen.loader;

import com.worldgen.MapFixture;
import com.worldgen.exception.ErrorKind;
import com.worldgen.exception.MapLoadException;
import com.worldgen.model.Airports;
import com.worldgen.model.RocketSites;
import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.model.scalar.StateId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StateProvinceMapLoader.
 */
class StateProvinceMapLoaderTest {

    @TempDir
    Path dir;

    private StateProvinceMapLoader loader;

    @BeforeEach
    void setUp() {
        loader = new StateProvinceMapLoader();
    }

    @Test
    @DisplayName("should map each state to its airport provinces")
    void shouldLoadAirports() {
        Path file = dir.resolve("airports.txt");
        MapFixture.writeFile(file, "1 = { 2 }\n\n2 = { 6 9 }\n");

        Airports airports = loader.loadAirports(file);

        assertEquals(List.of(new ProvinceId(2)), airports.of(new StateId(1)));
        assertEquals(List.of(new ProvinceId(6), new ProvinceId(9)), airports.of(new StateId(2)));
        assertTrue(airports.of(new StateId(3)).isEmpty());
    }

    @Test
    @DisplayName("a later line for the same state should replace the earlier one")
    void shouldReplaceRepeatedState() {
        Path file = dir.resolve("rocketsites.txt");
        MapFixture.writeFile(file, "1 = { 1 }\n1 = { 3 }\n");

        RocketSites sites = loader.loadRocketSites(file);

        assertEquals(List.of(new ProvinceId(3)), sites.of(new StateId(1)));
    }

    @Test
    @DisplayName("a malformed line should fail the file")
    void shouldRejectMalformedLine() {
        Path file = dir.resolve("airports.txt");
        MapFixture.writeFile(file, "1 = { 2 }\n2 = { 6\n");

        MapLoadException ex = assertThrows(MapLoadException.class, () -> loader.loadAirports(file));

        assertEquals(file, ex.getPath());
        assertTrue(ex.getDetail().startsWith("Line 2:"), ex.getDetail());
    }

    @Test
    @DisplayName("a non-numeric province should be a format error")
    void shouldRejectBadProvince() {
        Path file = dir.resolve("airports.txt");
        MapFixture.writeFile(file, "1 = { abc }\n");

        assertEquals(ErrorKind.FORMAT,
                assertThrows(MapLoadException.class, () -> loader.loadAirports(file)).getKind());
    }
}
