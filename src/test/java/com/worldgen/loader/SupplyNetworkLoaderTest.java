package com.worldgen.loader;

import com.worldgen.MapFixture;
import com.worldgen.exception.ErrorKind;
import com.worldgen.exception.MapLoadException;
import com.worldgen.model.Railway;
import com.worldgen.model.Railways;
import com.worldgen.model.SupplyNodes;
import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.model.scalar.RailLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SupplyNetworkLoader.
 */
class SupplyNetworkLoaderTest {

    @TempDir
    Path dir;

    private SupplyNetworkLoader loader;

    @BeforeEach
    void setUp() {
        loader = new SupplyNetworkLoader();
    }

    @Nested
    @DisplayName("railways")
    class RailwayTests {

        @Test
        @DisplayName("should read level, length and provinces of each line")
        void shouldReadRailways() {
            Path file = dir.resolve("railways.txt");
            MapFixture.writeFile(file, "2 4 43 54 65 78\n\n1 2 7 8\n");

            Railways railways = loader.loadRailways(file);

            assertEquals(2, railways.size());
            Railway first = railways.railways().get(0);
            assertEquals(new RailLevel(2), first.level());
            assertEquals(4, first.length());
            assertEquals(List.of(new ProvinceId(43), new ProvinceId(54), new ProvinceId(65), new ProvinceId(78)),
                    first.provinces());
        }

        @Test
        @DisplayName("a line whose count does not match its provinces should fail the file")
        void shouldRejectCountMismatch() {
            Path file = dir.resolve("railways.txt");
            MapFixture.writeFile(file, "2 4 43 54 65 78\n2 3 43 54 65 78\n");

            MapLoadException ex = assertThrows(MapLoadException.class, () -> loader.loadRailways(file));

            assertEquals(ErrorKind.VALIDATION, ex.getKind());
            assertEquals(file, ex.getPath());
            assertTrue(ex.getDetail().startsWith("Line 2:"), ex.getDetail());
        }

        @Test
        @DisplayName("a non-numeric level should be a validation error")
        void shouldRejectBadLevel() {
            Path file = dir.resolve("railways.txt");
            MapFixture.writeFile(file, "x 1 43\n");

            assertEquals(ErrorKind.VALIDATION,
                    assertThrows(MapLoadException.class, () -> loader.loadRailways(file)).getKind());
        }
    }

    @Nested
    @DisplayName("supply nodes")
    class SupplyNodeTests {

        @Test
        @DisplayName("should collect the province of every line once")
        void shouldReadSupplyNodes() {
            Path file = dir.resolve("supply_nodes.txt");
            MapFixture.writeFile(file, "1 15116\n1 200\n1 15116\n");

            SupplyNodes nodes = loader.loadSupplyNodes(file);

            assertEquals(2, nodes.size());
            assertTrue(nodes.contains(new ProvinceId(15116)));
        }

        @Test
        @DisplayName("a line not starting with 1 should fail the file")
        void shouldRejectWrongSentinel() {
            Path file = dir.resolve("supply_nodes.txt");
            MapFixture.writeFile(file, "2 15116\n");

            MapLoadException ex = assertThrows(MapLoadException.class, () -> loader.loadSupplyNodes(file));

            assertEquals(ErrorKind.VALIDATION, ex.getKind());
            assertTrue(ex.getDetail().contains("Invalid supply node"));
        }

        @Test
        @DisplayName("a missing file should be an IO error")
        void shouldFailOnMissingFile() {
            assertEquals(ErrorKind.IO, assertThrows(MapLoadException.class,
                    () -> loader.loadSupplyNodes(dir.resolve("none.txt"))).getKind());
        }
    }
}
