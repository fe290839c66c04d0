package com.worldgen.loader;

import com.worldgen.MapFixture;
import com.worldgen.exception.ErrorKind;
import com.worldgen.exception.MapLoadException;
import com.worldgen.model.Buildings;
import com.worldgen.model.StateBuilding;
import com.worldgen.model.scalar.BuildingId;
import com.worldgen.model.scalar.ProvinceId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BuildingLoader.
 */
class BuildingLoaderTest {

    @TempDir
    Path dir;

    private BuildingLoader loader;
    private Path typesFile;
    private Path buildingsFile;

    @BeforeEach
    void setUp() {
        loader = new BuildingLoader();
        typesFile = dir.resolve("00_buildings.txt");
        buildingsFile = dir.resolve("buildings.txt");
        MapFixture.writeFile(typesFile, MapFixture.BUILDING_TYPES);
    }

    @Test
    @DisplayName("should load placements of declared types and floating harbors")
    void shouldLoadDeclaredPlacements() {
        MapFixture.writeFile(buildingsFile, MapFixture.BUILDINGS);

        Buildings buildings = loader.load(typesFile, buildingsFile);

        assertEquals(4, buildings.types().size());
        assertTrue(buildings.isDeclared(Buildings.FLOATING_HARBOR));
        assertEquals(4, buildings.buildings().size());
        StateBuilding naval = buildings.buildings().get(0);
        assertEquals(new BuildingId("naval_base"), naval.buildingId());
        assertEquals(-3.93, naval.rotation(), 1e-9);
        assertEquals(new ProvinceId(4), naval.adjacentSeaProvince());
        assertEquals(StateBuilding.NO_SEA_PROVINCE, buildings.buildings().get(2).adjacentSeaProvince());
    }

    @Test
    @DisplayName("placements of undeclared types should be dropped")
    void shouldDropUndeclaredTypes() {
        MapFixture.writeFile(buildingsFile, """
                1;naval_base;10.00;9.68;20.00;0.00;4
                1;castle;11.00;9.68;21.00;0.00;0
                """);

        Buildings buildings = loader.load(typesFile, buildingsFile);

        assertEquals(1, buildings.buildings().size());
        assertFalse(buildings.isDeclared(new BuildingId("castle")));
    }

    @Test
    @DisplayName("rows that do not decode should be skipped")
    void shouldSkipBadRows() {
        MapFixture.writeFile(buildingsFile, """
                1;bunker;11.00;9.68;21.00;0.00;0
                x;bunker;11.00;9.68;21.00;0.00;0
                1;bunker;11.00
                """);

        assertEquals(1, loader.load(typesFile, buildingsFile).buildings().size());
    }

    @Test
    @DisplayName("a repeated building type should be a validation error")
    void shouldRejectDuplicateType() {
        MapFixture.writeFile(typesFile, "buildings = { bunker = { } bunker = { } }");
        MapFixture.writeFile(buildingsFile, "");

        MapLoadException ex = assertThrows(MapLoadException.class, () -> loader.load(typesFile, buildingsFile));

        assertEquals(ErrorKind.VALIDATION, ex.getKind());
        assertEquals("Duplicate buildings type: bunker", ex.getDetail());
    }

    @Test
    @DisplayName("an empty types file should be a validation error")
    void shouldRejectEmptyTypesFile() {
        MapFixture.writeFile(typesFile, "");
        MapFixture.writeFile(buildingsFile, "");

        MapLoadException ex = assertThrows(MapLoadException.class, () -> loader.load(typesFile, buildingsFile));

        assertEquals(ErrorKind.VALIDATION, ex.getKind());
        assertEquals("Invalid buildings file", ex.getDetail());
    }
}
