package com.worldgen.config;

import com.worldgen.exception.ErrorKind;
import com.worldgen.exception.MapAssemblyException;
import com.worldgen.exception.MapLoadException;
import com.worldgen.model.GameMap;
import com.worldgen.service.MapAssemblyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for MapLoader start-up loading.
 */
@ExtendWith(MockitoExtension.class)
class MapLoaderTest {

    @Mock
    private MapAssemblyService assemblyService;

    private MapProperties properties;
    private MapLoader loader;

    @BeforeEach
    void setUp() {
        properties = new MapProperties();
        loader = new MapLoader(properties, assemblyService);
    }

    @Test
    @DisplayName("loadMap() without a configured manifest should load nothing")
    void shouldSkipWhenUnconfigured() {
        loader.loadMap();

        assertFalse(loader.isLoaded());
        verifyNoInteractions(assemblyService);
        IllegalStateException ex = assertThrows(IllegalStateException.class, loader::getMap);
        assertTrue(ex.getMessage().contains("worldgen.map.manifest"));
    }

    @Test
    @DisplayName("loadMap() should assemble the configured manifest")
    void shouldLoadConfiguredManifest() {
        Path manifest = Path.of("game/map/default.map");
        properties.setManifest(manifest);
        GameMap map = GameMap.builder().warnings(List.of("1 finding")).build();
        when(assemblyService.assemble(manifest)).thenReturn(map);

        loader.loadMap();

        assertTrue(loader.isLoaded());
        assertSame(map, loader.getMap());
    }

    @Test
    @DisplayName("a failed load should propagate and keep the previous map")
    void shouldPropagateFailure() {
        GameMap previous = GameMap.builder().build();
        when(assemblyService.assemble(any()))
                .thenReturn(previous)
                .thenThrow(new MapAssemblyException("states",
                        MapLoadException.validation(Path.of("history/states/1.txt"), "Duplicate state id 1")));
        loader.load(Path.of("first/default.map"));

        MapLoadException ex = assertThrows(MapLoadException.class, () -> loader.load(Path.of("second/default.map")));

        assertEquals(ErrorKind.VALIDATION, ex.getKind());
        assertSame(previous, loader.getMap());
    }

    @Test
    @DisplayName("the default layout should point at the standard file names")
    void shouldUseDefaultLayout() {
        MapLayout layout = properties.getLayout();

        assertEquals("strategicregions", layout.getStrategicRegions());
        assertEquals("history/states", layout.getStates());
        assertEquals("common/terrain/00_terrain.txt", layout.getTerrainTypes());
    }
}
