package com.worldgen.service;

import com.worldgen.config.MapLayout;
import com.worldgen.config.MapProperties;
import com.worldgen.exception.MapAssemblyException;
import com.worldgen.exception.MapLoadException;
import com.worldgen.loader.AdjacencyLoader;
import com.worldgen.loader.AdjacencyRuleLoader;
import com.worldgen.loader.BuildingLoader;
import com.worldgen.loader.DefaultMapLoader;
import com.worldgen.loader.DefinitionLoader;
import com.worldgen.loader.MapAssetLoader;
import com.worldgen.loader.StateLoader;
import com.worldgen.loader.StateProvinceMapLoader;
import com.worldgen.loader.StrategicRegionLoader;
import com.worldgen.loader.SupplyNetworkLoader;
import com.worldgen.model.DefaultMap;
import com.worldgen.model.GameMap;
import com.worldgen.raster.RasterDecoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

/**
 * Loads every file of a map into one {@link GameMap}.
 * <p>
 * The manifest is read first and locates the other files. Each file is loaded as a named
 * stage; the first stage that fails stops the assembly with a {@link MapAssemblyException}
 * naming it, so a partially loaded map is never returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MapAssemblyService {

    private final DefaultMapLoader defaultMapLoader;
    private final DefinitionLoader definitionLoader;
    private final AdjacencyLoader adjacencyLoader;
    private final AdjacencyRuleLoader adjacencyRuleLoader;
    private final StrategicRegionLoader strategicRegionLoader;
    private final SupplyNetworkLoader supplyNetworkLoader;
    private final StateProvinceMapLoader stateProvinceMapLoader;
    private final BuildingLoader buildingLoader;
    private final StateLoader stateLoader;
    private final MapAssetLoader mapAssetLoader;
    private final RasterDecoder rasterDecoder;
    private final MapConsistencyChecker consistencyChecker;
    private final MapProperties properties;

    public GameMap assemble(Path manifest) {
        log.info("Assembling map from {}", manifest);
        DefaultMap map = stage("manifest", () -> defaultMapLoader.load(manifest));
        MapLayout layout = properties.getLayout();

        GameMap assembled = GameMap.builder()
                .defaultMap(map)
                .definitions(stage("definitions", () -> definitionLoader.load(
                        map.resolve(map.definitions()), layout.inRoot(map, layout.getTerrainTypes()))))
                .continents(stage("continents", () -> mapAssetLoader.loadContinents(map.resolve(map.continent()))))
                .adjacencyRules(stage("adjacency rules", () -> adjacencyRuleLoader.load(map.resolve(map.adjacencyRules()))))
                .adjacencies(stage("adjacencies", () -> adjacencyLoader.load(map.resolve(map.adjacencies()))))
                .seasons(stage("seasons", () -> mapAssetLoader.loadSeasons(map.resolve(map.seasons()))))
                .strategicRegions(stage("strategic regions", () -> strategicRegionLoader.load(
                        layout.inMap(map, layout.getStrategicRegions()))))
                .supplyNodes(stage("supply nodes", () -> supplyNetworkLoader.loadSupplyNodes(
                        layout.inMap(map, layout.getSupplyNodes()))))
                .railways(stage("railways", () -> supplyNetworkLoader.loadRailways(
                        layout.inMap(map, layout.getRailways()))))
                .airports(stage("airports", () -> stateProvinceMapLoader.loadAirports(
                        layout.inMap(map, layout.getAirports()))))
                .rocketSites(stage("rocket sites", () -> stateProvinceMapLoader.loadRocketSites(
                        layout.inMap(map, layout.getRocketSites()))))
                .buildings(stage("buildings", () -> buildingLoader.load(
                        layout.inRoot(map, layout.getBuildingTypes()), layout.inMap(map, layout.getBuildings()))))
                .states(stage("states", () -> stateLoader.load(layout.inRoot(map, layout.getStates()))))
                .cities(stage("cities", () -> mapAssetLoader.loadCities(layout.inMap(map, layout.getCities()))))
                .colors(stage("colors", () -> mapAssetLoader.loadColors(layout.inMap(map, layout.getColors()))))
                .unitStacks(stage("unit stacks", () -> mapAssetLoader.loadUnitStacks(
                        layout.inMap(map, layout.getUnitStacks()))))
                .weatherPositions(stage("weather positions", () -> mapAssetLoader.loadWeatherPositions(
                        layout.inMap(map, layout.getWeatherPositions()))))
                .provinces(stage("provinces bitmap", () -> rasterDecoder.decode(map.resolve(map.provinces()))))
                .terrain(stage("terrain bitmap", () -> rasterDecoder.decode(map.resolve(map.terrain()))))
                .rivers(stage("rivers bitmap", () -> rasterDecoder.decode(map.resolve(map.rivers()))))
                .heightmap(stage("heightmap", () -> rasterDecoder.decode(map.resolve(map.heightmap()))))
                .trees(stage("trees bitmap", () -> rasterDecoder.decode(map.resolve(map.treeDefinition()))))
                .build();

        List<String> warnings = consistencyChecker.check(assembled);
        warnings.forEach(warning -> log.warn("Consistency: {}", warning));
        log.info("Map assembled from {}: {} provinces, {} strategic regions, {} states, {} warning(s)",
                manifest, assembled.definitions().size(), assembled.strategicRegions().size(),
                assembled.states().size(), warnings.size());
        return assembled.toBuilder().warnings(warnings).build();
    }

    private static <T> T stage(String name, Supplier<T> step) {
        try {
            T value = step.get();
            log.debug("Stage '{}' done", name);
            return value;
        } catch (MapLoadException e) {
            throw new MapAssemblyException(name, e);
        }
    }
}
