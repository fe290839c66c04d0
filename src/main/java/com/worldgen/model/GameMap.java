package com.worldgen.model;

import com.worldgen.raster.RgbRaster;
import lombok.Builder;

import java.util.List;

/**
 * Everything loaded for one map. Built once by the assembly and never changed afterwards.
 *
 * @param warnings consistency findings that did not stop the load
 */
@Builder(toBuilder = true)
public record GameMap(
        DefaultMap defaultMap,
        Definitions definitions,
        Continents continents,
        AdjacencyRules adjacencyRules,
        Adjacencies adjacencies,
        Seasons seasons,
        StrategicRegions strategicRegions,
        SupplyNodes supplyNodes,
        Railways railways,
        Airports airports,
        RocketSites rocketSites,
        Buildings buildings,
        States states,
        Cities cities,
        Colors colors,
        UnitStacks unitStacks,
        WeatherPositions weatherPositions,
        RgbRaster provinces,
        RgbRaster terrain,
        RgbRaster rivers,
        RgbRaster heightmap,
        RgbRaster trees,
        List<String> warnings
) {

    public GameMap {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Palette indices of the tree bitmap that hold trees.
     */
    public List<Integer> treeIndices() {
        return defaultMap.tree();
    }
}
