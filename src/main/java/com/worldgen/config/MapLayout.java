package com.worldgen.config;

import com.worldgen.model.DefaultMap;
import lombok.Getter;
import lombok.Setter;

import java.nio.file.Path;

/**
 * Where the map files the manifest does not name are found.
 * <p>
 * Map files are relative to the directory holding {@code default.map}; game files are
 * relative to the game root, the directory above it.
 */
@Getter
@Setter
public class MapLayout {

    // relative to the map directory
    private String strategicRegions = "strategicregions";
    private String supplyNodes = "supply_nodes.txt";
    private String railways = "railways.txt";
    private String airports = "airports.txt";
    private String rocketSites = "rocketsites.txt";
    private String buildings = "buildings.txt";
    private String unitStacks = "unitstacks.txt";
    private String weatherPositions = "weatherpositions.txt";
    private String cities = "cities.txt";
    private String colors = "colors.txt";

    // relative to the game root
    private String terrainTypes = "common/terrain/00_terrain.txt";
    private String buildingTypes = "common/buildings/00_buildings.txt";
    private String states = "history/states";

    public Path inMap(DefaultMap map, String relative) {
        return map.resolve(Path.of(relative));
    }

    public Path inRoot(DefaultMap map, String relative) {
        Path directory = map.directory();
        Path root = directory.getParent();
        if (root == null) {
            root = directory.toAbsolutePath().getParent();
        }
        return root.resolve(relative);
    }
}
