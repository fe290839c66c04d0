package com.worldgen.service;

import com.worldgen.model.Adjacency;
import com.worldgen.model.Definition;
import com.worldgen.model.GameMap;
import com.worldgen.model.Railway;
import com.worldgen.model.State;
import com.worldgen.model.StateBuilding;
import com.worldgen.model.StrategicRegion;
import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.model.scalar.StrategicRegionId;
import com.worldgen.raster.RgbRaster;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cross-checks the catalogs of an assembled map. Nothing found here stops a load; the
 * findings are returned as messages, one per kind of problem.
 */
@Component
public class MapConsistencyChecker {

    private static final int EXAMPLES = 5;

    public List<String> check(GameMap map) {
        Set<ProvinceId> defined = map.definitions().definitions().stream()
                .map(Definition::id)
                .collect(Collectors.toSet());
        List<String> warnings = new ArrayList<>();

        Set<Object> terrain = new LinkedHashSet<>();
        Set<Object> continents = new LinkedHashSet<>();
        for (Definition definition : map.definitions().definitions()) {
            if (!map.definitions().terrainTypes().contains(definition.terrain())) {
                terrain.add(definition.terrain());
            }
            if (definition.continent().value() != 0 && map.continents().find(definition.continent()).isEmpty()) {
                continents.add(definition.id());
            }
        }
        report(warnings, "terrain types used by provinces are not declared", terrain);
        report(warnings, "provinces refer to an unknown continent", continents);

        Set<Object> adjacencyProvinces = new LinkedHashSet<>();
        Set<Object> adjacencyRules = new LinkedHashSet<>();
        for (Adjacency adjacency : map.adjacencies().adjacencies()) {
            undefined(defined, adjacency.from(), adjacencyProvinces);
            undefined(defined, adjacency.to(), adjacencyProvinces);
            adjacency.through().ifPresent(through -> undefined(defined, through, adjacencyProvinces));
            adjacency.ruleName()
                    .filter(name -> map.adjacencyRules().find(name).isEmpty())
                    .ifPresent(adjacencyRules::add);
        }
        report(warnings, "adjacencies refer to undefined provinces", adjacencyProvinces);
        report(warnings, "adjacencies refer to unknown adjacency rules", adjacencyRules);

        Set<Object> regionProvinces = new LinkedHashSet<>();
        Set<Object> sharedProvinces = new LinkedHashSet<>();
        Map<ProvinceId, StrategicRegionId> regionOf = new HashMap<>();
        for (StrategicRegion region : map.strategicRegions().regions().values()) {
            for (ProvinceId province : region.provinces()) {
                undefined(defined, province, regionProvinces);
                if (regionOf.putIfAbsent(province, region.id()) != null) {
                    sharedProvinces.add(province);
                }
            }
        }
        report(warnings, "strategic regions list undefined provinces", regionProvinces);
        report(warnings, "provinces belong to more than one strategic region", sharedProvinces);

        Set<Object> stateProvinces = new LinkedHashSet<>();
        for (State state : map.states().states().values()) {
            state.provinces().forEach(province -> undefined(defined, province, stateProvinces));
        }
        report(warnings, "states list undefined provinces", stateProvinces);

        Set<Object> supplyProvinces = new LinkedHashSet<>();
        map.supplyNodes().provinces().forEach(province -> undefined(defined, province, supplyProvinces));
        for (Railway railway : map.railways().railways()) {
            railway.provinces().forEach(province -> undefined(defined, province, supplyProvinces));
        }
        report(warnings, "supply nodes or railways use undefined provinces", supplyProvinces);

        Set<Object> buildingStates = new LinkedHashSet<>();
        for (StateBuilding building : map.buildings().buildings()) {
            if (map.states().find(building.stateId()).isEmpty()) {
                buildingStates.add(building.stateId());
            }
        }
        report(warnings, "buildings are placed in unknown states", buildingStates);

        checkRasters(map, warnings);
        return List.copyOf(warnings);
    }

    private void checkRasters(GameMap map, List<String> warnings) {
        RgbRaster provinces = map.provinces();
        if (provinces == null) {
            return;
        }
        for (RgbRaster other : new RgbRaster[]{map.terrain(), map.rivers(), map.heightmap(), map.trees()}) {
            if (other != null && !other.sameSize(provinces)) {
                warnings.add("bitmap of " + other.width() + "x" + other.height()
                        + " does not match the " + provinces.width() + "x" + provinces.height() + " province bitmap");
            }
        }
        Set<Integer> colors = new HashSet<>();
        for (Definition definition : map.definitions().definitions()) {
            colors.add(definition.color().packed());
        }
        Set<Object> unknown = new LinkedHashSet<>();
        provinces.stream()
                .filter(rgb -> !colors.contains(rgb))
                .forEach(rgb -> unknown.add(String.format("#%06X", rgb)));
        report(warnings, "province bitmap colours have no definition", unknown);
    }

    private static void undefined(Set<ProvinceId> defined, ProvinceId province, Set<Object> into) {
        if (!defined.contains(province)) {
            into.add(province);
        }
    }

    private static void report(List<String> warnings, String problem, Set<Object> offenders) {
        if (offenders.isEmpty()) {
            return;
        }
        String examples = offenders.stream()
                .limit(EXAMPLES)
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
        warnings.add(offenders.size() + " " + problem + " (" + examples
                + (offenders.size() > EXAMPLES ? ", ..." : "") + ")");
    }
}
