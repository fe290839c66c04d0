package com.worldgen.loader;

import com.worldgen.model.Buildings;
import com.worldgen.model.StateBuilding;
import com.worldgen.model.scalar.BuildingId;
import com.worldgen.parser.DelimitedRecordReader;
import com.worldgen.parser.RowDecodeMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the building type catalog and the building placements of the map.
 * <p>
 * Rows that do not decode are skipped, and so are placements of building types the
 * catalog does not declare. {@link Buildings#FLOATING_HARBOR} is always accepted.
 */
@Component
@Slf4j
public class BuildingLoader {

    public Buildings load(Path typesFile, Path buildingsCsv) {
        Set<BuildingId> types = new LinkedHashSet<>();
        for (String name : DeclaredTypes.read(typesFile, "buildings")) {
            types.add(new BuildingId(name));
        }
        types.add(Buildings.FLOATING_HARBOR);

        List<StateBuilding> placed = DelimitedRecordReader.read(
                buildingsCsv, false, RowDecodeMode.LOOSE, StateBuilding::fromRow);
        List<StateBuilding> buildings = new ArrayList<>(placed.size());
        for (StateBuilding building : placed) {
            if (types.contains(building.buildingId())) {
                buildings.add(building);
            } else {
                log.warn("BuildingId {} is not defined in types", building.buildingId());
            }
        }
        log.info("Loaded {} building(s) of {} type(s)", buildings.size(), types.size());
        return new Buildings(types, buildings);
    }
}
