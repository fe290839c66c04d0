package com.worldgen.model;

import com.worldgen.model.scalar.BuildingId;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Declared building types and the building placements that use them.
 *
 * @param types     building types from the buildings definition file plus
 *                  {@link #FLOATING_HARBOR}
 * @param buildings placements whose building id is one of {@code types}
 */
public record Buildings(Set<BuildingId> types, List<StateBuilding> buildings) {

    /** Placed by the game without being declared in the buildings definition file. */
    public static final BuildingId FLOATING_HARBOR = new BuildingId("floating_harbor");

    public Buildings {
        types = Collections.unmodifiableSet(new LinkedHashSet<>(types));
        buildings = List.copyOf(buildings);
    }

    public boolean isDeclared(BuildingId id) {
        return types.contains(id);
    }
}
