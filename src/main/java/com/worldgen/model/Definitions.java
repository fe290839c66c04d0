package com.worldgen.model;

import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.model.scalar.Terrain;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * All province definitions, in file order, together with the terrain types they may
 * refer to.
 *
 * @param definitions  one entry per province
 * @param terrainTypes terrain names declared in the terrain file
 */
public record Definitions(List<Definition> definitions, Set<Terrain> terrainTypes) {

    public Definitions {
        definitions = List.copyOf(definitions);
        terrainTypes = Set.copyOf(terrainTypes);
    }

    public int size() {
        return definitions.size();
    }

    public Optional<Definition> find(ProvinceId id) {
        return definitions.stream().filter(d -> d.id().equals(id)).findFirst();
    }
}
