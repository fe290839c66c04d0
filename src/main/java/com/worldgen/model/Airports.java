package com.worldgen.model;

import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.model.scalar.StateId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Airport provinces per state, from {@code airports.txt}.
 */
public record Airports(Map<StateId, List<ProvinceId>> airports) {

    public Airports {
        airports = Collections.unmodifiableMap(new LinkedHashMap<>(airports));
    }

    public List<ProvinceId> of(StateId state) {
        return airports.getOrDefault(state, List.of());
    }
}
