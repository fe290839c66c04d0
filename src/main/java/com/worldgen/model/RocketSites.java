package com.worldgen.model;

import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.model.scalar.StateId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rocket site provinces per state, from {@code rocketsites.txt}.
 */
public record RocketSites(Map<StateId, List<ProvinceId>> rocketSites) {

    public RocketSites {
        rocketSites = Collections.unmodifiableMap(new LinkedHashMap<>(rocketSites));
    }

    public List<ProvinceId> of(StateId state) {
        return rocketSites.getOrDefault(state, List.of());
    }
}
