package com.worldgen.model;

import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.model.scalar.StrategicRegionId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Strategic regions keyed by id, in the order their files were read.
 */
public record StrategicRegions(Map<StrategicRegionId, StrategicRegion> regions) {

    public StrategicRegions {
        regions = Collections.unmodifiableMap(new LinkedHashMap<>(regions));
    }

    public Optional<StrategicRegion> find(StrategicRegionId id) {
        return Optional.ofNullable(regions.get(id));
    }

    /**
     * The region that lists {@code province}, if any.
     */
    public Optional<StrategicRegion> regionOf(ProvinceId province) {
        return regions.values().stream()
                .filter(region -> region.provinces().contains(province))
                .findFirst();
    }

    public int size() {
        return regions.size();
    }
}
