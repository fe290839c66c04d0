package com.worldgen.model;

import com.worldgen.model.scalar.ProvinceId;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Provinces holding a supply node. Repeated lines collapse into one entry.
 */
public record SupplyNodes(Set<ProvinceId> provinces) {

    public SupplyNodes {
        provinces = Collections.unmodifiableSet(new LinkedHashSet<>(provinces));
    }

    public boolean contains(ProvinceId province) {
        return provinces.contains(province);
    }

    public int size() {
        return provinces.size();
    }
}
