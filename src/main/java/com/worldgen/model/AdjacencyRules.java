package com.worldgen.model;

import com.worldgen.model.scalar.AdjacencyRuleName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Adjacency rules keyed by name, in file order.
 */
public record AdjacencyRules(Map<AdjacencyRuleName, AdjacencyRule> rules) {

    public AdjacencyRules {
        rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public Optional<AdjacencyRule> find(AdjacencyRuleName name) {
        return Optional.ofNullable(rules.get(name));
    }

    public int size() {
        return rules.size();
    }
}
