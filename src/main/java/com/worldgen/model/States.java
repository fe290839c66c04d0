package com.worldgen.model;

import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.model.scalar.StateId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * States keyed by id.
 */
public record States(Map<StateId, State> states) {

    public States {
        states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }

    public Optional<State> find(StateId id) {
        return Optional.ofNullable(states.get(id));
    }

    public Optional<State> stateOf(ProvinceId province) {
        return states.values().stream()
                .filter(state -> state.provinces().contains(province))
                .findFirst();
    }

    public int size() {
        return states.size();
    }
}
