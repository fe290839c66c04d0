package com.worldgen.model;

import java.util.List;

/**
 * The adjacencies file, in file order.
 */
public record Adjacencies(List<Adjacency> adjacencies) {

    public Adjacencies {
        adjacencies = List.copyOf(adjacencies);
    }

    public int size() {
        return adjacencies.size();
    }
}
