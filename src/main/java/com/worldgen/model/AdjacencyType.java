package com.worldgen.model;

import com.worldgen.exception.MapLoadException;

import java.util.Optional;

/**
 * Type column of the adjacencies file. An empty column means a plain land connection and
 * decodes to no type at all.
 */
public enum AdjacencyType {
    IMPASSABLE("impassable"),
    SEA("sea"),
    RIVER("river"),
    LARGE_RIVER("large_river");

    private final String text;

    AdjacencyType(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public static Optional<AdjacencyType> parse(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        for (AdjacencyType type : values()) {
            if (type.text.equals(trimmed)) {
                return Optional.of(type);
            }
        }
        throw MapLoadException.format("Invalid adjacency type: '" + text + "'");
    }
}
