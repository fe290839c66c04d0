package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;

import java.util.Objects;

/**
 * Terrain type name declared in the terrain file.
 */
public record Terrain(String value) {

    public Terrain {
        Objects.requireNonNull(value, "terrain");
    }

    public static Terrain parse(String text) {
        return new Terrain(text.trim());
    }

    public static Terrain fromClause(ClauseValue value) {
        return new Terrain(value.asScalar().text());
    }

    public ClauseScalar toClause() {
        return ClauseScalar.quoted(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
