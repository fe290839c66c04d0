package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;

import java.util.Objects;

/**
 * A building type, as declared in the building types file.
 */
public record BuildingId(String value) {

    public BuildingId {
        Objects.requireNonNull(value, "building id");
    }

    public static BuildingId parse(String text) {
        return new BuildingId(text.trim());
    }

    public static BuildingId fromClause(ClauseValue value) {
        return new BuildingId(value.asScalar().text());
    }

    public ClauseScalar toClause() {
        return ClauseScalar.quoted(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
