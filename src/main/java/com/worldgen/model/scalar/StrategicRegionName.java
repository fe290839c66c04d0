package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;

import java.util.Objects;

/**
 * Localisation key naming a strategic region.
 */
public record StrategicRegionName(String value) {

    public StrategicRegionName {
        Objects.requireNonNull(value, "strategic region name");
    }

    public static StrategicRegionName parse(String text) {
        return new StrategicRegionName(text.trim());
    }

    public static StrategicRegionName fromClause(ClauseValue value) {
        return new StrategicRegionName(value.asScalar().text());
    }

    public ClauseScalar toClause() {
        return ClauseScalar.quoted(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
