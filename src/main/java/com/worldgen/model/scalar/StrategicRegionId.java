package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;
import com.worldgen.parser.Scalars;

/**
 * Identifies a strategic region. Region files are named after it.
 */
public record StrategicRegionId(int value) {

    public static StrategicRegionId parse(String text) {
        return new StrategicRegionId(Scalars.parseInt(text, "strategic region id"));
    }

    public static StrategicRegionId fromClause(ClauseValue value) {
        return parse(value.asScalar().text());
    }

    public ClauseScalar toClause() {
        return ClauseScalar.of(value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
