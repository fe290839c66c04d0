package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;
import com.worldgen.parser.Scalars;

public record SnowLevel(double value) {

    public static SnowLevel parse(String text) {
        return new SnowLevel(Scalars.parseDouble(text, "snow level"));
    }

    public static SnowLevel fromClause(ClauseValue value) {
        return parse(value.asScalar().text());
    }

    public ClauseScalar toClause() {
        return ClauseScalar.of(value);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
