package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;
import com.worldgen.parser.Scalars;

/**
 * Relative weight of a weather phenomenon within a period.
 */
public record Weight(double value) {

    public static Weight parse(String text) {
        return new Weight(Scalars.parseDouble(text, "weight"));
    }

    public static Weight fromClause(ClauseValue value) {
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
