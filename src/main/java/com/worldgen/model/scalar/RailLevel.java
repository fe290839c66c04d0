package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;
import com.worldgen.parser.Scalars;

/**
 * Level of a railway. The game uses levels 1 to 5; other values are not rejected here.
 */
public record RailLevel(int value) {

    public static RailLevel parse(String text) {
        return new RailLevel(Scalars.parseInt(text, "railway level"));
    }

    public static RailLevel fromClause(ClauseValue value) {
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
