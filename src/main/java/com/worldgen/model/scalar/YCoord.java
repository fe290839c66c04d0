package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;
import com.worldgen.parser.Scalars;

/**
 * A y coordinate on the province bitmap.
 */
public record YCoord(int value) {

    public static YCoord parse(String text) {
        return new YCoord(Scalars.parseInt(text, "y coordinate"));
    }

    public static YCoord fromClause(ClauseValue value) {
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
