package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;
import com.worldgen.parser.Scalars;

/**
 * An x coordinate on the province bitmap.
 */
public record XCoord(int value) {

    public static XCoord parse(String text) {
        return new XCoord(Scalars.parseInt(text, "x coordinate"));
    }

    public static XCoord fromClause(ClauseValue value) {
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
