package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;
import com.worldgen.parser.Scalars;

/**
 * 1-based index into the continent list. Sea provinces use 0.
 */
public record ContinentIndex(int value) {

    public static ContinentIndex parse(String text) {
        return new ContinentIndex(Scalars.parseInt(text, "continent index"));
    }

    public static ContinentIndex fromClause(ClauseValue value) {
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
