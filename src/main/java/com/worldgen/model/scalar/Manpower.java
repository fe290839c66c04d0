package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;
import com.worldgen.parser.Scalars;

public record Manpower(int value) {

    public static Manpower parse(String text) {
        return new Manpower(Scalars.parseInt(text, "manpower"));
    }

    public static Manpower fromClause(ClauseValue value) {
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
