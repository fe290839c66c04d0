package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;
import com.worldgen.parser.Scalars;

public record ModelIndex(int value) {

    public static ModelIndex parse(String text) {
        return new ModelIndex(Scalars.parseInt(text, "model index"));
    }

    public static ModelIndex fromClause(ClauseValue value) {
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
