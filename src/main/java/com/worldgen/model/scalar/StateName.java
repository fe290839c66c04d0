package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;

import java.util.Objects;

public record StateName(String value) {

    public StateName {
        Objects.requireNonNull(value, "state name");
    }

    public static StateName parse(String text) {
        return new StateName(text.trim());
    }

    public static StateName fromClause(ClauseValue value) {
        return new StateName(value.asScalar().text());
    }

    public ClauseScalar toClause() {
        return ClauseScalar.quoted(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
