package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;

import java.util.Objects;

public record StateCategoryName(String value) {

    public StateCategoryName {
        Objects.requireNonNull(value, "state category");
    }

    public static StateCategoryName parse(String text) {
        return new StateCategoryName(text.trim());
    }

    public static StateCategoryName fromClause(ClauseValue value) {
        return new StateCategoryName(value.asScalar().text());
    }

    public ClauseScalar toClause() {
        return ClauseScalar.quoted(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
