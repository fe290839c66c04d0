package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;

import java.util.Objects;

public record AdjacencyRuleName(String value) {

    public AdjacencyRuleName {
        Objects.requireNonNull(value, "adjacency rule name");
    }

    public static AdjacencyRuleName parse(String text) {
        return new AdjacencyRuleName(text.trim());
    }

    public static AdjacencyRuleName fromClause(ClauseValue value) {
        return new AdjacencyRuleName(value.asScalar().text());
    }

    public ClauseScalar toClause() {
        return ClauseScalar.quoted(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
