package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;

import java.util.Objects;

public record ContinentName(String value) {

    public ContinentName {
        Objects.requireNonNull(value, "continent name");
    }

    public static ContinentName parse(String text) {
        return new ContinentName(text.trim());
    }

    public static ContinentName fromClause(ClauseValue value) {
        return new ContinentName(value.asScalar().text());
    }

    public ClauseScalar toClause() {
        return ClauseScalar.quoted(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
