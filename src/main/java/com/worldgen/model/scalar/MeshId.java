package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;

import java.util.Objects;

public record MeshId(String value) {

    public MeshId {
        Objects.requireNonNull(value, "mesh id");
    }

    public static MeshId parse(String text) {
        return new MeshId(text.trim());
    }

    public static MeshId fromClause(ClauseValue value) {
        return new MeshId(value.asScalar().text());
    }

    public ClauseScalar toClause() {
        return ClauseScalar.quoted(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
