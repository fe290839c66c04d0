package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;

import java.util.Objects;

/**
 * Three-letter country tag such as {@code FRA}.
 */
public record CountryTag(String value) {

    public CountryTag {
        Objects.requireNonNull(value, "country tag");
    }

    public static CountryTag parse(String text) {
        return new CountryTag(text.trim());
    }

    public static CountryTag fromClause(ClauseValue value) {
        return new CountryTag(value.asScalar().text());
    }

    public ClauseScalar toClause() {
        return ClauseScalar.quoted(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
