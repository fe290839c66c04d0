package com.worldgen.parser;

import java.util.Objects;

/**
 * A {@code key op value} entry of an object block.
 *
 * @param key      the key text
 * @param operator the operator between key and value, usually {@code =}
 * @param value    the value
 */
public record ClauseField(String key, String operator, ClauseValue value) {

    public ClauseField {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
    }

    public ClauseField(String key, ClauseValue value) {
        this(key, "=", value);
    }
}
