package com.worldgen.parser;

import com.worldgen.exception.MapLoadException;

import java.util.Objects;

/**
 * A scalar token. Quoted and unquoted tokens carry the same text; the flag is kept so the
 * writer can reproduce the original quoting.
 *
 * @param text   the token text with quotes and escapes removed
 * @param quoted whether the token was written between double quotes
 */
public record ClauseScalar(String text, boolean quoted) implements ClauseValue {

    public ClauseScalar {
        Objects.requireNonNull(text, "text");
    }

    public static ClauseScalar of(String text) {
        return new ClauseScalar(text, false);
    }

    public static ClauseScalar quoted(String text) {
        return new ClauseScalar(text, true);
    }

    public static ClauseScalar of(int value) {
        return new ClauseScalar(Integer.toString(value), false);
    }

    public static ClauseScalar of(double value) {
        return new ClauseScalar(Double.toString(value), false);
    }

    public static ClauseScalar of(boolean value) {
        return new ClauseScalar(value ? "yes" : "no", false);
    }

    public int asInt() {
        return Scalars.parseInt(text, "integer");
    }

    public double asDouble() {
        return Scalars.parseDouble(text, "number");
    }

    /**
     * Clause files spell booleans {@code yes} and {@code no}.
     */
    public boolean asBoolean() {
        return switch (text) {
            case "yes" -> true;
            case "no" -> false;
            default -> throw MapLoadException.format("Invalid boolean: '" + text + "'");
        };
    }
}
