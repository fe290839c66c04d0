package com.worldgen.parser;

import com.worldgen.exception.MapLoadException;

/**
 * Primitive literal parsing shared by the wrapper types. Every failure becomes a
 * {@code FORMAT} {@link MapLoadException} naming what was being parsed.
 */
public final class Scalars {

    private Scalars() {
    }

    public static int parseInt(String text, String what) {
        if (text == null) {
            throw MapLoadException.format("Missing " + what);
        }
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw MapLoadException.format("Invalid " + what + ": '" + text + "'", e);
        }
    }

    public static double parseDouble(String text, String what) {
        if (text == null) {
            throw MapLoadException.format("Missing " + what);
        }
        String trimmed = text.trim();
        // Double.parseDouble also accepts hex floats and "NaN", neither of which appear in map files
        if (trimmed.isEmpty() || !trimmed.matches("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?")) {
            throw MapLoadException.format("Invalid " + what + ": '" + text + "'");
        }
        return Double.parseDouble(trimmed);
    }

    /**
     * Parses {@code true}/{@code false}, the spelling used by the CSV files.
     */
    public static boolean parseBoolean(String text, String what) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.equals("true")) {
            return true;
        }
        if (trimmed.equals("false")) {
            return false;
        }
        throw MapLoadException.format("Invalid " + what + ": '" + text + "'");
    }

    public static int parseIntInRange(String text, int min, int max, String what) {
        int value = parseInt(text, what);
        if (value < min || value > max) {
            throw MapLoadException.format("Invalid " + what + ": " + value
                    + " is outside " + min + ".." + max);
        }
        return value;
    }
}
