package com.worldgen.parser;

import com.worldgen.exception.MapLoadException;

import java.util.Optional;

/**
 * One row of a semicolon-separated file.
 *
 * @param number  1-based row number in the file, header included
 * @param columns raw column text
 */
public record DelimitedRow(int number, String[] columns) {

    public int size() {
        return columns.length;
    }

    /**
     * The text of a column that must be present.
     */
    public String get(int index, String name) {
        if (index >= columns.length) {
            throw MapLoadException.decode("Missing column " + (index + 1) + " (" + name + ")");
        }
        return columns[index];
    }

    /**
     * The text of a column, or empty when the column is absent or blank.
     */
    public Optional<String> find(int index) {
        if (index >= columns.length || columns[index].isBlank()) {
            return Optional.empty();
        }
        return Optional.of(columns[index]);
    }

    public void requireColumns(int count) {
        if (columns.length < count) {
            throw MapLoadException.decode("Expected " + count + " columns but found " + columns.length);
        }
    }

    @Override
    public String toString() {
        return "row " + number + ": " + String.join(";", columns);
    }
}
