package com.worldgen.model.scalar;

import com.worldgen.exception.MapLoadException;
import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;
import com.worldgen.parser.Scalars;

import java.util.List;

/**
 * An RGB colour with channels from 0 to 255. Provinces are identified on the province
 * bitmap by this value.
 */
public record Color(int red, int green, int blue) {

    public Color {
        checkChannel(red, "red");
        checkChannel(green, "green");
        checkChannel(blue, "blue");
    }

    public static Color parse(String red, String green, String blue) {
        return new Color(
                Scalars.parseIntInRange(red, 0, 255, "red"),
                Scalars.parseIntInRange(green, 0, 255, "green"),
                Scalars.parseIntInRange(blue, 0, 255, "blue"));
    }

    /**
     * Parses {@code "r g b"}.
     */
    public static Color parse(String text) {
        String[] parts = text.trim().split("\\s+");
        if (parts.length != 3) {
            throw MapLoadException.format("Invalid colour: '" + text + "'");
        }
        return parse(parts[0], parts[1], parts[2]);
    }

    public static Color fromClause(ClauseValue value) {
        List<String> parts = ClauseRecord.decodeItems(value, v -> v.asScalar().text());
        if (parts.size() != 3) {
            throw MapLoadException.decode("Expected 3 colour channels but found " + parts.size());
        }
        return parse(parts.get(0), parts.get(1), parts.get(2));
    }

    public static Color fromPacked(int rgb) {
        return new Color((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
    }

    public int packed() {
        return (red << 16) | (green << 8) | blue;
    }

    public ClauseBlock toClause() {
        return ClauseBlock.ofItems(List.of(ClauseScalar.of(red), ClauseScalar.of(green), ClauseScalar.of(blue)));
    }

    @Override
    public String toString() {
        return red + " " + green + " " + blue;
    }

    private static void checkChannel(int channel, String name) {
        if (channel < 0 || channel > 255) {
            throw MapLoadException.format("Invalid " + name + " channel: " + channel);
        }
    }
}
