package com.worldgen.model.scalar;

import com.worldgen.exception.MapLoadException;
import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;
import com.worldgen.parser.Scalars;

import java.util.List;

/**
 * A hue/saturation/value triple, written {@code { h s v }}.
 */
public record Hsv(double hue, double saturation, double value) {

    public static Hsv parse(String text) {
        String[] parts = text.trim().split("\\s+");
        if (parts.length != 3) {
            throw MapLoadException.format("Invalid HSV triple: '" + text + "'");
        }
        return new Hsv(Scalars.parseDouble(parts[0], "hue"),
                Scalars.parseDouble(parts[1], "saturation"),
                Scalars.parseDouble(parts[2], "value"));
    }

    public static Hsv fromClause(ClauseValue value) {
        List<Double> parts = ClauseRecord.decodeItems(value, v -> v.asScalar().asDouble());
        if (parts.size() != 3) {
            throw MapLoadException.decode("Expected 3 HSV components but found " + parts.size());
        }
        return new Hsv(parts.get(0), parts.get(1), parts.get(2));
    }

    public ClauseBlock toClause() {
        return ClauseBlock.ofItems(List.of(
                ClauseScalar.of(hue), ClauseScalar.of(saturation), ClauseScalar.of(value)));
    }
}
