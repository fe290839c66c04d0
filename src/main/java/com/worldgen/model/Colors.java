package com.worldgen.model;

import com.worldgen.model.scalar.Color;
import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseSchema;

import java.util.List;

/**
 * Repeated {@code color = { r g b }} entries of the colors file.
 */
public record Colors(List<Color> colors) {

    static final ClauseSchema SCHEMA = ClauseSchema.builder()
            .duplicated("color")
            .build();

    public Colors {
        colors = List.copyOf(colors);
    }

    public static Colors fromFile(ClauseBlock root) {
        return new Colors(root.decode(SCHEMA).getAll("color", Color::fromClause));
    }

    public int size() {
        return colors.size();
    }
}
