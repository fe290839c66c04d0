package com.worldgen.model;

import com.worldgen.model.scalar.AdjacencyRuleName;
import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.model.scalar.XCoord;
import com.worldgen.model.scalar.YCoord;
import com.worldgen.parser.DelimitedRow;
import com.worldgen.parser.Scalars;

import java.util.Optional;
import java.util.function.Function;

/**
 * An explicit connection between two provinces, from the adjacencies file:
 * {@code From;To;Type;Through;start_x;stop_x;start_y;stop_y;AdjacencyRuleName;comment}.
 * <p>
 * The file writes {@code -1} for "no through province" and "no coordinate override";
 * those sentinels become empty optionals here.
 */
public record Adjacency(
        ProvinceId from,
        ProvinceId to,
        Optional<AdjacencyType> type,
        Optional<ProvinceId> through,
        Optional<XCoord> startX,
        Optional<XCoord> stopX,
        Optional<YCoord> startY,
        Optional<YCoord> stopY,
        Optional<AdjacencyRuleName> ruleName,
        Optional<String> comment
) {

    public static final int UNSET = -1;

    /** Columns that must be present; the rule name and comment may be left off. */
    public static final int REQUIRED_COLUMNS = 8;

    public static Adjacency fromRow(DelimitedRow row) {
        row.requireColumns(REQUIRED_COLUMNS);
        return new Adjacency(
                ProvinceId.parse(row.get(0, "From")),
                ProvinceId.parse(row.get(1, "To")),
                AdjacencyType.parse(row.get(2, "Type")),
                unlessUnset(row.get(3, "Through"), "through province", ProvinceId::new),
                unlessUnset(row.get(4, "start_x"), "start_x", XCoord::new),
                unlessUnset(row.get(5, "stop_x"), "stop_x", XCoord::new),
                unlessUnset(row.get(6, "start_y"), "start_y", YCoord::new),
                unlessUnset(row.get(7, "stop_y"), "stop_y", YCoord::new),
                row.find(8).map(AdjacencyRuleName::parse),
                row.find(9).map(String::trim));
    }

    /**
     * Whether this is a sea crossing without the blocking province the game expects.
     */
    public boolean isSeaWithoutThrough() {
        return type.filter(t -> t == AdjacencyType.SEA).isPresent() && through.isEmpty();
    }

    private static <T> Optional<T> unlessUnset(String text, String what, Function<Integer, T> wrap) {
        if (text.isBlank()) {
            return Optional.empty();
        }
        int value = Scalars.parseInt(text, what);
        return value == UNSET ? Optional.empty() : Optional.of(wrap.apply(value));
    }
}
