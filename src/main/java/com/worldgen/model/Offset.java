package com.worldgen.model;

import com.worldgen.exception.MapLoadException;
import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;

import java.util.List;

/**
 * Icon offset of an adjacency rule, written {@code { x y z }}.
 */
public record Offset(int x, int y, int z) {

    public static Offset fromClause(ClauseValue value) {
        List<Integer> parts = ClauseRecord.decodeItems(value, v -> v.asScalar().asInt());
        if (parts.size() != 3) {
            throw MapLoadException.decode("Expected 3 offset components but found " + parts.size());
        }
        return new Offset(parts.get(0), parts.get(1), parts.get(2));
    }

    public ClauseBlock toClause() {
        return ClauseBlock.ofItems(List.of(ClauseScalar.of(x), ClauseScalar.of(y), ClauseScalar.of(z)));
    }
}
