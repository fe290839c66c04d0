package com.worldgen.model;

import com.worldgen.exception.MapLoadException;
import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseValue;

import java.util.List;

/**
 * Victory points of one province, written {@code victory_points = { <province> <value> }}.
 */
public record VictoryPoint(ProvinceId province, double value) {

    public static VictoryPoint fromClause(ClauseValue value) {
        List<ClauseValue> parts = ClauseRecord.decodeItems(value, v -> v);
        if (parts.size() != 2) {
            throw MapLoadException.decode("Expected a province and a value but found " + parts.size() + " item(s)");
        }
        return new VictoryPoint(ProvinceId.fromClause(parts.get(0)), parts.get(1).asScalar().asDouble());
    }
}
