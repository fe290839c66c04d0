package com.worldgen.model;

import com.worldgen.exception.MapLoadException;
import com.worldgen.model.scalar.Temperature;
import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseValue;

import java.util.List;

/**
 * Minimum and maximum temperature of a weather period, written {@code { min max }}.
 */
public record TemperatureRange(Temperature min, Temperature max) {

    public static TemperatureRange fromClause(ClauseValue value) {
        List<Temperature> parts = ClauseRecord.decodeItems(value, Temperature::fromClause);
        if (parts.size() != 2) {
            throw MapLoadException.decode("Expected 2 temperatures but found " + parts.size());
        }
        return new TemperatureRange(parts.get(0), parts.get(1));
    }

    public ClauseBlock toClause() {
        return ClauseBlock.ofItems(List.of(min.toClause(), max.toClause()));
    }
}
