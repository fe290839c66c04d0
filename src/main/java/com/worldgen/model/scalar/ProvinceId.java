package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;
import com.worldgen.parser.Scalars;

/**
 * Identifies a province. Also the key that links definitions, adjacencies, regions and states.
 */
public record ProvinceId(int value) {

    public static ProvinceId parse(String text) {
        return new ProvinceId(Scalars.parseInt(text, "province id"));
    }

    public static ProvinceId fromClause(ClauseValue value) {
        return parse(value.asScalar().text());
    }

    public ClauseScalar toClause() {
        return ClauseScalar.of(value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
