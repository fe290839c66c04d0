package com.worldgen.model.scalar;

import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;
import com.worldgen.parser.Scalars;

/**
 * A temperature in degrees Celsius.
 */
public record Temperature(double value) {

    public static Temperature parse(String text) {
        return new Temperature(Scalars.parseDouble(text, "temperature"));
    }

    public static Temperature fromClause(ClauseValue value) {
        return parse(value.asScalar().text());
    }

    public ClauseScalar toClause() {
        return ClauseScalar.of(value);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
