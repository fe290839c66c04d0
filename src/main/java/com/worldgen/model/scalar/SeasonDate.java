package com.worldgen.model.scalar;

import com.worldgen.exception.MapLoadException;
import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;
import com.worldgen.parser.Scalars;

/**
 * A {@code year.month.day} date as used by the seasons file, for example {@code 00.12.01}.
 * Month and day are 1-based here, unlike {@link DayMonth}.
 */
public record SeasonDate(int year, int month, int day) {

    public SeasonDate {
        if (month < 1 || month > 12 || day < 1 || day > 31) {
            throw MapLoadException.format("Invalid date: " + year + "." + month + "." + day);
        }
    }

    public static SeasonDate parse(String text) {
        String[] parts = text.trim().split("\\.", -1);
        if (parts.length != 3) {
            throw MapLoadException.format("Invalid date: '" + text + "', expected Y.M.D");
        }
        return new SeasonDate(
                Scalars.parseInt(parts[0], "year"),
                Scalars.parseIntInRange(parts[1], 1, 12, "month"),
                Scalars.parseIntInRange(parts[2], 1, 31, "day"));
    }

    public static SeasonDate fromClause(ClauseValue value) {
        return parse(value.asScalar().text());
    }

    public ClauseScalar toClause() {
        return ClauseScalar.of(toString());
    }

    @Override
    public String toString() {
        return String.format("%02d.%02d.%02d", year, month, day);
    }
}
