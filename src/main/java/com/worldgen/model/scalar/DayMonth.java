package com.worldgen.model.scalar;

import com.worldgen.exception.MapLoadException;
import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseValue;
import com.worldgen.parser.Scalars;

/**
 * Zero-indexed day of the month (0-30) and month of the year (0-11), written {@code D.M}.
 *
 * @param day   zero-indexed day, 0 to 30
 * @param month zero-indexed month, 0 to 11
 */
public record DayMonth(int day, int month) {

    public static final int MAX_DAY = 30;
    public static final int MAX_MONTH = 11;

    public DayMonth {
        if (day < 0 || day > MAX_DAY || month < 0 || month > MAX_MONTH) {
            throw MapLoadException.format("Invalid day/month: " + day + "." + month);
        }
    }

    public static DayMonth parse(String text) {
        String[] parts = text.trim().split("\\.", -1);
        if (parts.length != 2) {
            throw MapLoadException.format("Invalid day/month: '" + text + "', expected D.M");
        }
        int day = Scalars.parseIntInRange(parts[0], 0, MAX_DAY, "day");
        int month = Scalars.parseIntInRange(parts[1], 0, MAX_MONTH, "month");
        return new DayMonth(day, month);
    }

    public static DayMonth fromClause(ClauseValue value) {
        return parse(value.asScalar().text());
    }

    public ClauseScalar toClause() {
        return ClauseScalar.of(toString());
    }

    @Override
    public String toString() {
        return day + "." + month;
    }
}
