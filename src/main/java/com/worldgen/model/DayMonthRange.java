package com.worldgen.model;

import com.worldgen.model.scalar.DayMonth;

/**
 * Inclusive span of the year during which a weather period applies.
 */
public record DayMonthRange(DayMonth start, DayMonth end) {
}
