package com.worldgen.model;

import com.worldgen.exception.MapLoadException;
import com.worldgen.model.scalar.DayMonth;
import com.worldgen.model.scalar.SnowLevel;
import com.worldgen.model.scalar.Weight;
import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseSchema;
import com.worldgen.parser.ClauseValue;

import java.util.ArrayList;
import java.util.List;

/**
 * One weather system of a strategic region.
 * <p>
 * {@code between} lists day/month values two at a time, so {@code between = { 0.0 30.0 }}
 * covers the whole of January. Each weather state carries a weight deciding how likely it
 * is while the period is active.
 */
public record Period(
        List<DayMonthRange> between,
        TemperatureRange temperature,
        Weight noPhenomenon,
        Weight rainLight,
        Weight rainHeavy,
        Weight snow,
        Weight blizzard,
        Weight arcticWater,
        Weight mud,
        Weight sandstorm,
        SnowLevel minSnowLevel
) {

    static final ClauseSchema SCHEMA = ClauseSchema.builder()
            .required("between", "temperature", "no_phenomenon", "rain_light", "rain_heavy", "snow",
                    "blizzard", "arctic_water", "mud", "sandstorm", "min_snow_level")
            .build();

    public Period {
        if (between.isEmpty()) {
            throw MapLoadException.decode("A weather period needs at least one date range");
        }
        between = List.copyOf(between);
    }

    public static Period fromClause(ClauseValue value) {
        ClauseRecord record = value.asBlock().decode(SCHEMA);
        return new Period(
                record.get("between", Period::ranges),
                record.get("temperature", TemperatureRange::fromClause),
                record.get("no_phenomenon", Weight::fromClause),
                record.get("rain_light", Weight::fromClause),
                record.get("rain_heavy", Weight::fromClause),
                record.get("snow", Weight::fromClause),
                record.get("blizzard", Weight::fromClause),
                record.get("arctic_water", Weight::fromClause),
                record.get("mud", Weight::fromClause),
                record.get("sandstorm", Weight::fromClause),
                record.get("min_snow_level", SnowLevel::fromClause));
    }

    private static List<DayMonthRange> ranges(ClauseValue value) {
        List<DayMonth> dates = ClauseRecord.decodeItems(value, DayMonth::fromClause);
        if (dates.isEmpty() || dates.size() % 2 != 0) {
            throw MapLoadException.decode("Expected pairs of day.month values but found " + dates.size());
        }
        List<DayMonthRange> ranges = new ArrayList<>(dates.size() / 2);
        for (int i = 0; i < dates.size(); i += 2) {
            ranges.add(new DayMonthRange(dates.get(i), dates.get(i + 1)));
        }
        return ranges;
    }

    public ClauseBlock toClause() {
        List<DayMonth> dates = new ArrayList<>();
        for (DayMonthRange range : between) {
            dates.add(range.start());
            dates.add(range.end());
        }
        return ClauseBlock.builder()
                .field("between", ClauseBlock.ofItems(dates, DayMonth::toClause))
                .field("temperature", temperature.toClause())
                .field("no_phenomenon", noPhenomenon.toClause())
                .field("rain_light", rainLight.toClause())
                .field("rain_heavy", rainHeavy.toClause())
                .field("snow", snow.toClause())
                .field("blizzard", blizzard.toClause())
                .field("arctic_water", arcticWater.toClause())
                .field("mud", mud.toClause())
                .field("sandstorm", sandstorm.toClause())
                .field("min_snow_level", minSnowLevel.toClause())
                .build();
    }
}
