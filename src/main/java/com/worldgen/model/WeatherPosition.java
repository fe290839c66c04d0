package com.worldgen.model;

import com.worldgen.model.scalar.StrategicRegionId;
import com.worldgen.parser.DelimitedRow;
import com.worldgen.parser.Scalars;

/**
 * Where weather effects are drawn for a strategic region, one row of
 * {@code region;x;y;z;big|small}.
 */
public record WeatherPosition(StrategicRegionId region, double x, double y, double z, WeatherType type) {

    public static final int COLUMNS = 5;

    public static WeatherPosition fromRow(DelimitedRow row) {
        row.requireColumns(COLUMNS);
        return new WeatherPosition(
                StrategicRegionId.parse(row.get(0, "strategic_region_id")),
                Scalars.parseDouble(row.get(1, "x"), "x"),
                Scalars.parseDouble(row.get(2, "y"), "y"),
                Scalars.parseDouble(row.get(3, "z"), "z"),
                WeatherType.parse(row.get(4, "weather_type")));
    }
}
