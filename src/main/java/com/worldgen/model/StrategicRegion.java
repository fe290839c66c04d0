package com.worldgen.model;

import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.model.scalar.StrategicRegionId;
import com.worldgen.model.scalar.StrategicRegionName;
import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseSchema;
import com.worldgen.parser.ClauseValue;

import java.util.List;

/**
 * A group of provinces sharing weather and air/naval operations, read from
 * {@code strategicregions/<id>-StrategicRegion.txt}.
 *
 * @param id        region id, also the numeric prefix of the file name
 * @param name      localisation key of the region
 * @param provinces member provinces
 * @param weather   weather periods in file order
 */
public record StrategicRegion(
        StrategicRegionId id,
        StrategicRegionName name,
        List<ProvinceId> provinces,
        List<Period> weather
) {

    /** Schema of a region file: a single {@code strategic_region} block. */
    public static final ClauseSchema FILE_SCHEMA = ClauseSchema.builder()
            .required("strategic_region")
            .build();

    static final ClauseSchema SCHEMA = ClauseSchema.builder()
            .required("id", "name", "provinces", "weather")
            .build();

    private static final ClauseSchema WEATHER_SCHEMA = ClauseSchema.builder()
            .duplicated("period")
            .build();

    public StrategicRegion {
        provinces = List.copyOf(provinces);
        weather = List.copyOf(weather);
    }

    public static StrategicRegion fromClause(ClauseValue value) {
        ClauseRecord record = value.asBlock().decode(SCHEMA);
        return new StrategicRegion(
                record.get("id", StrategicRegionId::fromClause),
                record.get("name", StrategicRegionName::fromClause),
                record.getList("provinces", ProvinceId::fromClause),
                record.get("weather", StrategicRegion::periods));
    }

    /**
     * Decodes a whole region file.
     */
    public static StrategicRegion fromFile(ClauseBlock root) {
        return root.decode(FILE_SCHEMA).get("strategic_region", StrategicRegion::fromClause);
    }

    private static List<Period> periods(ClauseValue value) {
        return value.asBlock().decode(WEATHER_SCHEMA).getAll("period", Period::fromClause);
    }

    public ClauseBlock toClause() {
        ClauseBlock.Builder weatherBlock = ClauseBlock.builder();
        for (Period period : weather) {
            weatherBlock.field("period", period.toClause());
        }
        return ClauseBlock.builder()
                .field("id", id.toClause())
                .field("name", name.toClause())
                .field("provinces", ClauseBlock.ofItems(provinces, ProvinceId::toClause))
                .field("weather", weatherBlock.build())
                .build();
    }

    /**
     * Renders a whole region file.
     */
    public ClauseBlock toFile() {
        return ClauseBlock.builder().field("strategic_region", toClause()).build();
    }
}
