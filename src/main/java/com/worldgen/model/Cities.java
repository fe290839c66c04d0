package com.worldgen.model;

import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseSchema;

import java.nio.file.Path;
import java.util.List;

/**
 * The cities file: where the city type map lives, its sampling step and the city
 * groups drawn on it.
 *
 * @param typesSource path of the city type bitmap, relative to the game root
 */
public record Cities(Path typesSource, int pixelStepX, int pixelStepY, List<CityGroup> cityGroups) {

    static final ClauseSchema SCHEMA = ClauseSchema.builder()
            .required("types_source", "pixel_step_x", "pixel_step_y")
            .duplicated("city_group")
            .build();

    public Cities {
        cityGroups = List.copyOf(cityGroups);
    }

    public static Cities fromFile(ClauseBlock root) {
        ClauseRecord record = root.decode(SCHEMA);
        return new Cities(
                Path.of(record.getString("types_source")),
                record.getInt("pixel_step_x"),
                record.getInt("pixel_step_y"),
                record.getAll("city_group", CityGroup::fromClause));
    }
}
