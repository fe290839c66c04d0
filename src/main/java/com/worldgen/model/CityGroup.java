package com.worldgen.model;

import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseSchema;
import com.worldgen.parser.ClauseValue;

import java.util.List;

/**
 * City meshes drawn where the city type map uses {@code colorIndex}.
 */
public record CityGroup(int colorIndex, double density, List<BuildingMesh> buildings) {

    static final ClauseSchema SCHEMA = ClauseSchema.builder()
            .required("color_index", "density")
            .duplicated("building")
            .build();

    public CityGroup {
        buildings = List.copyOf(buildings);
    }

    public static CityGroup fromClause(ClauseValue value) {
        ClauseRecord record = value.asBlock().decode(SCHEMA);
        return new CityGroup(
                record.getInt("color_index"),
                record.getDouble("density"),
                record.getAll("building", BuildingMesh::fromClause));
    }
}
