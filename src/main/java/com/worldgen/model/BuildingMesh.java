package com.worldgen.model;

import com.worldgen.model.scalar.MeshId;
import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseSchema;
import com.worldgen.parser.ClauseValue;

import java.util.List;

/**
 * City building meshes used from a given distance between buildings.
 */
public record BuildingMesh(double distance, List<MeshId> meshes) {

    static final ClauseSchema SCHEMA = ClauseSchema.builder()
            .required("distance", "mesh")
            .build();

    public BuildingMesh {
        meshes = List.copyOf(meshes);
    }

    public static BuildingMesh fromClause(ClauseValue value) {
        ClauseRecord record = value.asBlock().decode(SCHEMA);
        return new BuildingMesh(record.getDouble("distance"), record.getList("mesh", MeshId::fromClause));
    }
}
