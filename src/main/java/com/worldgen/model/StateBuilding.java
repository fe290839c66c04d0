package com.worldgen.model;

import com.worldgen.model.scalar.BuildingId;
import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.model.scalar.StateId;
import com.worldgen.parser.DelimitedRow;
import com.worldgen.parser.Scalars;

/**
 * Placement of a building model on the map, one row of the buildings file:
 * {@code state_id;building_id;x;y;z;rotation;adjacent_sea_province}.
 *
 * @param adjacentSeaProvince sea province a naval building faces, 0 when none
 */
public record StateBuilding(
        StateId stateId,
        BuildingId buildingId,
        double x,
        double y,
        double z,
        double rotation,
        ProvinceId adjacentSeaProvince
) {

    public static final ProvinceId NO_SEA_PROVINCE = new ProvinceId(0);

    public static StateBuilding fromRow(DelimitedRow row) {
        row.requireColumns(6);
        return new StateBuilding(
                StateId.parse(row.get(0, "state_id")),
                BuildingId.parse(row.get(1, "building_id")),
                Scalars.parseDouble(row.get(2, "x"), "x"),
                Scalars.parseDouble(row.get(3, "y"), "y"),
                Scalars.parseDouble(row.get(4, "z"), "z"),
                Scalars.parseDouble(row.get(5, "rotation"), "rotation"),
                row.find(6).map(ProvinceId::parse).orElse(NO_SEA_PROVINCE));
    }
}
