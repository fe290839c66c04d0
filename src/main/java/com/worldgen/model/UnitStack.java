package com.worldgen.model;

import com.worldgen.model.scalar.ModelIndex;
import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.parser.DelimitedRow;
import com.worldgen.parser.Scalars;

/**
 * Placement of a unit model inside a province, one row of
 * {@code province;model_index;x;y;z;rotation;scale}.
 */
public record UnitStack(
        ProvinceId province,
        ModelIndex modelIndex,
        double x,
        double y,
        double z,
        double rotation,
        double scale
) {

    public static final int COLUMNS = 7;

    public static UnitStack fromRow(DelimitedRow row) {
        row.requireColumns(COLUMNS);
        return new UnitStack(
                ProvinceId.parse(row.get(0, "province")),
                ModelIndex.parse(row.get(1, "model_index")),
                Scalars.parseDouble(row.get(2, "x"), "x"),
                Scalars.parseDouble(row.get(3, "y"), "y"),
                Scalars.parseDouble(row.get(4, "z"), "z"),
                Scalars.parseDouble(row.get(5, "rotation"), "rotation"),
                Scalars.parseDouble(row.get(6, "scale"), "scale"));
    }
}
