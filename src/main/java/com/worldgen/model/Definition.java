package com.worldgen.model;

import com.worldgen.model.scalar.Color;
import com.worldgen.model.scalar.ContinentIndex;
import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.model.scalar.Terrain;
import com.worldgen.parser.DelimitedRow;
import com.worldgen.parser.Scalars;

/**
 * One province from the definitions file:
 * {@code id;r;g;b;province_type;coastal;terrain;continent}.
 *
 * @param id        province id
 * @param color     colour of the province on the province bitmap
 * @param type      land, sea or lake
 * @param coastal   whether the province touches the sea
 * @param terrain   terrain type name
 * @param continent 1-based continent index, 0 for sea provinces
 */
public record Definition(
        ProvinceId id,
        Color color,
        ProvinceType type,
        boolean coastal,
        Terrain terrain,
        ContinentIndex continent
) {

    public static final int COLUMNS = 8;

    public static Definition fromRow(DelimitedRow row) {
        row.requireColumns(COLUMNS);
        return new Definition(
                ProvinceId.parse(row.get(0, "id")),
                Color.parse(row.get(1, "r"), row.get(2, "g"), row.get(3, "b")),
                ProvinceType.parse(row.get(4, "province_type")),
                Scalars.parseBoolean(row.get(5, "coastal"), "coastal flag"),
                Terrain.parse(row.get(6, "terrain")),
                ContinentIndex.parse(row.get(7, "continent")));
    }
}
