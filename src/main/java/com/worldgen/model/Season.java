package com.worldgen.model;

import com.worldgen.model.scalar.Hsv;
import com.worldgen.model.scalar.SeasonDate;
import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseSchema;
import com.worldgen.parser.ClauseValue;

/**
 * Colour grading of the map for one season, given separately for the northern,
 * central and southern bands.
 */
public record Season(
        SeasonDate startDate,
        SeasonDate endDate,
        Hsv hsvNorth,
        Hsv colorBalanceNorth,
        Hsv hsvCenter,
        Hsv colorBalanceCenter,
        Hsv hsvSouth,
        Hsv colorBalanceSouth
) {

    static final ClauseSchema SCHEMA = ClauseSchema.builder()
            .required("start_date", "end_date", "hsv_north", "colorbalance_north", "hsv_center",
                    "colorbalance_center", "hsv_south", "colorbalance_south")
            .build();

    public static Season fromClause(ClauseValue value) {
        ClauseRecord record = value.asBlock().decode(SCHEMA);
        return new Season(
                record.get("start_date", SeasonDate::fromClause),
                record.get("end_date", SeasonDate::fromClause),
                record.get("hsv_north", Hsv::fromClause),
                record.get("colorbalance_north", Hsv::fromClause),
                record.get("hsv_center", Hsv::fromClause),
                record.get("colorbalance_center", Hsv::fromClause),
                record.get("hsv_south", Hsv::fromClause),
                record.get("colorbalance_south", Hsv::fromClause));
    }

    public ClauseBlock toClause() {
        return ClauseBlock.builder()
                .field("start_date", startDate.toClause())
                .field("end_date", endDate.toClause())
                .field("hsv_north", hsvNorth.toClause())
                .field("colorbalance_north", colorBalanceNorth.toClause())
                .field("hsv_center", hsvCenter.toClause())
                .field("colorbalance_center", colorBalanceCenter.toClause())
                .field("hsv_south", hsvSouth.toClause())
                .field("colorbalance_south", colorBalanceSouth.toClause())
                .build();
    }
}
