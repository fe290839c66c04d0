package com.worldgen.model;

import com.worldgen.model.scalar.SeasonDate;
import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseSchema;
import com.worldgen.parser.ClauseValue;

/**
 * When one of the tree foliage stages is shown.
 */
public record TreeSeason(SeasonDate startDate, SeasonDate endDate) {

    static final ClauseSchema SCHEMA = ClauseSchema.builder()
            .required("start_date", "end_date")
            .build();

    public static TreeSeason fromClause(ClauseValue value) {
        ClauseRecord record = value.asBlock().decode(SCHEMA);
        return new TreeSeason(
                record.get("start_date", SeasonDate::fromClause),
                record.get("end_date", SeasonDate::fromClause));
    }

    public ClauseBlock toClause() {
        return ClauseBlock.builder()
                .field("start_date", startDate.toClause())
                .field("end_date", endDate.toClause())
                .build();
    }
}
