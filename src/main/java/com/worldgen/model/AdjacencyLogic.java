package com.worldgen.model;

import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseSchema;
import com.worldgen.parser.ClauseValue;

/**
 * Which unit kinds may cross an adjacency rule for one diplomatic relation.
 */
public record AdjacencyLogic(boolean army, boolean navy, boolean submarine, boolean trade) {

    static final ClauseSchema SCHEMA = ClauseSchema.builder()
            .required("army", "navy", "submarine", "trade")
            .build();

    public static AdjacencyLogic fromClause(ClauseValue value) {
        ClauseRecord record = value.asBlock().decode(SCHEMA);
        return new AdjacencyLogic(
                record.getBoolean("army"),
                record.getBoolean("navy"),
                record.getBoolean("submarine"),
                record.getBoolean("trade"));
    }

    public ClauseBlock toClause() {
        return ClauseBlock.builder()
                .field("army", army)
                .field("navy", navy)
                .field("submarine", submarine)
                .field("trade", trade)
                .build();
    }
}
