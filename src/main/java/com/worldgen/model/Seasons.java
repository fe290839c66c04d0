package com.worldgen.model;

import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseSchema;

/**
 * The seasons file: four map seasons and eight tree foliage stages.
 */
public record Seasons(
        Season winter,
        Season spring,
        Season summer,
        Season autumn,
        TreeSeason treeWinter,
        TreeSeason treeWinter2,
        TreeSeason treeSpring,
        TreeSeason treeSpring2,
        TreeSeason treeSummer,
        TreeSeason treeSummer2,
        TreeSeason treeAutumn,
        TreeSeason treeAutumn2
) {

    static final ClauseSchema SCHEMA = ClauseSchema.builder()
            .required("winter", "spring", "summer", "autumn",
                    "tree_winter", "tree_winter2", "tree_spring", "tree_spring2",
                    "tree_summer", "tree_summer2", "tree_autumn", "tree_autumn2")
            .build();

    public static Seasons fromFile(ClauseBlock root) {
        ClauseRecord record = root.decode(SCHEMA);
        return new Seasons(
                record.get("winter", Season::fromClause),
                record.get("spring", Season::fromClause),
                record.get("summer", Season::fromClause),
                record.get("autumn", Season::fromClause),
                record.get("tree_winter", TreeSeason::fromClause),
                record.get("tree_winter2", TreeSeason::fromClause),
                record.get("tree_spring", TreeSeason::fromClause),
                record.get("tree_spring2", TreeSeason::fromClause),
                record.get("tree_summer", TreeSeason::fromClause),
                record.get("tree_summer2", TreeSeason::fromClause),
                record.get("tree_autumn", TreeSeason::fromClause),
                record.get("tree_autumn2", TreeSeason::fromClause));
    }

    public ClauseBlock toFile() {
        return ClauseBlock.builder()
                .field("winter", winter.toClause())
                .field("spring", spring.toClause())
                .field("summer", summer.toClause())
                .field("autumn", autumn.toClause())
                .field("tree_winter", treeWinter.toClause())
                .field("tree_winter2", treeWinter2.toClause())
                .field("tree_spring", treeSpring.toClause())
                .field("tree_spring2", treeSpring2.toClause())
                .field("tree_summer", treeSummer.toClause())
                .field("tree_summer2", treeSummer2.toClause())
                .field("tree_autumn", treeAutumn.toClause())
                .field("tree_autumn2", treeAutumn2.toClause())
                .build();
    }
}
