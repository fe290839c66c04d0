package com.worldgen.model;

import com.worldgen.model.scalar.CountryTag;
import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseSchema;
import com.worldgen.parser.ClauseValue;

import java.util.List;
import java.util.Optional;

/**
 * Start-date ownership of a state. Dated history entries nested in the block are not read.
 */
public record StateHistory(CountryTag owner, Optional<CountryTag> controller, List<VictoryPoint> victoryPoints) {

    static final ClauseSchema SCHEMA = ClauseSchema.builder()
            .required("owner")
            .optional("controller")
            .duplicated("victory_points")
            .build();

    public StateHistory {
        victoryPoints = List.copyOf(victoryPoints);
    }

    public static StateHistory fromClause(ClauseValue value) {
        ClauseRecord record = value.asBlock().decode(SCHEMA);
        return new StateHistory(
                record.get("owner", CountryTag::fromClause),
                record.find("controller", CountryTag::fromClause),
                record.getAll("victory_points", VictoryPoint::fromClause));
    }

    /**
     * The country controlling the state at start, which is the owner unless stated otherwise.
     */
    public CountryTag effectiveController() {
        return controller.orElse(owner);
    }
}
