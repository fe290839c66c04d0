package com.worldgen.model;

import com.worldgen.exception.MapLoadException;
import com.worldgen.model.scalar.Manpower;
import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.model.scalar.StateCategoryName;
import com.worldgen.model.scalar.StateId;
import com.worldgen.model.scalar.StateName;
import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseSchema;
import com.worldgen.parser.ClauseValue;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * A state from {@code history/states}. {@code manpower} and {@code state_category} may be
 * repeated by dated history; every value is kept and the last one is the effective one.
 */
public record State(
        StateId id,
        StateName name,
        List<Manpower> manpower,
        List<StateCategoryName> stateCategory,
        Optional<StateHistory> history,
        Set<ProvinceId> provinces,
        OptionalDouble localSupplies,
        boolean impassable,
        OptionalDouble buildingsMaxLevelFactor
) {

    public static final ClauseSchema FILE_SCHEMA = ClauseSchema.builder()
            .required("state")
            .build();

    static final ClauseSchema SCHEMA = ClauseSchema.builder()
            .required("id", "name", "provinces")
            .duplicatedRequired("manpower", "state_category")
            .optional("history", "local_supplies", "impassable", "buildings_max_level_factor")
            .build();

    public State {
        manpower = List.copyOf(manpower);
        stateCategory = List.copyOf(stateCategory);
        provinces = Collections.unmodifiableSet(new LinkedHashSet<>(provinces));
    }

    public static State fromClause(ClauseValue value) {
        ClauseRecord record = value.asBlock().decode(SCHEMA);
        return new State(
                record.get("id", StateId::fromClause),
                record.get("name", StateName::fromClause),
                record.getAll("manpower", Manpower::fromClause),
                record.getAll("state_category", StateCategoryName::fromClause),
                record.find("history", StateHistory::fromClause),
                new LinkedHashSet<>(record.getList("provinces", ProvinceId::fromClause)),
                optionalDouble(record, "local_supplies"),
                record.find("impassable", v -> v.asScalar().asBoolean()).orElse(false),
                optionalDouble(record, "buildings_max_level_factor"));
    }

    public static State fromFile(ClauseBlock root) {
        return root.decode(FILE_SCHEMA).get("state", State::fromClause);
    }

    private static OptionalDouble optionalDouble(ClauseRecord record, String key) {
        return record.find(key, v -> v.asScalar().asDouble())
                .map(OptionalDouble::of)
                .orElse(OptionalDouble.empty());
    }

    public Manpower effectiveManpower() {
        return last(manpower, "manpower");
    }

    public StateCategoryName effectiveCategory() {
        return last(stateCategory, "state_category");
    }

    private <T> T last(List<T> values, String key) {
        if (values.isEmpty()) {
            throw MapLoadException.decode("State " + id + " has no " + key);
        }
        return values.get(values.size() - 1);
    }
}
