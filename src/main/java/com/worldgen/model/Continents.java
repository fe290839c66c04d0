package com.worldgen.model;

import com.worldgen.model.scalar.ContinentIndex;
import com.worldgen.model.scalar.ContinentName;
import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseSchema;

import java.util.List;
import java.util.Optional;

/**
 * Continent names in declaration order. Definitions refer to them by 1-based index.
 */
public record Continents(List<ContinentName> continents) {

    static final ClauseSchema SCHEMA = ClauseSchema.builder()
            .required("continents")
            .build();

    public Continents {
        continents = List.copyOf(continents);
    }

    public static Continents fromFile(ClauseBlock root) {
        return new Continents(root.decode(SCHEMA).getList("continents", ContinentName::fromClause));
    }

    /**
     * The continent a definition index refers to; index 0 and out-of-range indices have none.
     */
    public Optional<ContinentName> find(ContinentIndex index) {
        int position = index.value() - 1;
        if (position < 0 || position >= continents.size()) {
            return Optional.empty();
        }
        return Optional.of(continents.get(position));
    }

    public int size() {
        return continents.size();
    }
}
