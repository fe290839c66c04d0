package com.worldgen.model;

import com.worldgen.exception.MapLoadException;
import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.model.scalar.RailLevel;

import java.util.List;

/**
 * One line of the railways file: {@code <level> <count> <province> ...}.
 *
 * @param level     rail level of the whole line
 * @param length    number of provinces the line declares
 * @param provinces provinces in travel order
 */
public record Railway(RailLevel level, int length, List<ProvinceId> provinces) {

    public Railway {
        if (length != provinces.size()) {
            throw MapLoadException.validation("Railway declares " + length
                    + " provinces but lists " + provinces.size());
        }
        provinces = List.copyOf(provinces);
    }
}
