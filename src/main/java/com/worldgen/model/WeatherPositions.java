package com.worldgen.model;

import java.util.List;

/**
 * The weather positions file, in file order.
 */
public record WeatherPositions(List<WeatherPosition> positions) {

    public WeatherPositions {
        positions = List.copyOf(positions);
    }

    public int size() {
        return positions.size();
    }
}
