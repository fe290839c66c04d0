package com.worldgen.model;

import com.worldgen.exception.MapLoadException;

/**
 * Size of a weather effect marker.
 */
public enum WeatherType {
    BIG("big"),
    SMALL("small");

    private final String text;

    WeatherType(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public static WeatherType parse(String text) {
        for (WeatherType type : values()) {
            if (type.text.equals(text.trim())) {
                return type;
            }
        }
        throw MapLoadException.format("Invalid weather type: '" + text + "'");
    }
}
