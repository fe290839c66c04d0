package com.worldgen.model;

import com.worldgen.exception.MapLoadException;

/**
 * Kind of province as written in the definitions file.
 */
public enum ProvinceType {
    LAND("land"),
    SEA("sea"),
    LAKE("lake");

    private final String text;

    ProvinceType(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public static ProvinceType parse(String text) {
        for (ProvinceType type : values()) {
            if (type.text.equals(text.trim())) {
                return type;
            }
        }
        throw MapLoadException.format("Invalid province type: '" + text + "'");
    }
}
