package com.worldgen.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Settings under {@code worldgen.map}.
 */
@ConfigurationProperties(prefix = "worldgen.map")
@Getter
@Setter
public class MapProperties {

    /** The {@code default.map} to load at start-up. Nothing is loaded when unset. */
    private Path manifest;

    private MapLayout layout = new MapLayout();
}
