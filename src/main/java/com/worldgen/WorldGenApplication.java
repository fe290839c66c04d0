package com.worldgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point. Loads the map named by {@code worldgen.map.manifest} and reports what
 * was found.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class WorldGenApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorldGenApplication.class, args);
    }
}
