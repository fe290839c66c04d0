package com.worldgen.config;

import com.worldgen.exception.MapLoadException;
import com.worldgen.model.GameMap;
import com.worldgen.service.MapAssemblyService;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Loads the configured map at startup.
 * <p>
 * The manifest comes from {@code worldgen.map.manifest}. Without one the application
 * starts with no map; with one that fails to load, startup fails.
 */
@Component
@Slf4j
public class MapLoader {

    private final MapProperties properties;
    private final MapAssemblyService assemblyService;

    private GameMap map;

    public MapLoader(MapProperties properties, MapAssemblyService assemblyService) {
        this.properties = properties;
        this.assemblyService = assemblyService;
    }

    @PostConstruct
    public void loadMap() {
        Path manifest = properties.getManifest();
        if (manifest == null) {
            log.warn("No map configured! Set worldgen.map.manifest to the default.map to load.");
            return;
        }
        load(manifest);
    }

    /**
     * Loads {@code manifest}, replacing the current map only when the load succeeds.
     *
     * @throws MapLoadException if the map cannot be loaded
     */
    public GameMap load(Path manifest) {
        try {
            GameMap loaded = assemblyService.assemble(manifest);
            map = loaded;
            log.info("Loaded map from {} ({} warning(s))", manifest, loaded.warnings().size());
            return loaded;
        } catch (MapLoadException e) {
            log.error("Failed to load map {}: {}", manifest, e.getMessage());
            throw e;
        }
    }

    public boolean isLoaded() {
        return map != null;
    }

    /**
     * The loaded map.
     *
     * @throws IllegalStateException if no map has been loaded
     */
    public GameMap getMap() {
        if (map == null) {
            throw new IllegalStateException("No map loaded. Configure worldgen.map.manifest.");
        }
        return map;
    }
}
