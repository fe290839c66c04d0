package com.worldgen.loader;

import com.worldgen.model.DefaultMap;
import com.worldgen.parser.ClauseParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Reads the {@code default.map} manifest that names every other map asset.
 */
@Component
@Slf4j
public class DefaultMapLoader {

    /**
     * Decodes the manifest and checks that assets can be resolved against it.
     *
     * @throws com.worldgen.exception.MapLoadException of kind {@code IO} when the manifest
     *         is missing or its location has no parent directory
     */
    public DefaultMap load(Path manifest) {
        DefaultMap map = ClauseParser.decodeFile(manifest, root -> DefaultMap.fromClause(manifest, root));
        Path directory = map.directory();
        log.debug("Read manifest {} (assets under {})", manifest, directory);
        return map;
    }
}
