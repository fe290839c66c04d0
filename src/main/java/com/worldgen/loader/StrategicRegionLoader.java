package com.worldgen.loader;

import com.worldgen.exception.ErrorKind;
import com.worldgen.exception.MapLoadException;
import com.worldgen.model.StrategicRegion;
import com.worldgen.model.StrategicRegions;
import com.worldgen.model.scalar.StrategicRegionId;
import com.worldgen.parser.ClauseParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Loads every {@code <id>-StrategicRegion.txt} file of the strategic regions directory.
 * <p>
 * A file name that only loosely follows the pattern is reported and still read, as long
 * as it starts with a numeric id. The region inside must declare that same id, a non-zero
 * id and a name; any violation fails the whole directory.
 */
@Component
@Slf4j
public class StrategicRegionLoader {

    private static final Pattern FILE_NAME = Pattern.compile("[1-9][0-9]*-StrategicRegion\\.txt");

    public StrategicRegions load(Path directory) {
        Map<StrategicRegionId, StrategicRegion> regions = new LinkedHashMap<>();
        for (Path file : MapDirectory.regularFiles(directory)) {
            StrategicRegion region = loadFile(file);
            if (regions.putIfAbsent(region.id(), region) != null) {
                throw MapLoadException.validation(file, "Duplicate strategic region id " + region.id());
            }
        }
        log.info("Loaded {} strategic region(s) from {}", regions.size(), directory);
        return new StrategicRegions(regions);
    }

    StrategicRegion loadFile(Path file) {
        StrategicRegionId fileId = idFromFileName(file);
        StrategicRegion region = ClauseParser.decodeFile(file, StrategicRegion::fromFile);
        if (region.id().value() == 0) {
            throw MapLoadException.validation(file, "Invalid strategic region id 0");
        }
        if (!region.id().equals(fileId)) {
            throw MapLoadException.validation(file, "Strategic region id " + region.id()
                    + " does not match file name id " + fileId);
        }
        if (region.name().value().isBlank()) {
            throw MapLoadException.validation(file, "Strategic region " + region.id() + " has an empty name");
        }
        log.debug("Read strategic region {} ({} provinces) from {}",
                region.id(), region.provinces().size(), file.getFileName());
        return region;
    }

    /**
     * The id in front of the first {@code -} of the file name.
     */
    static StrategicRegionId idFromFileName(Path file) {
        String name = file.getFileName().toString();
        int dash = name.indexOf('-');
        if (dash < 0) {
            throw MapLoadException.validation(file, "Invalid strategic region file name: " + name);
        }
        StrategicRegionId id;
        try {
            id = StrategicRegionId.parse(name.substring(0, dash));
        } catch (MapLoadException e) {
            throw new MapLoadException(ErrorKind.VALIDATION,
                    file, "Invalid strategic region file name: " + name, e);
        }
        if (!FILE_NAME.matcher(name).matches()) {
            log.warn("Strategic region file name is not correct: {}", name);
        }
        return id;
    }
}
