package com.worldgen.loader;

import com.worldgen.model.Airports;
import com.worldgen.model.RocketSites;
import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.model.scalar.StateId;
import com.worldgen.parser.IdArrayLineParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Loads files listing provinces per state, one {@code <state> = { <province> ... }} per
 * line: airports and rocket sites.
 */
@Component
@Slf4j
public class StateProvinceMapLoader {

    private final IdArrayLineParser<StateId, ProvinceId> parser =
            new IdArrayLineParser<>(StateId::parse, ProvinceId::parse);

    public Airports loadAirports(Path path) {
        Map<StateId, List<ProvinceId>> airports = parser.parse(path);
        log.info("Loaded airports for {} state(s)", airports.size());
        return new Airports(airports);
    }

    public RocketSites loadRocketSites(Path path) {
        Map<StateId, List<ProvinceId>> rocketSites = parser.parse(path);
        log.info("Loaded rocket sites for {} state(s)", rocketSites.size());
        return new RocketSites(rocketSites);
    }
}
