package com.worldgen.loader;

import com.worldgen.model.Cities;
import com.worldgen.model.Colors;
import com.worldgen.model.Continents;
import com.worldgen.model.Seasons;
import com.worldgen.model.UnitStack;
import com.worldgen.model.UnitStacks;
import com.worldgen.model.WeatherPosition;
import com.worldgen.model.WeatherPositions;
import com.worldgen.parser.ClauseParser;
import com.worldgen.parser.DelimitedRecordReader;
import com.worldgen.parser.RowDecodeMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Loads the map files that need no cross-checking of their own: continents, seasons,
 * cities, colours, unit stacks and weather positions.
 */
@Component
@Slf4j
public class MapAssetLoader {

    public Continents loadContinents(Path path) {
        Continents continents = ClauseParser.decodeFile(path, Continents::fromFile);
        log.info("Loaded {} continent(s)", continents.size());
        return continents;
    }

    public Seasons loadSeasons(Path path) {
        return ClauseParser.decodeFile(path, Seasons::fromFile);
    }

    public Cities loadCities(Path path) {
        Cities cities = ClauseParser.decodeFile(path, Cities::fromFile);
        log.info("Loaded {} city group(s)", cities.cityGroups().size());
        return cities;
    }

    public Colors loadColors(Path path) {
        return ClauseParser.decodeFile(path, Colors::fromFile);
    }

    public UnitStacks loadUnitStacks(Path path) {
        List<UnitStack> stacks = DelimitedRecordReader.read(path, false, RowDecodeMode.LOOSE, UnitStack::fromRow);
        log.info("Loaded {} unit stack(s)", stacks.size());
        return new UnitStacks(stacks);
    }

    public WeatherPositions loadWeatherPositions(Path path) {
        List<WeatherPosition> positions = DelimitedRecordReader.read(
                path, false, RowDecodeMode.LOOSE, WeatherPosition::fromRow);
        log.info("Loaded {} weather position(s)", positions.size());
        return new WeatherPositions(positions);
    }
}
