package com.worldgen.loader;

import com.worldgen.model.Definition;
import com.worldgen.model.Definitions;
import com.worldgen.model.scalar.Color;
import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.model.scalar.Terrain;
import com.worldgen.parser.DelimitedRecordReader;
import com.worldgen.parser.RowDecodeMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loads province definitions and the terrain types they may use.
 * <p>
 * Every definition row must decode. Repeated ids or colours are reported but kept,
 * since the game itself tolerates them.
 */
@Component
@Slf4j
public class DefinitionLoader {

    public Definitions load(Path definitionsCsv, Path terrainFile) {
        List<Definition> definitions = DelimitedRecordReader.read(
                definitionsCsv, false, RowDecodeMode.STRICT, Definition::fromRow);
        reportDuplicates(definitions, definitionsCsv);
        Set<Terrain> terrain = DeclaredTypes.read(terrainFile, "terrain").stream()
                .map(Terrain::new)
                .collect(Collectors.toSet());
        log.info("Loaded {} province definition(s) and {} terrain type(s)", definitions.size(), terrain.size());
        return new Definitions(definitions, terrain);
    }

    private void reportDuplicates(List<Definition> definitions, Path path) {
        Map<ProvinceId, Definition> byId = new HashMap<>();
        Map<Color, Definition> byColor = new HashMap<>();
        for (Definition definition : definitions) {
            Definition sameId = byId.putIfAbsent(definition.id(), definition);
            if (sameId != null) {
                log.warn("Province {} is defined more than once in {}", definition.id(), path.getFileName());
            }
            Definition sameColor = byColor.putIfAbsent(definition.color(), definition);
            if (sameColor != null) {
                log.warn("Provinces {} and {} share colour {} in {}",
                        sameColor.id(), definition.id(), definition.color(), path.getFileName());
            }
        }
    }
}
