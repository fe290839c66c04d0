package com.worldgen.loader;

import com.worldgen.model.Adjacencies;
import com.worldgen.model.Adjacency;
import com.worldgen.parser.DelimitedRecordReader;
import com.worldgen.parser.RowDecodeMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Loads the adjacencies CSV. The first row is a header.
 */
@Component
@Slf4j
public class AdjacencyLoader {

    public Adjacencies load(Path path) {
        List<Adjacency> adjacencies = DelimitedRecordReader.read(path, true, RowDecodeMode.STRICT, Adjacency::fromRow);
        for (Adjacency adjacency : adjacencies) {
            if (adjacency.isSeaWithoutThrough()) {
                log.warn("Sea adjacency {} -> {} has no through province", adjacency.from(), adjacency.to());
            }
        }
        log.info("Loaded {} adjacency record(s)", adjacencies.size());
        return new Adjacencies(adjacencies);
    }
}
