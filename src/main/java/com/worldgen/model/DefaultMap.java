package com.worldgen.model;

import com.worldgen.exception.MapLoadException;
import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseScalar;
import com.worldgen.parser.ClauseSchema;
import com.worldgen.parser.ClauseValue;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * The map manifest, {@code default.map}. Every asset path is kept exactly as written,
 * relative to the directory holding the manifest; use {@link #resolve(Path)} to locate
 * the file.
 *
 * @param manifest       the manifest file itself
 * @param definitions    province definitions CSV
 * @param provinces      province bitmap
 * @param positions      unit and building positions
 * @param terrain        terrain bitmap
 * @param rivers         river bitmap
 * @param heightmap      height bitmap
 * @param treeDefinition tree bitmap
 * @param continent      continent names
 * @param adjacencyRules adjacency rules
 * @param adjacencies    adjacencies CSV
 * @param climate        climate file, absent in newer maps
 * @param ambientObject  ambient objects
 * @param seasons        seasons file
 * @param tree           palette indices of the tree bitmap that hold trees
 */
public record DefaultMap(
        Path manifest,
        Path definitions,
        Path provinces,
        Path positions,
        Path terrain,
        Path rivers,
        Path heightmap,
        Path treeDefinition,
        Path continent,
        Path adjacencyRules,
        Path adjacencies,
        Optional<Path> climate,
        Path ambientObject,
        Path seasons,
        List<Integer> tree
) {

    static final ClauseSchema SCHEMA = ClauseSchema.builder()
            .required("definitions", "provinces", "positions", "terrain", "rivers", "heightmap",
                    "tree_definition", "continent", "adjacency_rules", "adjacencies",
                    "ambient_object", "seasons")
            .optional("climate", "tree")
            .build();

    public DefaultMap {
        tree = List.copyOf(tree);
    }

    /**
     * Decodes the top level of a manifest read from {@code manifest}.
     */
    public static DefaultMap fromClause(Path manifest, ClauseValue value) {
        ClauseRecord record = value.asBlock().decode(SCHEMA);
        return new DefaultMap(
                manifest,
                record.get("definitions", DefaultMap::path),
                record.get("provinces", DefaultMap::path),
                record.get("positions", DefaultMap::path),
                record.get("terrain", DefaultMap::path),
                record.get("rivers", DefaultMap::path),
                record.get("heightmap", DefaultMap::path),
                record.get("tree_definition", DefaultMap::path),
                record.get("continent", DefaultMap::path),
                record.get("adjacency_rules", DefaultMap::path),
                record.get("adjacencies", DefaultMap::path),
                record.find("climate", DefaultMap::path),
                record.get("ambient_object", DefaultMap::path),
                record.get("seasons", DefaultMap::path),
                record.find("tree", v -> ClauseRecord.decodeItems(v, item -> item.asScalar().asInt()))
                        .orElse(List.of()));
    }

    private static Path path(ClauseValue value) {
        return Path.of(value.asScalar().text());
    }

    /**
     * Joins {@code relative} with the directory holding the manifest.
     *
     * @throws MapLoadException of kind {@code IO} when the manifest path has no parent
     *                          directory or no file name
     */
    public Path resolve(Path relative) {
        return directory().resolve(relative);
    }

    /**
     * The directory holding the manifest.
     */
    public Path directory() {
        Path parent = manifest.getParent();
        if (parent == null || manifest.getFileName() == null) {
            throw MapLoadException.fileNotFound(manifest);
        }
        return parent;
    }

    public ClauseBlock toClause() {
        ClauseBlock.Builder builder = ClauseBlock.builder()
                .quoted("definitions", text(definitions))
                .quoted("provinces", text(provinces))
                .quoted("positions", text(positions))
                .quoted("terrain", text(terrain))
                .quoted("rivers", text(rivers))
                .quoted("heightmap", text(heightmap))
                .quoted("tree_definition", text(treeDefinition))
                .quoted("continent", text(continent))
                .quoted("adjacency_rules", text(adjacencyRules))
                .quoted("adjacencies", text(adjacencies));
        climate.ifPresent(path -> builder.quoted("climate", text(path)));
        builder.quoted("ambient_object", text(ambientObject))
                .quoted("seasons", text(seasons))
                .field("tree", ClauseBlock.ofItems(tree, index -> ClauseScalar.of(index.intValue())));
        return builder.build();
    }

    private static String text(Path path) {
        return path.toString().replace('\\', '/');
    }
}
