package com.worldgen.loader;

import com.worldgen.exception.MapLoadException;
import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseField;
import com.worldgen.parser.ClauseParser;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads type catalogs such as {@code common/terrain/00_terrain.txt}: the keys of the
 * first top-level block are the declared type names.
 */
final class DeclaredTypes {

    private DeclaredTypes() {
    }

    /**
     * @param kind used in error messages, e.g. {@code "terrain"}
     */
    static Set<String> read(Path path, String kind) {
        ClauseBlock root = ClauseParser.parseFile(path);
        if (root.fields().isEmpty() || !root.fields().get(0).value().isBlock()) {
            throw MapLoadException.validation(path, "Invalid " + kind + " file");
        }
        ClauseBlock types = root.fields().get(0).value().asBlock();
        Set<String> names = new LinkedHashSet<>();
        for (ClauseField field : types.fields()) {
            if (!names.add(field.key())) {
                throw MapLoadException.validation(path, "Duplicate " + kind + " type: " + field.key());
            }
        }
        return Collections.unmodifiableSet(names);
    }
}
