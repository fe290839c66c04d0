package com.worldgen.parser;

import com.worldgen.exception.ErrorKind;
import com.worldgen.exception.MapLoadException;
import com.worldgen.parser.LegacyText.NumberedLine;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;

/**
 * Parses lines of exactly two tokens, a fixed sentinel followed by an id, and collects the
 * ids into a set.
 */
public final class SentinelPairLineParser<T> {

    private final String sentinel;
    private final Function<String, T> idParser;
    private final String recordName;

    public SentinelPairLineParser(String sentinel, Function<String, T> idParser, String recordName) {
        this.sentinel = sentinel;
        this.idParser = idParser;
        this.recordName = recordName;
    }

    public Set<T> parse(Path path) {
        Set<T> result = new LinkedHashSet<>();
        for (NumberedLine line : LegacyText.nonBlankLines(path)) {
            try {
                result.add(parseLine(line.text()));
            } catch (MapLoadException e) {
                throw new MapLoadException(e.getKind(), path,
                        "Line " + line.number() + ": " + e.getDetail(), e);
            }
        }
        return Collections.unmodifiableSet(result);
    }

    public T parseLine(String line) {
        String[] tokens = line.trim().split("\\s+");
        if (tokens.length != 2 || !tokens[0].equals(sentinel)) {
            throw MapLoadException.validation("Invalid " + recordName + ": '" + line.trim() + "'");
        }
        try {
            return idParser.apply(tokens[1]);
        } catch (MapLoadException e) {
            throw new MapLoadException(ErrorKind.VALIDATION, null,
                    "Invalid " + recordName + ": '" + line.trim() + "' (" + e.getDetail() + ")", e);
        }
    }
}
