package com.worldgen.parser;

import com.worldgen.exception.ErrorKind;
import com.worldgen.exception.MapLoadException;
import com.worldgen.parser.LegacyText.NumberedLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parses lines of whitespace-separated tokens: a prefix value, a declared count, then ids.
 * A line is valid only when the declared count equals the number of ids that parsed;
 * ids that do not parse are dropped before the comparison.
 */
public final class PrefixedCountLineParser<P, T> {

    private final Function<String, P> prefixParser;
    private final Function<String, T> idParser;
    private final String recordName;

    public PrefixedCountLineParser(Function<String, P> prefixParser, Function<String, T> idParser,
                                   String recordName) {
        this.prefixParser = prefixParser;
        this.idParser = idParser;
        this.recordName = recordName;
    }

    public List<PrefixedCountLine<P, T>> parse(Path path) {
        List<PrefixedCountLine<P, T>> result = new ArrayList<>();
        for (NumberedLine line : LegacyText.nonBlankLines(path)) {
            try {
                result.add(parseLine(line.text()));
            } catch (MapLoadException e) {
                throw new MapLoadException(e.getKind(), path,
                        "Line " + line.number() + ": " + e.getDetail(), e);
            }
        }
        return List.copyOf(result);
    }

    public PrefixedCountLine<P, T> parseLine(String line) {
        String[] tokens = line.trim().split("\\s+");
        if (tokens.length < 2) {
            throw invalid(line);
        }
        P prefix;
        int declared;
        try {
            prefix = prefixParser.apply(tokens[0]);
            declared = Scalars.parseInt(tokens[1], recordName + " length");
        } catch (MapLoadException e) {
            throw new MapLoadException(ErrorKind.VALIDATION, null,
                    "Invalid " + recordName + ": '" + line.trim() + "' (" + e.getDetail() + ")", e);
        }
        List<T> ids = new ArrayList<>();
        for (int i = 2; i < tokens.length; i++) {
            tryParseId(tokens[i]).ifPresent(ids::add);
        }
        if (declared != ids.size()) {
            throw invalid(line);
        }
        return new PrefixedCountLine<>(prefix, declared, ids);
    }

    private Optional<T> tryParseId(String token) {
        try {
            return Optional.of(idParser.apply(token));
        } catch (MapLoadException e) {
            return Optional.empty();
        }
    }

    private MapLoadException invalid(String line) {
        return MapLoadException.validation("Invalid " + recordName + ": '" + line.trim() + "'");
    }
}
