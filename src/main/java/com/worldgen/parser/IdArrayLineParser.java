package com.worldgen.parser;

import com.worldgen.exception.MapLoadException;
import com.worldgen.parser.LegacyText.NumberedLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Parses files where every line reads {@code <key> = { <value> <value> ... }}.
 * <p>
 * Each line goes through the clause parser on its own. A later line with the same key
 * replaces the earlier one. A single malformed line fails the whole file.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class IdArrayLineParser<K, V> {

    private final Function<String, K> keyParser;
    private final Function<String, V> valueParser;

    public IdArrayLineParser(Function<String, K> keyParser, Function<String, V> valueParser) {
        this.keyParser = keyParser;
        this.valueParser = valueParser;
    }

    public Map<K, List<V>> parse(Path path) {
        Map<K, List<V>> result = new LinkedHashMap<>();
        for (NumberedLine line : LegacyText.nonBlankLines(path)) {
            try {
                parseLine(line.text(), result);
            } catch (MapLoadException e) {
                throw new MapLoadException(e.getKind(), path,
                        "Line " + line.number() + ": " + e.getDetail(), e);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Parses one line into {@code into}, replacing any entry with the same key.
     */
    public void parseLine(String line, Map<K, List<V>> into) {
        ClauseBlock block = ClauseParser.parse(line);
        if (!block.items().isEmpty() || block.fields().isEmpty()) {
            throw MapLoadException.decode("Expected '<id> = { <id> ... }' but found '" + line.trim() + "'");
        }
        for (ClauseField field : block.fields()) {
            K key = keyParser.apply(field.key());
            List<V> values = new ArrayList<>();
            for (ClauseValue item : ClauseRecord.decodeItems(field.value(), Function.identity())) {
                values.add(valueParser.apply(item.asScalar().text()));
            }
            into.put(key, List.copyOf(values));
        }
    }
}
