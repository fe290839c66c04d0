package com.worldgen.parser;

import com.worldgen.exception.MapLoadException;
import com.worldgen.parser.ClauseSchema.RepeatPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * The fields of one block after a {@link ClauseSchema} has been applied.
 * <p>
 * Accessors take a decoder for the field's value; a decoder failure is reported with
 * the field name prepended so errors point at the offending key.
 */
public final class ClauseRecord {

    private final ClauseSchema schema;
    private final Map<String, ClauseValue> single;
    private final Map<String, List<ClauseValue>> accumulated;

    ClauseRecord(ClauseSchema schema, Map<String, ClauseValue> single,
                 Map<String, List<ClauseValue>> accumulated) {
        this.schema = schema;
        this.single = single;
        this.accumulated = accumulated;
    }

    public <T> T get(String key, Function<ClauseValue, T> decoder) {
        return find(key, decoder).orElseThrow(
                () -> MapLoadException.decode("Missing required field '" + key + "'"));
    }

    public <T> Optional<T> find(String key, Function<ClauseValue, T> decoder) {
        expect(key, RepeatPolicy.REPLACE);
        ClauseValue value = single.get(key);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(apply(key, value, decoder));
    }

    /**
     * Every occurrence of a duplicated key, in file order.
     */
    public <T> List<T> getAll(String key, Function<ClauseValue, T> decoder) {
        expect(key, RepeatPolicy.ACCUMULATE);
        List<T> result = new ArrayList<>();
        for (ClauseValue value : accumulated.getOrDefault(key, List.of())) {
            result.add(apply(key, value, decoder));
        }
        return List.copyOf(result);
    }

    /**
     * The items of an array-valued field, each decoded with {@code decoder}.
     */
    public <T> List<T> getList(String key, Function<ClauseValue, T> decoder) {
        return get(key, value -> decodeItems(value, decoder));
    }

    public String getString(String key) {
        return get(key, v -> v.asScalar().text());
    }

    public int getInt(String key) {
        return get(key, v -> v.asScalar().asInt());
    }

    public double getDouble(String key) {
        return get(key, v -> v.asScalar().asDouble());
    }

    public boolean getBoolean(String key) {
        return get(key, v -> v.asScalar().asBoolean());
    }

    public ClauseBlock getBlock(String key) {
        return get(key, ClauseValue::asBlock);
    }

    public static <T> List<T> decodeItems(ClauseValue value, Function<ClauseValue, T> decoder) {
        ClauseBlock block = value.asBlock();
        if (!block.fields().isEmpty()) {
            throw MapLoadException.decode("Expected a list of values but found keyed fields");
        }
        List<T> result = new ArrayList<>(block.items().size());
        for (ClauseValue item : block.items()) {
            result.add(decoder.apply(item));
        }
        return List.copyOf(result);
    }

    private void expect(String key, RepeatPolicy policy) {
        if (schema.spec(key).repeat() != policy) {
            throw new IllegalArgumentException("Key '" + key + "' is declared as " + schema.spec(key).repeat());
        }
    }

    private static <T> T apply(String key, ClauseValue value, Function<ClauseValue, T> decoder) {
        try {
            return decoder.apply(value);
        } catch (MapLoadException e) {
            throw new MapLoadException(e.getKind(), e.getPath(), "Field '" + key + "': " + e.getDetail(), e);
        }
    }
}
