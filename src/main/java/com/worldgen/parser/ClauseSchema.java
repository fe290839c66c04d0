package com.worldgen.parser;

import com.worldgen.exception.MapLoadException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declares which keys a decoded block understands and what happens when a key repeats.
 * <p>
 * Repetition is a property of the field, not of the container shape: a
 * {@link RepeatPolicy#ACCUMULATE} field collects every occurrence in file order, while a
 * {@link RepeatPolicy#REPLACE} field keeps the last one. Keys that are not declared are
 * ignored.
 * <pre>
 * ClauseSchema weather = ClauseSchema.builder()
 *         .duplicated("period")
 *         .build();
 * </pre>
 */
public final class ClauseSchema {

    public enum RepeatPolicy {
        REPLACE,
        ACCUMULATE
    }

    /**
     * How one key is decoded.
     *
     * @param required whether decoding fails when the key is absent
     * @param repeat   what a repeated key does
     */
    public record FieldSpec(boolean required, RepeatPolicy repeat) {}

    private final Map<String, FieldSpec> fields;

    private ClauseSchema(Map<String, FieldSpec> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, FieldSpec> fields() {
        return fields;
    }

    FieldSpec spec(String key) {
        FieldSpec spec = fields.get(key);
        if (spec == null) {
            throw new IllegalArgumentException("Key '" + key + "' is not declared in this schema");
        }
        return spec;
    }

    /**
     * Applies this schema to the fields of {@code block}.
     *
     * @throws MapLoadException of kind {@code DECODE} when a required key is missing
     */
    public ClauseRecord decode(ClauseBlock block) {
        Map<String, ClauseValue> single = new LinkedHashMap<>();
        Map<String, List<ClauseValue>> accumulated = new LinkedHashMap<>();
        for (ClauseField field : block.fields()) {
            FieldSpec spec = fields.get(field.key());
            if (spec == null) {
                continue;
            }
            if (spec.repeat() == RepeatPolicy.ACCUMULATE) {
                accumulated.computeIfAbsent(field.key(), k -> new ArrayList<>()).add(field.value());
            } else {
                single.put(field.key(), field.value());
            }
        }
        for (Map.Entry<String, FieldSpec> entry : fields.entrySet()) {
            String key = entry.getKey();
            if (entry.getValue().required()
                    && !single.containsKey(key) && !accumulated.containsKey(key)) {
                throw MapLoadException.decode("Missing required field '" + key + "'");
            }
        }
        return new ClauseRecord(this, single, accumulated);
    }

    public static final class Builder {

        private final Map<String, FieldSpec> fields = new LinkedHashMap<>();

        private Builder() {
        }

        /** Keys that must be present; a repeat replaces the earlier value. */
        public Builder required(String... keys) {
            return declare(new FieldSpec(true, RepeatPolicy.REPLACE), keys);
        }

        /** Keys that may be absent; a repeat replaces the earlier value. */
        public Builder optional(String... keys) {
            return declare(new FieldSpec(false, RepeatPolicy.REPLACE), keys);
        }

        /** Keys whose every occurrence is kept, in order. Zero occurrences decode as an empty list. */
        public Builder duplicated(String... keys) {
            return declare(new FieldSpec(false, RepeatPolicy.ACCUMULATE), keys);
        }

        /** Like {@link #duplicated}, but at least one occurrence is required. */
        public Builder duplicatedRequired(String... keys) {
            return declare(new FieldSpec(true, RepeatPolicy.ACCUMULATE), keys);
        }

        private Builder declare(FieldSpec spec, String... keys) {
            for (String key : keys) {
                if (fields.putIfAbsent(key, spec) != null) {
                    throw new IllegalArgumentException("Key '" + key + "' declared twice");
                }
            }
            return this;
        }

        public ClauseSchema build() {
            return new ClauseSchema(fields);
        }
    }
}
