package com.worldgen.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A {@code { ... }} block, or the top level of a clause file.
 * <p>
 * A block holds keyed fields (an object block), bare values (an array block), or both.
 * Field order and repeated keys are kept exactly as written; interpreting repeats is left
 * to {@link ClauseSchema}.
 */
public final class ClauseBlock implements ClauseValue {

    private final String tag;
    private final List<ClauseField> fields;
    private final List<ClauseValue> items;

    public ClauseBlock(String tag, List<ClauseField> fields, List<ClauseValue> items) {
        this.tag = tag;
        this.fields = List.copyOf(fields);
        this.items = List.copyOf(items);
    }

    public ClauseBlock(List<ClauseField> fields, List<ClauseValue> items) {
        this(null, fields, items);
    }

    public static ClauseBlock ofItems(List<? extends ClauseValue> items) {
        return new ClauseBlock(List.of(), List.copyOf(items));
    }

    public static <T> ClauseBlock ofItems(List<T> values, Function<T, ? extends ClauseValue> encoder) {
        return ofItems(values.stream().map(encoder).toList());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Colour blocks may be prefixed with a tag such as {@code rgb} or {@code hsv}.
     */
    public String tag() {
        return tag;
    }

    public List<ClauseField> fields() {
        return fields;
    }

    public List<ClauseValue> items() {
        return items;
    }

    public boolean isEmpty() {
        return fields.isEmpty() && items.isEmpty();
    }

    public ClauseRecord decode(ClauseSchema schema) {
        return schema.decode(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClauseBlock other)) return false;
        return Objects.equals(tag, other.tag)
                && fields.equals(other.fields)
                && items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, fields, items);
    }

    @Override
    public String toString() {
        return "ClauseBlock{fields=" + fields.size() + ", items=" + items.size() + "}";
    }

    /**
     * Assembles blocks for the writer.
     */
    public static final class Builder {

        private String tag;
        private final List<ClauseField> fields = new ArrayList<>();
        private final List<ClauseValue> items = new ArrayList<>();

        private Builder() {
        }

        public Builder tag(String tag) {
            this.tag = tag;
            return this;
        }

        public Builder field(String key, ClauseValue value) {
            fields.add(new ClauseField(key, value));
            return this;
        }

        public Builder field(String key, int value) {
            return field(key, ClauseScalar.of(value));
        }

        public Builder field(String key, double value) {
            return field(key, ClauseScalar.of(value));
        }

        public Builder field(String key, boolean value) {
            return field(key, ClauseScalar.of(value));
        }

        public Builder quoted(String key, String value) {
            return field(key, ClauseScalar.quoted(value));
        }

        public Builder item(ClauseValue value) {
            items.add(value);
            return this;
        }

        public ClauseBlock build() {
            return new ClauseBlock(tag, fields, items);
        }
    }
}
