package com.worldgen.parser;

/**
 * Renders a {@link ClauseBlock} tree back to clause text that {@link ClauseParser} reads
 * into an equal tree. Blocks holding only scalars are written on one line.
 */
public final class ClauseWriter {

    private static final String INDENT = "\t";

    private ClauseWriter() {
    }

    public static String write(ClauseBlock root) {
        StringBuilder out = new StringBuilder();
        writeContents(root, 0, out);
        return out.toString();
    }

    private static void writeContents(ClauseBlock block, int depth, StringBuilder out) {
        for (ClauseField field : block.fields()) {
            indent(depth, out);
            out.append(field.key()).append(' ').append(field.operator()).append(' ');
            writeValue(field.value(), depth, out);
            out.append('\n');
        }
        for (ClauseValue item : block.items()) {
            indent(depth, out);
            writeValue(item, depth, out);
            out.append('\n');
        }
    }

    private static void writeValue(ClauseValue value, int depth, StringBuilder out) {
        if (value instanceof ClauseScalar scalar) {
            writeScalar(scalar, out);
            return;
        }
        ClauseBlock block = value.asBlock();
        if (block.tag() != null) {
            out.append(block.tag()).append(' ');
        }
        if (block.isEmpty()) {
            out.append("{ }");
        } else if (block.fields().isEmpty() && block.items().stream().allMatch(ClauseValue::isScalar)) {
            out.append("{ ");
            for (ClauseValue item : block.items()) {
                writeScalar(item.asScalar(), out);
                out.append(' ');
            }
            out.append('}');
        } else {
            out.append("{\n");
            writeContents(block, depth + 1, out);
            indent(depth, out);
            out.append('}');
        }
    }

    private static void writeScalar(ClauseScalar scalar, StringBuilder out) {
        if (!scalar.quoted()) {
            out.append(scalar.text());
            return;
        }
        out.append('"');
        for (char c : scalar.text().toCharArray()) {
            if (c == '"' || c == '\\') {
                out.append('\\');
            }
            out.append(c);
        }
        out.append('"');
    }

    private static void indent(int depth, StringBuilder out) {
        out.append(INDENT.repeat(depth));
    }
}
