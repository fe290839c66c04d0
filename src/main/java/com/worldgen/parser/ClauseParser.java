package com.worldgen.parser;

import com.worldgen.exception.MapLoadException;
import com.worldgen.parser.ClauseTokenizer.Token;
import com.worldgen.parser.ClauseTokenizer.Type;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Parses the clause-object text format into a tree of {@link ClauseBlock}s.
 * <pre>
 * strategic_region = {
 *     id = 1
 *     name = "REGION_1"
 *     provinces = { 2 6 8 }
 * }
 * </pre>
 * The parser only builds the tree; decoding into domain values happens through
 * {@link ClauseSchema}.
 */
public final class ClauseParser {

    private static final Set<String> COLOR_TAGS = Set.of("rgb", "hsv", "hsv360");

    private final ClauseTokenizer tokenizer;

    private ClauseParser(String source) {
        this.tokenizer = new ClauseTokenizer(source);
    }

    /**
     * Parses clause text. The returned block is the file's top level.
     */
    public static ClauseBlock parse(String source) {
        ClauseParser parser = new ClauseParser(source);
        return parser.parseBlock(false);
    }

    /**
     * Reads a file in the legacy encoding and parses it.
     */
    public static ClauseBlock parseFile(Path path) {
        String source = LegacyText.read(path);
        try {
            return parse(source);
        } catch (MapLoadException e) {
            throw e.inFile(path);
        }
    }

    /**
     * Parses a file and decodes its top level with {@code decoder}. Any failure is
     * attributed to the file.
     */
    public static <T> T decodeFile(Path path, Function<ClauseBlock, T> decoder) {
        ClauseBlock root = parseFile(path);
        try {
            return decoder.apply(root);
        } catch (MapLoadException e) {
            throw e.inFile(path);
        }
    }

    private ClauseBlock parseBlock(boolean nested) {
        List<ClauseField> fields = new ArrayList<>();
        List<ClauseValue> items = new ArrayList<>();
        while (true) {
            Token token = tokenizer.next();
            switch (token.type()) {
                case END:
                    if (nested) {
                        throw tokenizer.error(token, "Unclosed block");
                    }
                    return new ClauseBlock(fields, items);
                case CLOSE:
                    if (!nested) {
                        throw tokenizer.error(token, "Unexpected '}'");
                    }
                    return new ClauseBlock(fields, items);
                case OPEN:
                    items.add(parseBlock(true));
                    break;
                case OPERATOR:
                    throw tokenizer.error(token, "Operator " + token.describe() + " without a key");
                default:
                    parseEntry(token, fields, items);
            }
        }
    }

    private void parseEntry(Token keyToken, List<ClauseField> fields, List<ClauseValue> items) {
        Token following = tokenizer.peek();
        if (following.type() == Type.OPERATOR) {
            tokenizer.next();
            fields.add(new ClauseField(keyToken.text(), following.text(), parseValue()));
        } else if (following.type() == Type.OPEN && keyToken.type() == Type.WORD
                && !COLOR_TAGS.contains(keyToken.text())) {
            // key { ... } without an operator
            tokenizer.next();
            fields.add(new ClauseField(keyToken.text(), "=", parseBlock(true)));
        } else {
            items.add(scalar(keyToken));
        }
    }

    private ClauseValue parseValue() {
        Token token = tokenizer.next();
        if (token.type() == Type.OPEN) {
            return parseBlock(true);
        }
        if (!token.isKeyCandidate()) {
            throw tokenizer.error(token, "Expected a value but found " + token.describe());
        }
        if (token.type() == Type.WORD && COLOR_TAGS.contains(token.text())
                && tokenizer.peek().type() == Type.OPEN) {
            tokenizer.next();
            ClauseBlock body = parseBlock(true);
            return new ClauseBlock(token.text(), body.fields(), body.items());
        }
        return scalar(token);
    }

    private static ClauseScalar scalar(Token token) {
        return new ClauseScalar(token.text(), token.type() == Type.QUOTED);
    }
}
