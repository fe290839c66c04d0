package com.worldgen.parser;

import com.worldgen.exception.MapLoadException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads map text files. Map files use a legacy single-byte encoding, so every byte is
 * mapped to the code point of the same value.
 */
public final class LegacyText {

    public static final Charset CHARSET = StandardCharsets.ISO_8859_1;

    /** The UTF-8 byte order mark as it reads in {@link #CHARSET}. */
    static final String BYTE_ORDER_MARK = "\u00EF\u00BB\u00BF";

    private LegacyText() {
    }

    public static String read(Path path) {
        try {
            return stripByteOrderMark(Files.readString(path, CHARSET));
        } catch (NoSuchFileException e) {
            throw MapLoadException.fileNotFound(path);
        } catch (IOException e) {
            throw MapLoadException.io(path, "Unable to read file", e);
        }
    }

    public static BufferedReader open(Path path) {
        try {
            BufferedReader reader = Files.newBufferedReader(path, CHARSET);
            try {
                skipByteOrderMark(reader);
            } catch (IOException e) {
                reader.close();
                throw e;
            }
            return reader;
        } catch (NoSuchFileException e) {
            throw MapLoadException.fileNotFound(path);
        } catch (IOException e) {
            throw MapLoadException.io(path, "Unable to open file", e);
        }
    }

    static String stripByteOrderMark(String text) {
        return text.startsWith(BYTE_ORDER_MARK) ? text.substring(BYTE_ORDER_MARK.length()) : text;
    }

    private static void skipByteOrderMark(BufferedReader reader) throws IOException {
        char[] head = new char[BYTE_ORDER_MARK.length()];
        reader.mark(head.length);
        int read = reader.read(head, 0, head.length);
        if (read != head.length || !BYTE_ORDER_MARK.equals(new String(head))) {
            reader.reset();
        }
    }

    /**
     * Returns the non-blank lines of a file with their 1-based line numbers.
     */
    public static List<NumberedLine> nonBlankLines(Path path) {
        String[] lines = read(path).split("\r?\n|\r", -1);
        List<NumberedLine> result = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].isBlank()) {
                result.add(new NumberedLine(i + 1, lines[i]));
            }
        }
        return result;
    }

    /**
     * A single line of text and where it was found.
     */
    public record NumberedLine(int number, String text) {}
}
