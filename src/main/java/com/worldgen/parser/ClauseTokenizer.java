package com.worldgen.parser;

import com.worldgen.exception.MapLoadException;

/**
 * Splits clause text into tokens: braces, operators, quoted strings and bare words.
 * Comments run from {@code #} to the end of the line.
 */
final class ClauseTokenizer {

    enum Type {
        OPEN,
        CLOSE,
        OPERATOR,
        WORD,
        QUOTED,
        END
    }

    record Token(Type type, String text, int line, int column) {

        boolean isKeyCandidate() {
            return type == Type.WORD || type == Type.QUOTED;
        }

        String describe() {
            return type == Type.END ? "end of input" : "'" + text + "'";
        }
    }

    private final String source;
    private int pos;
    private int line = 1;
    private int lineStart;
    private Token peeked;

    ClauseTokenizer(String source) {
        this.source = source;
    }

    Token peek() {
        if (peeked == null) {
            peeked = read();
        }
        return peeked;
    }

    Token next() {
        Token token = peek();
        peeked = null;
        return token;
    }

    MapLoadException error(Token at, String message) {
        return MapLoadException.format(message + " at line " + at.line() + ", column " + at.column());
    }

    private Token read() {
        skipWhitespaceAndComments();
        if (pos >= source.length()) {
            return token(Type.END, "", pos);
        }
        int start = pos;
        char c = source.charAt(pos);
        switch (c) {
            case '{':
                pos++;
                return token(Type.OPEN, "{", start);
            case '}':
                pos++;
                return token(Type.CLOSE, "}", start);
            case '"':
                return readQuoted();
            case '=':
                pos++;
                if (pos < source.length() && source.charAt(pos) == '=') {
                    pos++;
                }
                return token(Type.OPERATOR, source.substring(start, pos), start);
            case '<':
            case '>':
                pos++;
                if (pos < source.length() && source.charAt(pos) == '=') {
                    pos++;
                }
                return token(Type.OPERATOR, source.substring(start, pos), start);
            default:
                if ((c == '!' || c == '?') && pos + 1 < source.length() && source.charAt(pos + 1) == '=') {
                    pos += 2;
                    return token(Type.OPERATOR, source.substring(start, pos), start);
                }
                return readWord();
        }
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                pos++;
                line++;
                lineStart = pos;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                return;
            }
        }
    }

    private Token readQuoted() {
        int start = pos;
        int startLine = line;
        int startColumn = pos - lineStart + 1;
        pos++;
        StringBuilder text = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == '"') {
                return new Token(Type.QUOTED, text.toString(), startLine, startColumn);
            }
            if (c == '\\' && pos < source.length()) {
                char escaped = source.charAt(pos++);
                if (escaped != '"' && escaped != '\\') {
                    text.append('\\');
                }
                text.append(escaped);
                continue;
            }
            if (c == '\n') {
                line++;
                lineStart = pos;
            }
            text.append(c);
        }
        throw MapLoadException.format("Unterminated quoted string at line " + startLine
                + ", column " + startColumn + " (offset " + start + ")");
    }

    private Token readWord() {
        int start = pos;
        while (pos < source.length() && !endsWord(pos)) {
            pos++;
        }
        return token(Type.WORD, source.substring(start, pos), start);
    }

    private boolean endsWord(int at) {
        char c = source.charAt(at);
        if (Character.isWhitespace(c)) {
            return true;
        }
        switch (c) {
            case '{', '}', '=', '<', '>', '#', '"':
                return true;
            case '!', '?':
                return at + 1 < source.length() && source.charAt(at + 1) == '=';
            default:
                return false;
        }
    }

    private Token token(Type type, String text, int start) {
        return new Token(type, text, line, start - lineStart + 1);
    }
}
