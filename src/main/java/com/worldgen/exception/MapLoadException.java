package com.worldgen.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Raised when a map file cannot be loaded into a complete, valid value.
 * <p>
 * Every loader either returns a fully built catalog or throws this exception for the
 * first problem it finds. The {@link ErrorKind} tells callers which stage of decoding
 * rejected the input.
 */
@Getter
public class MapLoadException extends RuntimeException {

    private final ErrorKind kind;
    private final Path path;
    private final String detail;

    public MapLoadException(ErrorKind kind, String message) {
        this(kind, null, message, null);
    }

    public MapLoadException(ErrorKind kind, Path path, String message) {
        this(kind, path, message, null);
    }

    public MapLoadException(ErrorKind kind, Path path, String message, Throwable cause) {
        super(path == null ? message : message + " [" + path + "]", cause);
        this.kind = kind;
        this.path = path;
        this.detail = message;
    }

    public static MapLoadException io(Path path, String message, Throwable cause) {
        return new MapLoadException(ErrorKind.IO, path, message, cause);
    }

    public static MapLoadException fileNotFound(Path path) {
        return new MapLoadException(ErrorKind.IO, path, "File not found");
    }

    public static MapLoadException format(String message) {
        return new MapLoadException(ErrorKind.FORMAT, message);
    }

    public static MapLoadException format(String message, Throwable cause) {
        return new MapLoadException(ErrorKind.FORMAT, null, message, cause);
    }

    public static MapLoadException decode(String message) {
        return new MapLoadException(ErrorKind.DECODE, message);
    }

    public static MapLoadException validation(String message) {
        return new MapLoadException(ErrorKind.VALIDATION, message);
    }

    public static MapLoadException validation(Path path, String message) {
        return new MapLoadException(ErrorKind.VALIDATION, path, message);
    }

    /**
     * Returns a copy of this failure attributed to {@code file}, unless it already names a file.
     */
    public MapLoadException inFile(Path file) {
        if (path != null) {
            return this;
        }
        return new MapLoadException(kind, file, detail, this);
    }
}
