package com.worldgen.exception;

/**
 * Category of a map loading failure.
 */
public enum ErrorKind {
    IO,             // File missing or unreadable
    FORMAT,         // Malformed scalar, clause or CSV token
    DECODE,         // Well-formed tokens with the wrong shape
    VALIDATION      // Domain rule violated
}
