package com.worldgen.parser;

/**
 * Turns one delimited row into a typed record.
 */
@FunctionalInterface
public interface RowDecoder<T> {

    T decode(DelimitedRow row);
}
