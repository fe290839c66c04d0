package com.worldgen.parser;

/**
 * How {@link DelimitedRecordReader} reacts to a row that fails to decode.
 */
public enum RowDecodeMode {
    STRICT,     // First bad row fails the whole file
    LOOSE       // Bad rows are logged and skipped
}
