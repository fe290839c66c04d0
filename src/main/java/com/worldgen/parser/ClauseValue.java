package com.worldgen.parser;

import com.worldgen.exception.MapLoadException;

/**
 * A value in a clause file: either a scalar token or a {@code { ... }} block.
 */
public interface ClauseValue {

    default boolean isScalar() {
        return this instanceof ClauseScalar;
    }

    default boolean isBlock() {
        return this instanceof ClauseBlock;
    }

    default ClauseScalar asScalar() {
        if (this instanceof ClauseScalar scalar) {
            return scalar;
        }
        throw MapLoadException.decode("Expected a scalar value but found a block");
    }

    default ClauseBlock asBlock() {
        if (this instanceof ClauseBlock block) {
            return block;
        }
        throw MapLoadException.decode("Expected a block but found '" + asScalar().text() + "'");
    }
}
