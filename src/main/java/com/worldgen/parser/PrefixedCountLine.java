package com.worldgen.parser;

import java.util.List;

/**
 * A line of the form {@code <prefix> <count> <id> <id> ...} whose count matched its ids.
 *
 * @param prefix        decoded first token
 * @param declaredCount the count given in the second token
 * @param ids           the ids that followed, in order
 */
public record PrefixedCountLine<P, T>(P prefix, int declaredCount, List<T> ids) {

    public PrefixedCountLine {
        ids = List.copyOf(ids);
    }
}
