package com.worldgen.model;

import java.util.List;

/**
 * The railways file, in file order.
 */
public record Railways(List<Railway> railways) {

    public Railways {
        railways = List.copyOf(railways);
    }

    public int size() {
        return railways.size();
    }
}
