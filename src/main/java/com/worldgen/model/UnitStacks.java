package com.worldgen.model;

import java.util.List;

/**
 * The unit stacks file, in file order.
 */
public record UnitStacks(List<UnitStack> stacks) {

    public UnitStacks {
        stacks = List.copyOf(stacks);
    }

    public int size() {
        return stacks.size();
    }
}
