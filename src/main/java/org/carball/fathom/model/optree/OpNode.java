package org.carball.fathom.model.optree;

import java.util.List;
import java.util.Objects;

/**
 * One op of a parsed program. Children are kept in source order and the list is immutable.
 */
public record OpNode(String name, OpFamily family, List<OpNode> children) {

    public OpNode {
        Objects.requireNonNull(name, "op name");
        family = family != null ? family : OpFamily.BASE;
        children = children != null ? List.copyOf(children) : List.of();
    }

    public static OpNode leaf(String name, OpFamily family) {
        return new OpNode(name, family, List.of());
    }

    public static OpNode of(String name, OpFamily family, OpNode... children) {
        return new OpNode(name, family, List.of(children));
    }

    @Override
    public String toString() {
        return name + "(" + family + ")";
    }
}
