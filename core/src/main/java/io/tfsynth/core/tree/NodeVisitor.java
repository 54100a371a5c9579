package io.tfsynth.core.tree;

import io.tfsynth.core.model.ConstructNode;

/** Callback for {@link ConstructTree#walkTree}; {@code depth} is 0 for the node walked from. */
@FunctionalInterface
public interface NodeVisitor<T> {

    T visit(ConstructNode node, int depth);
}
