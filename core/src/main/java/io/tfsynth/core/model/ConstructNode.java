package io.tfsynth.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One node of the construct tree. Immutable: adding a child produces a new node (see {@code
 * ConstructTree#addChild}).
 *
 * <p>
 * {@code path} is the chain of ancestor ids down to and including {@code id}. Children keep
 * insertion order, which is the order elements appear in the synthesized document.
 *
 * @param id       identifier, unique among siblings
 * @param path     ancestor ids including this node
 * @param children ordered child nodes
 * @param metadata element-specific data
 */
public record ConstructNode(String id, List<String> path, List<ConstructNode> children, ConstructMetadata metadata) {

    public ConstructNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        path = List.copyOf(Objects.requireNonNull(path, "path must not be null"));
        children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
    }

    /** The metadata kind of this node. */
    public ConstructMetadata.Kind kind() {
        return metadata.kind();
    }

    /** Returns a copy of this node with the given children. */
    public ConstructNode withChildren(List<ConstructNode> newChildren) {
        return new ConstructNode(id, path, newChildren, metadata);
    }

    /** The construct path joined with {@code /}, as used in the manifest. */
    public String constructPath() {
        return String.join("/", path);
    }

    @Override
    public String toString() {
        return "ConstructNode[" + metadata.kind() + " " + constructPath() + ", children=" + children.size() + "]";
    }
}
