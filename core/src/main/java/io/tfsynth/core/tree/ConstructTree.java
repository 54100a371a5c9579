package io.tfsynth.core.tree;

import io.tfsynth.core.error.UnknownConstructPathException;
import io.tfsynth.core.model.ConstructMetadata;
import io.tfsynth.core.model.ConstructNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Operations on the immutable construct tree. Updates rebuild the spine from the root to the
 * changed node and return the new root; untouched subtrees are shared.
 *
 * <p>
 * Lookups report a missing path as {@link Optional#empty()}. Updates that target a missing path
 * are programming errors and throw {@link UnknownConstructPathException}.
 */
public final class ConstructTree {

    private ConstructTree() {}

    /**
     * Creates a childless node.
     *
     * @throws IllegalArgumentException if {@code path} is non-empty and does not end with {@code id}
     */
    public static ConstructNode createNode(String id, List<String> path, ConstructMetadata metadata) {
        Objects.requireNonNull(path, "path must not be null");
        if (!path.isEmpty() && !path.get(path.size() - 1).equals(id)) {
            throw new IllegalArgumentException("path " + path + " must end with the node id '" + id + "'");
        }
        return new ConstructNode(id, path, List.of(), metadata);
    }

    /**
     * Creates a node as a child of {@code parent}: its path is the parent's path plus {@code id}.
     * The node is not attached; pass it to {@link #addChild}.
     */
    public static ConstructNode childOf(ConstructNode parent, String id, ConstructMetadata metadata) {
        List<String> path = new ArrayList<>(parent.path());
        path.add(id);
        return createNode(id, path, metadata);
    }

    /**
     * Returns a new tree with {@code child} appended to the children of the node at {@code
     * parentPath}.
     *
     * @throws IllegalArgumentException      if {@code child}'s path is not {@code parentPath} plus its id
     * @throws UnknownConstructPathException if no node has {@code parentPath}
     */
    public static ConstructNode addChild(ConstructNode tree, List<String> parentPath, ConstructNode child) {
        Objects.requireNonNull(child, "child must not be null");
        List<String> expected = new ArrayList<>(parentPath);
        expected.add(child.id());
        if (!pathEquals(child.path(), expected)) {
            throw new IllegalArgumentException(
                    "child path " + child.path() + " does not match its position " + expected);
        }
        return updateNode(tree, parentPath, parent -> {
            List<ConstructNode> children = new ArrayList<>(parent.children());
            children.add(child);
            return parent.withChildren(children);
        });
    }

    /**
     * Returns a new tree where the node at {@code path} is replaced by {@code updater}'s result.
     *
     * @throws UnknownConstructPathException if no node has {@code path}
     */
    public static ConstructNode updateNode(ConstructNode tree, List<String> path, UnaryOperator<ConstructNode> updater) {
        ConstructNode updated = update(tree, path, updater);
        if (updated == null) {
            throw new UnknownConstructPathException("No construct at path " + String.join("/", path), path);
        }
        return updated;
    }

    /**
     * Returns a new tree without the node at {@code path} (and its subtree).
     *
     * @throws UnknownConstructPathException if no node has {@code path}, or if it is the root
     */
    public static ConstructNode removeNode(ConstructNode tree, List<String> path) {
        if (path.size() < 2 || findNode(tree, path).isEmpty() || pathEquals(tree.path(), path)) {
            throw new UnknownConstructPathException("No removable construct at path " + String.join("/", path), path);
        }
        return updateNode(tree, path.subList(0, path.size() - 1), parent -> {
            List<ConstructNode> children = new ArrayList<>(parent.children());
            children.removeIf(c -> pathEquals(c.path(), path));
            return parent.withChildren(children);
        });
    }

    /** Finds the node whose path equals {@code path}. */
    public static Optional<ConstructNode> findNode(ConstructNode tree, List<String> path) {
        if (pathEquals(tree.path(), path)) {
            return Optional.of(tree);
        }
        for (ConstructNode child : tree.children()) {
            Optional<ConstructNode> found = findNode(child, path);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /** Pre-order walk; returns the visitor results in visit order. */
    public static <T> List<T> walkTree(ConstructNode tree, NodeVisitor<T> visitor) {
        List<T> results = new ArrayList<>();
        walkPre(tree, visitor, 0, results);
        return results;
    }

    /** Post-order walk: children before their parent. */
    public static <T> List<T> walkTreePost(ConstructNode tree, NodeVisitor<T> visitor) {
        List<T> results = new ArrayList<>();
        walkPost(tree, visitor, 0, results);
        return results;
    }

    /** All descendants in pre-order, excluding {@code node} itself. */
    public static List<ConstructNode> getDescendants(ConstructNode node) {
        return getDescendants(node, null);
    }

    /**
     * Descendants in pre-order, excluding {@code node} itself, optionally restricted to one kind.
     *
     * @param kind the kind to keep, or null for all kinds
     */
    public static List<ConstructNode> getDescendants(ConstructNode node, ConstructMetadata.Kind kind) {
        List<ConstructNode> result = new ArrayList<>();
        collect(node, kind, result);
        return result;
    }

    public static boolean pathEquals(List<String> a, List<String> b) {
        return a.equals(b);
    }

    // Returns null when the path was not found anywhere below tree.
    private static ConstructNode update(ConstructNode tree, List<String> path, UnaryOperator<ConstructNode> updater) {
        if (pathEquals(tree.path(), path)) {
            return updater.apply(tree);
        }
        List<ConstructNode> children = tree.children();
        for (int i = 0; i < children.size(); i++) {
            ConstructNode updated = update(children.get(i), path, updater);
            if (updated != null) {
                List<ConstructNode> newChildren = new ArrayList<>(children);
                newChildren.set(i, updated);
                return tree.withChildren(newChildren);
            }
        }
        return null;
    }

    private static <T> void walkPre(ConstructNode node, NodeVisitor<T> visitor, int depth, List<T> out) {
        out.add(visitor.visit(node, depth));
        for (ConstructNode child : node.children()) {
            walkPre(child, visitor, depth + 1, out);
        }
    }

    private static <T> void walkPost(ConstructNode node, NodeVisitor<T> visitor, int depth, List<T> out) {
        for (ConstructNode child : node.children()) {
            walkPost(child, visitor, depth + 1, out);
        }
        out.add(visitor.visit(node, depth));
    }

    private static void collect(ConstructNode node, ConstructMetadata.Kind kind, List<ConstructNode> out) {
        for (ConstructNode child : node.children()) {
            if (kind == null || child.kind() == kind) {
                out.add(child);
            }
            collect(child, kind, out);
        }
    }
}
