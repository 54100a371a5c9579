package io.tfsynth.core.error;

import java.util.List;

/**
 * Thrown when two elements of a stack synthesize to the same key of the same block, which would
 * silently drop one of them from the document.
 */
public final class LogicalIdCollisionException extends SynthException {

    private static final long serialVersionUID = 1L;

    private final List<String> collisions;

    public LogicalIdCollisionException(List<String> stackPath, List<String> collisions) {
        super(
                "Logical id collision in stack " + String.join("/", stackPath) + ": " + String.join("; ", collisions),
                stackPath,
                Phase.SYNTHESIS);
        this.collisions = List.copyOf(collisions);
    }

    /** One human-readable description per colliding key. */
    public List<String> collisions() {
        return collisions;
    }
}
