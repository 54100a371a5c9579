package io.tfsynth.core.error;

import java.util.List;

/** Thrown when a tree operation names a parent or target path that does not exist. */
public final class UnknownConstructPathException extends SynthException {

    private static final long serialVersionUID = 1L;

    public UnknownConstructPathException(String message, List<String> path) {
        super(message, path, Phase.CONSTRUCTION);
    }
}
