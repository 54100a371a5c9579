package io.tfsynth.core.error;

import java.util.List;

/**
 * Abstract base for all tf-synth exceptions. Never thrown directly; use the concrete subclasses.
 * Validation findings are reported as data ({@code ValidationError}) and only become an
 * exception when a caller asks for a validated synthesis.
 */
public abstract class SynthException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        CONSTRUCTION,
        VALIDATION,
        SYNTHESIS
    }

    private final List<String> path;
    private final Phase phase;

    protected SynthException(String message, List<String> path, Phase phase) {
        super(message);
        this.path = path == null ? List.of() : List.copyOf(path);
        this.phase = phase;
    }

    protected SynthException(String message, Throwable cause, List<String> path, Phase phase) {
        super(message, cause);
        this.path = path == null ? List.of() : List.copyOf(path);
        this.phase = phase;
    }

    /** The construct path the error concerns, empty when it concerns the whole tree. */
    public List<String> path() {
        return path;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
