package io.tfsynth.standalone.writer;

import io.tfsynth.core.error.SynthException;
import java.nio.file.Path;
import java.util.List;

/** Thrown when a synthesized document or the manifest cannot be written. */
public final class OutputWriteException extends SynthException {

    private static final long serialVersionUID = 1L;

    private final String target;

    public OutputWriteException(Path target, Throwable cause) {
        super("Failed to write " + target + ": " + cause.getMessage(), cause, List.of(), Phase.SYNTHESIS);
        this.target = target.toString();
    }

    /** The file that could not be written. */
    public String target() {
        return target;
    }
}
