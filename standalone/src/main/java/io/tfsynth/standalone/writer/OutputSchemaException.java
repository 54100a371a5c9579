package io.tfsynth.standalone.writer;

import io.tfsynth.core.error.SynthException;
import java.util.List;

/**
 * Thrown in {@link SchemaValidationMode#STRICT} mode when a synthesized stack document does not
 * conform to the bundled Terraform JSON schema.
 */
public final class OutputSchemaException extends SynthException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public OutputSchemaException(String stackName, List<String> stackPath, List<String> violations) {
        super(
                "Stack '" + stackName + "' does not conform to the Terraform JSON schema: "
                        + String.join("; ", violations),
                stackPath,
                Phase.SYNTHESIS);
        this.violations = List.copyOf(violations);
    }

    /** Schema violation messages, one per failed constraint. */
    public List<String> violations() {
        return violations;
    }
}
