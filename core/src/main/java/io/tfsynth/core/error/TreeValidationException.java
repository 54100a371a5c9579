package io.tfsynth.core.error;

import io.tfsynth.core.model.ValidationError;
import java.util.List;
import java.util.stream.Collectors;

/** Thrown by validated synthesis when the tree has validation errors. Carries all of them. */
public final class TreeValidationException extends SynthException {

    private static final long serialVersionUID = 1L;

    private final transient List<ValidationError> errors;

    public TreeValidationException(List<ValidationError> errors) {
        super(summarize(errors), List.of(), Phase.VALIDATION);
        this.errors = List.copyOf(errors);
    }

    /** Every validation error, in discovery order. */
    public List<ValidationError> errors() {
        return errors;
    }

    private static String summarize(List<ValidationError> errors) {
        return errors.size() + " validation error(s):" + System.lineSeparator()
                + errors.stream().map(e -> "  " + e).collect(Collectors.joining(System.lineSeparator()));
    }
}
