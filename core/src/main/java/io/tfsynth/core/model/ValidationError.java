package io.tfsynth.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One problem found by the validator.
 *
 * <p>
 * For {@link ValidationErrorCode#CIRCULAR_DEPENDENCY} the path holds the cycle itself: the
 * addresses in dependency order, starting and ending with the same address.
 *
 * @param path    construct path of the offending node
 * @param message human-readable description
 * @param code    error classification
 */
public record ValidationError(List<String> path, String message, ValidationErrorCode code) {

    public ValidationError {
        path = List.copyOf(Objects.requireNonNull(path, "path must not be null"));
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(code, "code must not be null");
    }

    @Override
    public String toString() {
        return "[" + code + "] " + (path.isEmpty() ? "<root>" : String.join("/", path)) + ": " + message;
    }
}
