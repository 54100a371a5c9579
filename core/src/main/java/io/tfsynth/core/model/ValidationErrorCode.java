package io.tfsynth.core.model;

/** Classification of a {@link ValidationError}. */
public enum ValidationErrorCode {
    MISSING_REQUIRED_FIELD,
    INVALID_FIELD_TYPE,
    INVALID_REFERENCE,
    DUPLICATE_ID,
    INVALID_LIFECYCLE,
    INVALID_PROVIDER,
    CIRCULAR_DEPENDENCY,
    UNKNOWN
}
