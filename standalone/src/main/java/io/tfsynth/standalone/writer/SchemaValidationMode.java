package io.tfsynth.standalone.writer;

import java.util.Locale;

/**
 * What to do when a synthesized document fails the output schema check.
 *
 * <ul>
 * <li>{@link #STRICT}: refuse to write the stack and throw {@link OutputSchemaException}</li>
 * <li>{@link #LENIENT}: log the violations at WARN and write the stack anyway (default)</li>
 * </ul>
 */
public enum SchemaValidationMode {
    STRICT,
    LENIENT;

    /**
     * Parses {@code strict} or {@code lenient}, ignoring case.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static SchemaValidationMode parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("schema-validation must be 'lenient' or 'strict', got null");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "strict":
                return STRICT;
            case "lenient":
                return LENIENT;
            default:
                throw new IllegalArgumentException("schema-validation must be 'lenient' or 'strict', got '" + value + "'");
        }
    }
}
