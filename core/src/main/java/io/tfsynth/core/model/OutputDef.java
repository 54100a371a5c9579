package io.tfsynth.core.model;

import io.tfsynth.core.token.Token;
import java.util.List;

/**
 * An output value.
 *
 * @param value        required; may be or contain tokens
 * @param description  documentation string, or null
 * @param sensitive    redact in CLI output, or null
 * @param dependsOn    explicit dependencies, or null
 * @param precondition checked before the output is recorded, or null
 */
public record OutputDef(
        Object value, String description, Boolean sensitive, List<Token> dependsOn, ConditionDef precondition) {

    public OutputDef {
        dependsOn = ModelCollections.listCopy(dependsOn);
    }

    public static OutputDef of(Object value) {
        return new OutputDef(value, null, null, null, null);
    }
}
