package io.tfsynth.core.model;

import java.util.List;

/**
 * An input variable. All fields are optional.
 *
 * @param type         type constraint such as {@code string} or {@code list(string)}
 * @param defaultValue default value; may contain tokens
 * @param description  documentation string
 * @param sensitive    hide the value in plan output
 * @param nullable     whether null is an accepted value
 * @param validation   custom validation rules
 */
public record VariableDef(
        String type,
        Object defaultValue,
        String description,
        Boolean sensitive,
        Boolean nullable,
        List<ConditionDef> validation) {

    public VariableDef {
        validation = ModelCollections.listCopy(validation);
    }

    public static VariableDef ofType(String type) {
        return new VariableDef(type, null, null, null, null, null);
    }
}
