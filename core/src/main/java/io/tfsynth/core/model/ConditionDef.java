package io.tfsynth.core.model;

import io.tfsynth.core.token.Token;

/**
 * A condition with a failure message. Used for lifecycle pre/postconditions, output
 * preconditions and variable validation rules.
 *
 * @param condition    expression that must evaluate to true
 * @param errorMessage message reported when the condition is false
 */
public record ConditionDef(Token condition, String errorMessage) {}
