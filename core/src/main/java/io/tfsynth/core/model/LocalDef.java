package io.tfsynth.core.model;

/** A local value. {@code expression} is required and may be or contain tokens. */
public record LocalDef(Object expression) {}
