package io.tfsynth.core.model;

import io.tfsynth.core.token.Token;
import java.util.List;

/**
 * Lifecycle meta-argument of a resource. Every field is optional (null means "not set").
 *
 * <p>
 * {@code ignoreChanges} is either the string {@code "all"} or a list of attribute names. It is
 * typed loosely because callers assemble it from user input; {@code TreeValidator} checks the
 * shape.
 */
public record LifecycleDef(
        Boolean createBeforeDestroy,
        Boolean preventDestroy,
        Object ignoreChanges,
        List<Token> replaceTriggeredBy,
        List<ConditionDef> precondition,
        List<ConditionDef> postcondition) {

    public static final String IGNORE_ALL = "all";

    public LifecycleDef {
        replaceTriggeredBy = ModelCollections.listCopy(replaceTriggeredBy);
        precondition = ModelCollections.listCopy(precondition);
        postcondition = ModelCollections.listCopy(postcondition);
        if (ignoreChanges instanceof List<?> list) {
            ignoreChanges = ModelCollections.listCopy(list);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link LifecycleDef}. */
    public static final class Builder {

        private Boolean createBeforeDestroy;
        private Boolean preventDestroy;
        private Object ignoreChanges;
        private List<Token> replaceTriggeredBy;
        private List<ConditionDef> precondition;
        private List<ConditionDef> postcondition;

        private Builder() {}

        public Builder createBeforeDestroy(boolean value) {
            this.createBeforeDestroy = value;
            return this;
        }

        public Builder preventDestroy(boolean value) {
            this.preventDestroy = value;
            return this;
        }

        public Builder ignoreChanges(List<String> attributes) {
            this.ignoreChanges = attributes;
            return this;
        }

        public Builder ignoreAllChanges() {
            this.ignoreChanges = IGNORE_ALL;
            return this;
        }

        /** Sets {@code ignoreChanges} without checking its shape. */
        public Builder ignoreChangesRaw(Object value) {
            this.ignoreChanges = value;
            return this;
        }

        public Builder replaceTriggeredBy(List<Token> references) {
            this.replaceTriggeredBy = references;
            return this;
        }

        public Builder precondition(List<ConditionDef> conditions) {
            this.precondition = conditions;
            return this;
        }

        public Builder postcondition(List<ConditionDef> conditions) {
            this.postcondition = conditions;
            return this;
        }

        public LifecycleDef build() {
            return new LifecycleDef(
                    createBeforeDestroy, preventDestroy, ignoreChanges, replaceTriggeredBy, precondition, postcondition);
        }
    }
}
