package io.tfsynth.core.token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A value that is not known until synthesis: a reference to another element's attribute, a
 * function call, a literal expression, or a deferred computation.
 *
 * <p>
 * Tokens are immutable. They are rendered to the {@code ${...}} interpolation syntax by {@link
 * Tokens#tokenToString(Token)}; to pass one through a string-typed API, wrap it with {@link
 * TokenTable#createToken(Token)}.
 */
public sealed interface Token permits Token.Ref, Token.Fn, Token.Raw, Token.Lazy {

    /** Discriminator for the token variants. */
    enum Kind {
        REF,
        FN,
        RAW,
        LAZY
    }

    Kind kind();

    /**
     * Reference to an attribute of an addressable element.
     *
     * @param fqn       element address, e.g. {@code aws_instance.web}
     * @param attribute attribute name; empty to reference the element itself
     */
    record Ref(String fqn, String attribute) implements Token {
        public Ref {
            Objects.requireNonNull(fqn, "fqn must not be null");
            attribute = attribute == null ? "" : attribute;
        }

        @Override
        public Kind kind() {
            return Kind.REF;
        }
    }

    /**
     * Call of a built-in function.
     *
     * @param name function name
     * @param args ordered arguments: literals, collections, tokens or marker strings
     */
    record Fn(String name, List<Object> args) implements Token {
        public Fn {
            Objects.requireNonNull(name, "name must not be null");
            args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        }

        @Override
        public Kind kind() {
            return Kind.FN;
        }
    }

    /** An expression that is already in its final form and is emitted unchanged. */
    record Raw(String expression) implements Token {
        public Raw {
            Objects.requireNonNull(expression, "expression must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.RAW;
        }
    }

    /**
     * A value computed at resolution time. The producer may be invoked more than once and must
     * return the same result each time. It may return another token, a string or a structured
     * value.
     */
    record Lazy(Supplier<Object> producer) implements Token {
        public Lazy {
            Objects.requireNonNull(producer, "producer must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.LAZY;
        }
    }
}
