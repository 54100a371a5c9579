package io.tfsynth.core.token;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Factory and rendering functions for {@link Token}s.
 *
 * <p>
 * Rendering rules:
 * <ul>
 * <li>Ref: {@code ${fqn.attribute}}, or {@code ${fqn}} when the attribute is empty</li>
 * <li>Fn: {@code ${name(arg1, arg2)}}; strings quoted, lists bracketed, maps as
 * {@code {k = v}}, nested tokens inlined without their own {@code ${}}</li>
 * <li>Raw: the expression unchanged</li>
 * <li>Lazy: the producer's result, rendered recursively</li>
 * </ul>
 *
 * Stateless; marker strings are handled by {@link TokenTable}.
 */
public final class Tokens {

    private static final TokenRenderer PLAIN = new TokenRenderer(null);

    private Tokens() {}

    public static Token.Ref ref(String fqn, String attribute) {
        return new Token.Ref(fqn, attribute);
    }

    public static Token.Fn fn(String name, Object... args) {
        return new Token.Fn(name, Arrays.asList(args));
    }

    public static Token.Raw raw(String expression) {
        return new Token.Raw(expression);
    }

    public static Token.Lazy lazy(Supplier<Object> producer) {
        return new Token.Lazy(producer);
    }

    /** Returns the value as a token, or empty when it is not one. */
    public static Optional<Token> asToken(Object value) {
        return value instanceof Token token ? Optional.of(token) : Optional.empty();
    }

    /** Renders a token to interpolation syntax. Same token, same string. */
    public static String tokenToString(Token token) {
        return PLAIN.render(token);
    }
}
