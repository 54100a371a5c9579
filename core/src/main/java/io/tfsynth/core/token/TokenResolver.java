package io.tfsynth.core.token;

/** Maps a token to its resolved value during {@link TokenTable#resolveTokens}. */
@FunctionalInterface
public interface TokenResolver {

    /**
     * @param token the token found in the value being resolved
     * @return the replacement; when the token is embedded in a larger string the result is
     *         converted with {@link String#valueOf(Object)}
     */
    Object resolve(Token token);
}
