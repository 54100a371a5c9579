package io.tfsynth.core.token;

import com.fasterxml.jackson.databind.JsonNode;
import io.tfsynth.core.error.UnresolvedTokenException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Side table that lets tokens travel through string- and number-typed APIs.
 *
 * <p>
 * {@link #createToken(Token)} registers a token and returns a marker string
 * {@code ${TfToken[n]}} that can be concatenated, formatted and stored like any other string.
 * {@link #resolveTokens(Object, TokenResolver)} later finds the markers and replaces them.
 * {@link #createNumberToken(Token)} does the same for numeric fields by encoding the id in the
 * upper bits of a double.
 *
 * <p>
 * One table belongs to one synthesis session: markers are only meaningful to the table that
 * created them. Not thread-safe.
 */
public final class TokenTable {

    static final String MARKER_PREFIX = "${TfToken[";
    static final String MARKER_SUFFIX = "]}";

    private static final Pattern MARKER = Pattern.compile("\\$\\{TfToken\\[(\\d+)]}");

    private static final long NUMBER_MARKER = 0x48c00000L;
    private static final long NUMBER_MASK = 0xffff0000L;
    private static final int MAX_NUMBER_TOKEN_ID = 0xffff;

    private final List<Token> tokens = new ArrayList<>();
    private final TokenRenderer renderer = new TokenRenderer(this);

    /** Registers the token and returns its marker string. */
    public String createToken(Token token) {
        return MARKER_PREFIX + register(token) + MARKER_SUFFIX;
    }

    /**
     * Registers the token and returns a double carrying its id. The value survives arithmetic-free
     * storage only; any computation on it destroys the marker.
     *
     * @throws IllegalStateException if the table holds more tokens than the encoding can address
     */
    public double createNumberToken(Token token) {
        int id = register(token);
        if (id > MAX_NUMBER_TOKEN_ID) {
            throw new IllegalStateException("Too many tokens for number encoding: " + id);
        }
        long high = NUMBER_MARKER | id;
        return Double.longBitsToDouble(high << 32);
    }

    /** Returns the token registered under the given id. */
    public Optional<Token> lookup(int id) {
        return id >= 0 && id < tokens.size() ? Optional.of(tokens.get(id)) : Optional.empty();
    }

    /** Number of registered tokens. */
    public int size() {
        return tokens.size();
    }

    /**
     * Returns the token represented by the value: a {@link Token} instance, a string consisting
     * of exactly one marker, or a number token. Empty otherwise.
     */
    public Optional<Token> asToken(Object value) {
        if (value instanceof Token token) {
            return Optional.of(token);
        }
        if (value instanceof String s) {
            Matcher m = MARKER.matcher(s);
            return m.matches() ? Optional.of(require(parseId(m))) : Optional.empty();
        }
        if (value instanceof Double d) {
            int id = numberTokenId(d);
            return id < 0 ? Optional.empty() : Optional.of(require(id));
        }
        return Optional.empty();
    }

    /**
     * Whether the value holds at least one token: a marker anywhere in a string, a number
     * token, or a {@link Token} instance, at any depth of maps, lists and JSON trees.
     */
    public boolean containsTokens(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String s) {
            return MARKER.matcher(s).find();
        }
        if (value instanceof Double d) {
            return numberTokenId(d) >= 0;
        }
        if (value instanceof Token) {
            return true;
        }
        if (value instanceof JsonNode node) {
            if (node.isTextual()) {
                return containsTokens(node.textValue());
            }
            if (node.isContainerNode()) {
                for (JsonNode child : node) {
                    if (containsTokens(child)) {
                        return true;
                    }
                }
            }
            return false;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (containsTokens(entry.getKey()) || containsTokens(entry.getValue())) {
                    return true;
                }
            }
            return false;
        }
        if (value instanceof Iterable<?> iterable) {
            for (Object item : iterable) {
                if (containsTokens(item)) {
                    return true;
                }
            }
            return false;
        }
        return false;
    }

    /**
     * Returns a copy of the value with every token replaced by {@code resolver}'s result. Maps
     * keep their key order; values without tokens are returned as they are.
     *
     * <p>
     * A string that is exactly one marker is replaced by the resolver result itself, which need
     * not be a string. Markers embedded in longer strings are spliced in as text.
     *
     * @throws UnresolvedTokenException if a marker was not created by this table
     */
    public Object resolveTokens(Object value, TokenResolver resolver) {
        Objects.requireNonNull(resolver, "resolver must not be null");
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return resolveString(s, resolver);
        }
        if (value instanceof Double d) {
            int id = numberTokenId(d);
            return id < 0 ? d : resolver.resolve(require(id));
        }
        if (value instanceof Token token) {
            return resolver.resolve(token);
        }
        if (value instanceof JsonNode node) {
            return containsTokens(node) ? resolveJson(node, resolver) : node;
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                Object key = entry.getKey() instanceof String k
                        ? String.valueOf(resolveString(k, resolver))
                        : entry.getKey();
                result.put(key, resolveTokens(entry.getValue(), resolver));
            }
            return result;
        }
        if (value instanceof Iterable<?> iterable) {
            List<Object> result = new ArrayList<>();
            Iterator<?> it = iterable.iterator();
            while (it.hasNext()) {
                result.add(resolveTokens(it.next(), resolver));
            }
            return result;
        }
        return value;
    }

    /**
     * Renders a token like {@link Tokens#tokenToString(Token)}, additionally resolving markers
     * that appear inside function arguments and lazy results.
     */
    public String tokenToString(Token token) {
        return renderer.render(token);
    }

    /** Renders any value as a bare expression suitable for nesting inside an interpolation. */
    public String toExpression(Object value) {
        return renderer.renderExpression(value);
    }

    private int register(Token token) {
        Objects.requireNonNull(token, "token must not be null");
        tokens.add(token);
        return tokens.size() - 1;
    }

    private Object resolveString(String value, TokenResolver resolver) {
        Matcher m = MARKER.matcher(value);
        if (!m.find()) {
            return value;
        }
        if (m.start() == 0 && m.end() == value.length()) {
            return resolver.resolve(require(parseId(m)));
        }
        return splice(value, UnaryOperator.identity(), resolver);
    }

    /**
     * Replaces every marker in {@code value} with the resolver result and passes the text between
     * markers through {@code literal}.
     */
    String splice(String value, UnaryOperator<String> literal, TokenResolver resolver) {
        Matcher m = MARKER.matcher(value);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        while (m.find()) {
            sb.append(literal.apply(value.substring(last, m.start())));
            sb.append(resolver.resolve(require(parseId(m))));
            last = m.end();
        }
        sb.append(literal.apply(value.substring(last)));
        return sb.toString();
    }

    private Object resolveJson(JsonNode node, TokenResolver resolver) {
        if (node.isTextual()) {
            return resolveString(node.textValue(), resolver);
        }
        if (node.isObject()) {
            Map<String, Object> result = new LinkedHashMap<>();
            node.fields().forEachRemaining(e -> result.put(e.getKey(), resolveJson(e.getValue(), resolver)));
            return result;
        }
        if (node.isArray()) {
            List<Object> result = new ArrayList<>();
            node.forEach(child -> result.add(resolveJson(child, resolver)));
            return result;
        }
        return node;
    }

    private Token require(int id) {
        return lookup(id)
                .orElseThrow(() -> new UnresolvedTokenException(
                        "Token " + id + " is not registered in this token table", id));
    }

    private static int parseId(Matcher m) {
        return Integer.parseInt(m.group(1));
    }

    private static int numberTokenId(double d) {
        long bits = Double.doubleToRawLongBits(d);
        if ((bits & 0xffffffffL) != 0) {
            return -1;
        }
        long high = bits >>> 32;
        return (high & NUMBER_MASK) == NUMBER_MARKER ? (int) (high & ~NUMBER_MASK) : -1;
    }
}
