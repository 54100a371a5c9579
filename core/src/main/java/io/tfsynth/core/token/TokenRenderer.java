package io.tfsynth.core.token;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Renders tokens to interpolation syntax. A {@link TokenTable} may be supplied so that marker
 * strings nested in function arguments or lazy results are resolved too; without one they are
 * rendered as plain strings.
 */
final class TokenRenderer {

    private final TokenTable table;

    TokenRenderer(TokenTable table) {
        this.table = table;
    }

    String render(Token token) {
        return switch (token.kind()) {
            case REF -> renderRef((Token.Ref) token);
            case FN -> renderFn((Token.Fn) token);
            case RAW -> ((Token.Raw) token).expression();
            case LAZY -> renderLazyResult(((Token.Lazy) token).producer().get());
        };
    }

    /** Renders any value as a bare expression, the form used for function arguments. */
    String renderExpression(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Token token) {
            return unwrap(render(token));
        }
        if (value instanceof String s) {
            return renderStringArgument(s);
        }
        if (value instanceof Double d && table != null) {
            Optional<Token> numberToken = table.asToken(d);
            if (numberToken.isPresent()) {
                return unwrap(render(numberToken.get()));
            }
        }
        if (value instanceof Double || value instanceof Float) {
            return formatNumber(((Number) value).doubleValue());
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Map<?, ?> map) {
            StringJoiner joiner = new StringJoiner(", ", "{", "}");
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                joiner.add(entry.getKey() + " = " + renderExpression(entry.getValue()));
            }
            return joiner.toString();
        }
        if (value instanceof Iterable<?> iterable) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            Iterator<?> it = iterable.iterator();
            while (it.hasNext()) {
                joiner.add(renderExpression(it.next()));
            }
            return joiner.toString();
        }
        return value.toString();
    }

    private String renderRef(Token.Ref ref) {
        if (ref.attribute().isEmpty()) {
            return "${" + ref.fqn() + "}";
        }
        return "${" + ref.fqn() + "." + ref.attribute() + "}";
    }

    private String renderFn(Token.Fn fn) {
        StringJoiner joiner = new StringJoiner(", ", fn.name() + "(", ")");
        for (Object arg : fn.args()) {
            joiner.add(renderExpression(arg));
        }
        return "${" + joiner + "}";
    }

    private String renderLazyResult(Object result) {
        if (result instanceof Token token) {
            return render(token);
        }
        if (result == null) {
            return "null";
        }
        if (result instanceof String s) {
            return table == null ? s : String.valueOf(table.resolveTokens(s, this::render));
        }
        return renderExpression(result);
    }

    private String renderStringArgument(String s) {
        if (table != null) {
            Optional<Token> single = table.asToken(s);
            if (single.isPresent()) {
                return unwrap(render(single.get()));
            }
            if (table.containsTokens(s)) {
                return "\"" + table.splice(s, TokenRenderer::escape, this::render) + "\"";
            }
        }
        return quote(s);
    }

    static String quote(String s) {
        return "\"" + escape(s) + "\"";
    }

    /**
     * Escapes literal text for an HCL quoted string, template sequences included. Marker strings
     * are left intact so that a table can still resolve them later.
     */
    static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean templateStart = i + 1 < s.length() && s.charAt(i + 1) == '{';
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '$' -> sb.append(templateStart && !s.startsWith(TokenTable.MARKER_PREFIX, i) ? "$$" : "$");
                case '%' -> sb.append(templateStart ? "%%" : "%");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    static String formatNumber(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    /**
     * Strips the enclosing {@code ${...}} when the whole string is a single interpolation, so
     * that the expression can be nested inside another one.
     */
    static String unwrap(String expression) {
        if (!expression.startsWith("${") || !expression.endsWith("}")) {
            return expression;
        }
        int depth = 0;
        boolean inString = false;
        for (int i = 1; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i == expression.length() - 1 ? expression.substring(2, i) : expression;
                }
            }
        }
        return expression;
    }
}
