package io.tfsynth.core.token;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Typed access to Terraform's built-in functions and expression forms. Every method returns a
 * marker string registered in the backing {@link TokenTable}, so results can be stored in any
 * string-typed attribute and combined with further calls.
 *
 * <p>
 * Arguments may be literals, lists, maps, {@link Token}s or marker strings produced by the same
 * table.
 */
public final class TerraformFunctions {

    private static final Pattern IDENTIFIER = Pattern.compile("[_a-zA-Z][_a-zA-Z0-9-]*");

    private final TokenTable table;

    public TerraformFunctions(TokenTable table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    /** Generic call of any function by name. */
    public String call(String name, Object... args) {
        return table.createToken(Tokens.fn(name, args));
    }

    // --- numeric ---

    public String abs(Object num) {
        return call("abs", num);
    }

    public String ceil(Object num) {
        return call("ceil", num);
    }

    public String floor(Object num) {
        return call("floor", num);
    }

    public String max(List<?> numbers) {
        return call("max", spread(numbers));
    }

    public String min(List<?> numbers) {
        return call("min", spread(numbers));
    }

    public String parseint(Object str, Object base) {
        return call("parseint", str, base);
    }

    // --- string ---

    public String format(String pattern, Object... args) {
        return call("format", prepend(pattern, args));
    }

    public String join(String separator, Object list) {
        return call("join", separator, list);
    }

    public String lower(Object str) {
        return call("lower", str);
    }

    public String upper(Object str) {
        return call("upper", str);
    }

    public String replace(Object str, Object substr, Object replacement) {
        return call("replace", str, substr, replacement);
    }

    public String split(String separator, Object str) {
        return call("split", separator, str);
    }

    public String substr(Object str, Object offset, Object length) {
        return call("substr", str, offset, length);
    }

    public String trimspace(Object str) {
        return call("trimspace", str);
    }

    public String regex(String pattern, Object str) {
        return call("regex", pattern, str);
    }

    // --- collection ---

    public String concat(Object... lists) {
        return call("concat", lists);
    }

    public String contains(Object list, Object value) {
        return call("contains", list, value);
    }

    public String distinct(Object list) {
        return call("distinct", list);
    }

    public String element(Object list, Object index) {
        return call("element", list, index);
    }

    public String flatten(Object list) {
        return call("flatten", list);
    }

    public String keys(Object map) {
        return call("keys", map);
    }

    public String values(Object map) {
        return call("values", map);
    }

    public String length(Object value) {
        return call("length", value);
    }

    public String lookup(Object map, Object key, Object defaultValue) {
        return defaultValue == null ? call("lookup", map, key) : call("lookup", map, key, defaultValue);
    }

    public String merge(Object... maps) {
        return call("merge", maps);
    }

    public String range(Object start, Object limit) {
        return call("range", start, limit);
    }

    public String coalesce(Object... args) {
        return call("coalesce", args);
    }

    public String zipmap(Object keys, Object values) {
        return call("zipmap", keys, values);
    }

    // --- encoding ---

    public String base64encode(Object str) {
        return call("base64encode", str);
    }

    public String base64decode(Object str) {
        return call("base64decode", str);
    }

    public String jsonencode(Object value) {
        return call("jsonencode", value);
    }

    public String jsondecode(Object str) {
        return call("jsondecode", str);
    }

    // --- filesystem ---

    public String file(Object path) {
        return call("file", path);
    }

    public String templatefile(Object path, Map<String, ?> vars) {
        return call("templatefile", path, vars);
    }

    // --- hash and crypto ---

    public String md5(Object str) {
        return call("md5", str);
    }

    public String sha256(Object str) {
        return call("sha256", str);
    }

    // --- IP network ---

    public String cidrsubnet(Object prefix, Object newbits, Object netnum) {
        return call("cidrsubnet", prefix, newbits, netnum);
    }

    public String cidrhost(Object prefix, Object hostnum) {
        return call("cidrhost", prefix, hostnum);
    }

    // --- type conversion ---

    public String tostring(Object value) {
        return call("tostring", value);
    }

    public String tonumber(Object value) {
        return call("tonumber", value);
    }

    public String tolist(Object value) {
        return call("tolist", value);
    }

    public String toset(Object value) {
        return call("toset", value);
    }

    public String sensitive(Object value) {
        return call("sensitive", value);
    }

    // --- expressions ---

    /** {@code ${condition ? trueValue : falseValue}}. */
    public String conditional(Object condition, Object trueValue, Object falseValue) {
        return table.createToken(Tokens.lazy(() -> Tokens.raw("${" + table.toExpression(condition) + " ? "
                + table.toExpression(trueValue) + " : " + table.toExpression(falseValue) + "}")));
    }

    /**
     * Attribute and index access on an expression: identifiers become {@code .name}, numbers
     * {@code [n]}, anything else {@code ["key"]}.
     */
    public String propertyAccess(Object target, Object... path) {
        List<Object> segments = Arrays.asList(path);
        return table.createToken(Tokens.lazy(() -> {
            StringBuilder sb = new StringBuilder(table.toExpression(target));
            for (Object segment : segments) {
                if (segment instanceof Number n) {
                    sb.append('[').append(n).append(']');
                } else if (IDENTIFIER.matcher(String.valueOf(segment)).matches()) {
                    sb.append('.').append(segment);
                } else {
                    sb.append('[').append(TokenRenderer.quote(String.valueOf(segment))).append(']');
                }
            }
            return Tokens.raw("${" + sb + "}");
        }));
    }

    /** Binary operator, parenthesized: {@code ${(left op right)}}. */
    public String binary(String operator, Object left, Object right) {
        return table.createToken(Tokens.lazy(() ->
                Tokens.raw("${(" + table.toExpression(left) + " " + operator + " " + table.toExpression(right) + ")}")));
    }

    /** Unary operator: {@code ${!value}} or {@code ${-value}}. */
    public String unary(String operator, Object operand) {
        return table.createToken(Tokens.lazy(() -> Tokens.raw("${" + operator + table.toExpression(operand) + "}")));
    }

    /** A list literal whose elements may be expressions: {@code ${[a, b]}}. */
    public String listOf(Object... elements) {
        List<Object> items = Arrays.asList(elements);
        return table.createToken(Tokens.lazy(() -> Tokens.raw("${["
                + items.stream().map(table::toExpression).collect(Collectors.joining(", ")) + "]}")));
    }

    private static Object[] spread(List<?> values) {
        return new ArrayList<Object>(values).toArray();
    }

    private static Object[] prepend(Object first, Object[] rest) {
        Object[] all = new Object[rest.length + 1];
        all[0] = first;
        System.arraycopy(rest, 0, all, 1, rest.length);
        return all;
    }
}
