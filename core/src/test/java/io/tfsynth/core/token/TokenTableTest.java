package io.tfsynth.core.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tfsynth.core.error.UnresolvedTokenException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for marker creation, detection and resolution. */
@DisplayName("TokenTable")
class TokenTableTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private TokenTable table;

    @BeforeEach
    void setUp() {
        table = new TokenTable();
    }

    @Test
    @DisplayName("createToken returns a marker that maps back to the token")
    void markerRoundTrip() {
        Token ref = Tokens.ref("aws_instance.web", "id");

        String marker = table.createToken(ref);

        assertThat(marker).isEqualTo("${TfToken[0]}");
        assertThat(table.asToken(marker)).contains(ref);
        assertThat(table.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("a string with text around a marker is not itself a token")
    void embeddedMarkerIsNotAToken() {
        String marker = table.createToken(Tokens.ref("var.env", ""));

        assertThat(table.asToken("prefix-" + marker)).isEmpty();
        assertThat(table.containsTokens("prefix-" + marker)).isTrue();
    }

    @Test
    @DisplayName("number tokens survive storage as a double")
    void numberTokens() {
        Token count = Tokens.ref("var.count", "");
        table.createToken(Tokens.raw("unused"));

        double number = table.createNumberToken(count);

        assertThat(table.asToken(number)).contains(count);
        assertThat(table.containsTokens(number)).isTrue();
        assertThat(table.containsTokens(42.0)).isFalse();
        assertThat(table.resolveTokens(number, table::tokenToString)).isEqualTo("${var.count}");
    }

    @Test
    @DisplayName("containsTokens finds markers at any depth and nothing else")
    void containsTokensDeep() {
        String marker = table.createToken(Tokens.ref("aws_vpc.main", "id"));
        Map<String, Object> nested = Map.of("a", List.of(1, Map.of("b", List.of("x", "vpc=" + marker))));
        Map<String, Object> plain = Map.of("a", List.of(1, Map.of("b", List.of("x", "${var.not_a_marker}"))));

        assertThat(table.containsTokens(nested)).isTrue();
        assertThat(table.containsTokens(plain)).isFalse();
        assertThat(table.containsTokens(null)).isFalse();
        assertThat(table.containsTokens(Map.of(marker, "key holds it"))).isTrue();
        assertThat(table.containsTokens(Tokens.raw("x"))).isTrue();
    }

    @Test
    @DisplayName("containsTokens scans Jackson trees")
    void containsTokensInJson() throws Exception {
        String marker = table.createToken(Tokens.ref("var.a", ""));
        JsonNode withMarker = JSON.readTree("{\"x\":[{\"y\":\"" + marker.replace("\\", "\\\\") + "\"}]}");
        JsonNode without = JSON.readTree("{\"x\":[{\"y\":\"plain\"}]}");

        assertThat(table.containsTokens(withMarker)).isTrue();
        assertThat(table.containsTokens(without)).isFalse();
    }

    @Test
    @DisplayName("resolveTokens leaves token-free structures unchanged")
    void resolveTokensNoTokens() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("name", "web");
        value.put("ports", List.of(80, 443));
        value.put("tags", Map.of("env", "dev"));
        value.put("enabled", true);
        value.put("nothing", null);

        Object resolved = table.resolveTokens(value, table::tokenToString);

        assertThat(resolved).isEqualTo(value);
    }

    @Test
    @DisplayName("resolveTokens splices embedded markers and replaces whole markers")
    void resolveTokensSplices() {
        String id = table.createToken(Tokens.ref("aws_vpc.main", "id"));
        String env = table.createToken(Tokens.ref("var.env", ""));
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("vpc_id", id);
        value.put("name", "app-" + env + "-web");
        value.put("list", List.of(id, "plain"));

        Object resolved = table.resolveTokens(value, table::tokenToString);

        assertThat(resolved)
                .isEqualTo(Map.of(
                        "vpc_id", "${aws_vpc.main.id}",
                        "name", "app-${var.env}-web",
                        "list", List.of("${aws_vpc.main.id}", "plain")));
    }

    @Test
    @DisplayName("a whole-marker string resolves to the resolver result as is")
    void wholeMarkerKeepsResolverType() {
        String marker = table.createToken(Tokens.raw("x"));

        Object resolved = table.resolveTokens(List.of(marker), token -> 7);

        assertThat(resolved).isEqualTo(List.of(7));
    }

    @Test
    @DisplayName("resolveTokens preserves map key order")
    void resolvePreservesOrder() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("z", 1);
        value.put("a", table.createToken(Tokens.raw("${x}")));
        value.put("m", 3);

        @SuppressWarnings("unchecked")
        Map<String, Object> resolved = (Map<String, Object>) table.resolveTokens(value, table::tokenToString);

        assertThat(resolved.keySet()).containsExactly("z", "a", "m");
    }

    @Test
    @DisplayName("markers from another table are rejected")
    void foreignMarkerRejected() {
        TokenTable other = new TokenTable();
        other.createToken(Tokens.raw("a"));
        String foreign = other.createToken(Tokens.raw("b"));

        assertThatThrownBy(() -> table.resolveTokens(foreign, table::tokenToString))
                .isInstanceOfSatisfying(
                        UnresolvedTokenException.class, e -> assertThat(e.tokenId()).isEqualTo(1));
    }

    @Test
    @DisplayName("tokenToString resolves markers nested in function arguments")
    void tokenToStringResolvesNestedMarkers() {
        String name = table.createToken(Tokens.ref("var.name", ""));
        Token upper = Tokens.fn("upper", name);
        Token format = Tokens.fn("format", "%s-" + name, "x");

        assertThat(table.tokenToString(upper)).isEqualTo("${upper(var.name)}");
        assertThat(table.tokenToString(format)).isEqualTo("${format(\"%s-${var.name}\", \"x\")}");
        assertThat(Tokens.tokenToString(upper)).isEqualTo("${upper(\"${TfToken[0]}\")}");
    }

    @Test
    @DisplayName("escapes the literal text around an embedded marker but not the marker itself")
    void embeddedMarkerStaysLive() {
        String name = table.createToken(Tokens.ref("var.name", ""));
        Token format = Tokens.fn("format", "${x}\n" + name, "y");

        assertThat(table.tokenToString(format)).isEqualTo("${format(\"$${x}\\n${var.name}\", \"y\")}");
    }

    @Test
    @DisplayName("lookup of an unknown id is empty")
    void lookupUnknown() {
        assertThat(table.lookup(0)).isEmpty();
        assertThat(table.lookup(-1)).isEmpty();
    }
}
