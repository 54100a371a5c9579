package io.tfsynth.core.synth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import io.tfsynth.core.token.Token;
import io.tfsynth.core.token.TokenTable;
import java.util.List;

/**
 * Turns model values into JSON for the output document. Every token, marker string and number
 * token is rendered to its {@code ${...}} form through the session's {@link TokenTable}; plain
 * values pass through unchanged.
 */
final class ValueResolver {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TokenTable tokens;

    ValueResolver(TokenTable tokens) {
        this.tokens = tokens;
    }

    JsonNode toJson(Object value) {
        Object resolved = tokens.resolveTokens(value, tokens::tokenToString);
        return resolved == null ? NullNode.getInstance() : MAPPER.valueToTree(resolved);
    }

    String render(Token token) {
        return tokens.tokenToString(token);
    }

    ArrayNode renderAll(List<Token> tokenList) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        for (Token token : tokenList) {
            array.add(render(token));
        }
        return array;
    }
}
