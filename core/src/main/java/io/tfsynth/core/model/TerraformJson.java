package io.tfsynth.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Optional;

/**
 * A synthesized stack document in the Terraform JSON configuration syntax. Top-level keys
 * ({@code terraform}, {@code provider}, {@code resource}, {@code data}, {@code module}, {@code
 * variable}, {@code output}, {@code locals}) are present only when the stack has elements of that
 * kind; key order is insertion order, so the same tree always serializes to the same bytes.
 *
 * <p>
 * The wrapped tree is copied on the way in and on the way out; instances are immutable.
 */
public final class TerraformJson {

    public static final String TERRAFORM = "terraform";
    public static final String PROVIDER = "provider";
    public static final String RESOURCE = "resource";
    public static final String DATA = "data";
    public static final String MODULE = "module";
    public static final String VARIABLE = "variable";
    public static final String OUTPUT = "output";
    public static final String LOCALS = "locals";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObjectNode document;

    public TerraformJson(ObjectNode document) {
        this.document = Objects.requireNonNull(document, "document must not be null").deepCopy();
    }

    /** A copy of the whole document. */
    public ObjectNode toJsonNode() {
        return document.deepCopy();
    }

    /** The top-level block under {@code key}, if the document has one. */
    public Optional<JsonNode> block(String key) {
        JsonNode block = document.get(key);
        return block == null ? Optional.empty() : Optional.of(block.deepCopy());
    }

    public Optional<JsonNode> terraform() {
        return block(TERRAFORM);
    }

    public Optional<JsonNode> provider() {
        return block(PROVIDER);
    }

    public Optional<JsonNode> resource() {
        return block(RESOURCE);
    }

    public Optional<JsonNode> data() {
        return block(DATA);
    }

    public Optional<JsonNode> module() {
        return block(MODULE);
    }

    public Optional<JsonNode> variable() {
        return block(VARIABLE);
    }

    public Optional<JsonNode> output() {
        return block(OUTPUT);
    }

    public Optional<JsonNode> locals() {
        return block(LOCALS);
    }

    /** True when the stack produced no blocks at all. */
    public boolean isEmpty() {
        return document.isEmpty();
    }

    /**
     * Serializes the document.
     *
     * @param pretty indent with two spaces when true
     */
    public String toJson(boolean pretty) {
        try {
            return pretty
                    ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(document)
                    : MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            // a tree of plain JSON nodes always serializes
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof TerraformJson other && document.equals(other.document));
    }

    @Override
    public int hashCode() {
        return document.hashCode();
    }

    @Override
    public String toString() {
        return toJson(false);
    }
}
