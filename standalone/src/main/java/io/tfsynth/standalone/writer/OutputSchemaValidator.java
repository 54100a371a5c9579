package io.tfsynth.standalone.writer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Checks synthesized documents against the bundled {@code terraform-json.schema.json} (JSON
 * Schema 2020-12). The schema covers the block layout only; attribute names inside resources and
 * providers are not checked.
 *
 * <p>
 * Thread-safe: the compiled schema is immutable.
 */
final class OutputSchemaValidator {

    static final String SCHEMA_RESOURCE = "/terraform-json.schema.json";

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final JsonSchema schema;

    OutputSchemaValidator() {
        this.schema = SCHEMA_FACTORY.getSchema(loadSchema());
    }

    /** Violation messages in a stable order; empty when the document conforms. */
    List<String> validate(JsonNode document) {
        Set<ValidationMessage> messages = schema.validate(document);
        List<String> violations = new ArrayList<>();
        for (ValidationMessage message : messages) {
            violations.add(message.getMessage());
        }
        violations.sort(null);
        return violations;
    }

    private static JsonNode loadSchema() {
        try (InputStream in = OutputSchemaValidator.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Output schema not found on classpath: " + SCHEMA_RESOURCE);
            }
            return new ObjectMapper().readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read output schema " + SCHEMA_RESOURCE, e);
        }
    }
}
