package io.tfsynth.standalone.writer;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("OutputSchemaValidator")
class OutputSchemaValidatorTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final OutputSchemaValidator validator = new OutputSchemaValidator();

    @Test
    void acceptsTypicalDocument() throws Exception {
        JsonNode doc = JSON.readTree("""
                {
                  "terraform": {"required_providers": {"aws": {"source": "hashicorp/aws", "version": "~> 5.0"}}},
                  "provider": {"aws": [{"region": "us-east-1"}, {"region": "us-west-2", "alias": "west"}]},
                  "resource": {"aws_instance": {"stack_web_39C4F105": {
                    "ami": "ami-123",
                    "depends_on": ["${aws_vpc.stack_vpc_5204145C}"],
                    "lifecycle": {"ignore_changes": "all"},
                    "provisioner": [{"local-exec": {"command": "echo", "when": "destroy"}}]
                  }}},
                  "output": {"stack_id_3D9B664D": {"value": "${aws_instance.stack_web_39C4F105.id}"}},
                  "locals": {"region": "us-east-1"}
                }
                """);

        assertThat(validator.validate(doc)).isEmpty();
        assertThat(validator.validate(JSON.createObjectNode())).isEmpty();
    }

    @Test
    void rejectsUnknownBlocksAndBadShapes() throws Exception {
        JsonNode doc = JSON.readTree("""
                {
                  "resources": {},
                  "module": {"net": {"version": "1.0"}},
                  "output": {"id": {"description": "no value"}}
                }
                """);

        assertThat(validator.validate(doc)).hasSizeGreaterThanOrEqualTo(3).isSorted();
    }
}
