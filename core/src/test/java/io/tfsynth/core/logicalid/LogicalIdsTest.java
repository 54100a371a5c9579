package io.tfsynth.core.logicalid;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for logical id derivation. Expected hashes are pinned golden values. */
@DisplayName("LogicalIds")
class LogicalIdsTest {

    @Test
    @DisplayName("short paths")
    void shortPaths() {
        assertThat(LogicalIds.generateLogicalId(List.of())).isEmpty();
        assertThat(LogicalIds.generateLogicalId(List.of("x"))).isEqualTo("x");
        assertThat(LogicalIds.generateLogicalId(List.of("stack", "my-resource"))).isEqualTo("my-resource");
        assertThat(LogicalIds.generateLogicalId(List.of("app", "stack"))).isEqualTo("stack");
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "app/stack/resource, stack_resource_B9C9345B",
        "app/stack/Default/resource, stack_resource_B9C9345B",
        "app/my-stack/instance, my-stack_instance_066DA6AC",
        "app/stack@123/resource#456, stack123_resource456_BEFD9908",
        "app/stack/Resource/instance, stack_instance_CD6E02D6",
        "app/stack/MyBucket/Bucket, stack_MyBucket_262A4485"
    })
    @DisplayName("golden ids")
    void goldenIds(String path, String expected) {
        assertThat(LogicalIds.generateLogicalId(List.of(path.split("/")))).isEqualTo(expected);
    }

    @Test
    @DisplayName("deterministic for the same path")
    void deterministic() {
        List<String> path = List.of("app", "stack", "vpc", "subnet");

        assertThat(LogicalIds.generateLogicalId(path)).isEqualTo(LogicalIds.generateLogicalId(List.copyOf(path)));
    }

    @Test
    @DisplayName("paths that sanitize alike still get distinct ids")
    void distinctHashesForSameHumanPart() {
        String dashed = LogicalIds.generateLogicalId(List.of("app", "stack", "a.b"));
        String plain = LogicalIds.generateLogicalId(List.of("app", "stack", "ab"));

        assertThat(dashed).startsWith("stack_ab_");
        assertThat(plain).startsWith("stack_ab_");
        assertThat(dashed).isNotEqualTo(plain);
    }

    @Test
    @DisplayName("the same element in two stacks gets two ids")
    void stackNameIsPartOfId() {
        assertThat(LogicalIds.generateLogicalId(List.of("app", "stack1", "resource"))).isEqualTo("stack1_resource_63F58D61");
        assertThat(LogicalIds.generateLogicalId(List.of("app", "stack2", "resource"))).isEqualTo("stack2_resource_35816258");
    }

    @Test
    @DisplayName("the readable part is capped")
    void humanPartTruncated() {
        String longId = "x".repeat(300);

        String id = LogicalIds.generateLogicalId(List.of("app", "stack", longId));

        assertThat(id).hasSize(LogicalIds.MAX_HUMAN_LENGTH + 1 + LogicalIds.HASH_LENGTH);
        assertThat(id).matches("stack_x+_[0-9A-F]{8}");
    }

    @Test
    @DisplayName("a single component over the id limit falls back to the hashed form")
    void longSingleComponentHashed() {
        String atLimit = "y".repeat(LogicalIds.MAX_ID_LENGTH);
        String overLimit = "y".repeat(LogicalIds.MAX_ID_LENGTH + 1);

        assertThat(LogicalIds.generateLogicalId(List.of("app", atLimit))).isEqualTo(atLimit);

        String id = LogicalIds.generateLogicalId(List.of("app", overLimit));
        assertThat(id).hasSize(LogicalIds.MAX_HUMAN_LENGTH + 1 + LogicalIds.HASH_LENGTH);
        assertThat(id).matches("y{240}_[0-9A-F]{8}");
    }

    @Test
    @DisplayName("only [A-Za-z0-9_-] survives sanitizing")
    void sanitize() {
        assertThat(LogicalIds.sanitize("a.b/c d_e-f!")).isEqualTo("abcd_e-f");
    }

    @Test
    @DisplayName("generateFqn joins type and id")
    void fqn() {
        assertThat(LogicalIds.generateFqn("aws_instance", "stack_web_39C4F105")).isEqualTo("aws_instance.stack_web_39C4F105");
    }
}
