package io.tfsynth.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.tfsynth.core.model.ValidationError;
import io.tfsynth.core.model.ValidationErrorCode;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: one abstract root, concrete types carrying phase and path. */
class ExceptionHierarchyTest {

    @Test
    void synthExceptionIsAbstractAndRoot() {
        assertThat(SynthException.class).isAbstract();
        assertThat(SynthException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void unknownConstructPath() {
        var ex = new UnknownConstructPathException("No construct at path app/x", List.of("app", "x"));

        assertThat(ex).isInstanceOf(SynthException.class);
        assertThat(ex.phase()).isEqualTo(SynthException.Phase.CONSTRUCTION);
        assertThat(ex.path()).containsExactly("app", "x");
        assertThat(ex.detail()).isEqualTo("No construct at path app/x");
    }

    @Test
    void unresolvedToken() {
        var ex = new UnresolvedTokenException("Unknown token 7", 7);

        assertThat(ex.tokenId()).isEqualTo(7);
        assertThat(ex.path()).isEmpty();
        assertThat(ex.phase()).isEqualTo(SynthException.Phase.CONSTRUCTION);
    }

    @Test
    void treeValidationCarriesAllErrors() {
        List<ValidationError> errors = List.of(
                new ValidationError(
                        List.of("app", "s"), "Stack requires 'stackName'", ValidationErrorCode.MISSING_REQUIRED_FIELD),
                new ValidationError(
                        List.of("a", "b", "a"), "Circular dependency", ValidationErrorCode.CIRCULAR_DEPENDENCY));

        var ex = new TreeValidationException(errors);

        assertThat(ex.phase()).isEqualTo(SynthException.Phase.VALIDATION);
        assertThat(ex.errors()).isEqualTo(errors);
        assertThat(ex.getMessage())
                .startsWith("2 validation error(s):")
                .contains("[MISSING_REQUIRED_FIELD] app/s: Stack requires 'stackName'")
                .contains("[CIRCULAR_DEPENDENCY] a/b/a: Circular dependency");
    }

    @Test
    void logicalIdCollision() {
        var ex = new LogicalIdCollisionException(
                List.of("app", "stack"), List.of("resource.a.b is produced by both x and y"));

        assertThat(ex.phase()).isEqualTo(SynthException.Phase.SYNTHESIS);
        assertThat(ex.path()).containsExactly("app", "stack");
        assertThat(ex.collisions()).containsExactly("resource.a.b is produced by both x and y");
        assertThat(ex.getMessage())
                .isEqualTo("Logical id collision in stack app/stack: resource.a.b is produced by both x and y");
    }
}
