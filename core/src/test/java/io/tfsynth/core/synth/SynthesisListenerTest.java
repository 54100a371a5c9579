package io.tfsynth.core.synth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tfsynth.core.error.TreeValidationException;
import io.tfsynth.core.model.ConstructMetadata;
import io.tfsynth.core.model.ConstructNode;
import io.tfsynth.core.model.OutputDef;
import io.tfsynth.core.model.ProviderDef;
import io.tfsynth.core.spi.SynthesisListener;
import io.tfsynth.core.spi.SynthesisListener.AppSynthesizedEvent;
import io.tfsynth.core.spi.SynthesisListener.StackSynthesizedEvent;
import io.tfsynth.core.spi.SynthesisListener.ValidationFailedEvent;
import io.tfsynth.core.testkit.TestTrees;
import io.tfsynth.core.token.TokenTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for the {@link SynthesisListener} hooks fired by {@link StackSynthesizer}. */
@DisplayName("SynthesisListener")
class SynthesisListenerTest {

    private static ConstructNode stackWithThreeElements() {
        ConstructNode stack = TestTrees.stack("stack");
        return TestTrees.with(
                stack,
                TestTrees.provider(stack, "aws", ProviderDef.of("hashicorp/aws", Map.of())),
                TestTrees.resource(stack, "web", "aws_instance"),
                TestTrees.child(stack, "ip", new ConstructMetadata.Output(OutputDef.of("1.2.3.4"))));
    }

    @Test
    @DisplayName("stack synthesis reports name, path and element count")
    void stackSynthesizedEvent() {
        CapturingListener listener = new CapturingListener();

        new StackSynthesizer(new TokenTable(), listener).synthesizeStack(stackWithThreeElements());

        assertThat(listener.stackEvents).singleElement().satisfies(event -> {
            assertThat(event.stackName()).isEqualTo("stack");
            assertThat(event.constructPath()).isEqualTo("app/stack");
            assertThat(event.elementCount()).isEqualTo(3);
            assertThat(event.durationMs()).isGreaterThanOrEqualTo(0);
        });
        assertThat(listener.validationEvents).isEmpty();
    }

    @Test
    @DisplayName("refused synthesis reports the error codes")
    void validationFailedEvent() {
        CapturingListener listener = new CapturingListener();
        ConstructNode stack = TestTrees.stack("stack");
        stack = TestTrees.with(stack, TestTrees.resource(stack, "web", ""));
        ConstructNode tree = TestTrees.appWith(stack);
        ConstructNode target = stack;
        StackSynthesizer synthesizer = new StackSynthesizer(new TokenTable(), listener);

        assertThatThrownBy(() -> synthesizer.synthesizeValidated(tree, target))
                .isInstanceOf(TreeValidationException.class);

        assertThat(listener.validationEvents).singleElement().satisfies(event -> {
            assertThat(event.rootPath()).isEqualTo("app");
            assertThat(event.errorCount()).isEqualTo(1);
            assertThat(event.errorCodes()).containsExactly("MISSING_REQUIRED_FIELD");
        });
        assertThat(listener.stackEvents).isEmpty();
    }

    @Test
    @DisplayName("a failing listener does not break synthesis")
    void failingListenerIgnored() {
        SynthesisListener failing = new CapturingListener() {
            @Override
            public void onStackSynthesized(StackSynthesizedEvent event) {
                throw new IllegalStateException("listener down");
            }
        };

        StackSynthesizer synthesizer = new StackSynthesizer(new TokenTable(), failing);

        assertThat(synthesizer.synthesizeStack(stackWithThreeElements()).resource()).isPresent();
    }

    private static class CapturingListener implements SynthesisListener {

        final List<StackSynthesizedEvent> stackEvents = new ArrayList<>();
        final List<ValidationFailedEvent> validationEvents = new ArrayList<>();
        final List<AppSynthesizedEvent> appEvents = new ArrayList<>();

        @Override
        public void onStackSynthesized(StackSynthesizedEvent event) {
            stackEvents.add(event);
        }

        @Override
        public void onValidationFailed(ValidationFailedEvent event) {
            validationEvents.add(event);
        }

        @Override
        public void onAppSynthesized(AppSynthesizedEvent event) {
            appEvents.add(event);
        }
    }
}
