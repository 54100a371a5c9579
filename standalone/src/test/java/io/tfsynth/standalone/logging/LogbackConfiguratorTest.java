package io.tfsynth.standalone.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import io.tfsynth.standalone.config.SynthConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LogbackConfigurator")
class LogbackConfiguratorTest {

    private RootLoggerSnapshot snapshot;

    @BeforeEach
    void saveRoot() {
        snapshot = RootLoggerSnapshot.take();
    }

    @AfterEach
    void restoreRoot() {
        snapshot.restore();
    }

    @SuppressWarnings("unchecked")
    private static ConsoleAppender<ILoggingEvent> stdout() {
        return (ConsoleAppender<ILoggingEvent>)
                RootLoggerSnapshot.root().getAppender(LogbackConfigurator.APPENDER_NAME);
    }

    @Test
    @DisplayName("json format installs the JSON encoder")
    void jsonFormat() {
        LogbackConfigurator.configure(
                SynthConfig.builder().loggingFormat("JSON").loggingLevel("DEBUG").build());

        assertThat(RootLoggerSnapshot.root().getLevel()).isEqualTo(Level.DEBUG);
        assertThat(stdout().getEncoder()).isInstanceOf(JsonEncoder.class);
        assertThat(stdout().isStarted()).isTrue();
    }

    @Test
    @DisplayName("text format uses the pattern encoder")
    void textFormat() {
        LogbackConfigurator.configure("text", "WARN");

        assertThat(RootLoggerSnapshot.root().getLevel()).isEqualTo(Level.WARN);
        assertThat(stdout().getEncoder())
                .isInstanceOfSatisfying(PatternLayoutEncoder.class, e -> assertThat(e.getPattern())
                        .isEqualTo(LogbackConfigurator.TEXT_PATTERN));
    }

    @Test
    @DisplayName("an unknown level falls back to INFO")
    void unknownLevel() {
        LogbackConfigurator.configure("text", "chatty");

        assertThat(RootLoggerSnapshot.root().getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    @DisplayName("reconfiguring replaces the appender")
    void singleAppender() {
        LogbackConfigurator.configure("text", "INFO");
        LogbackConfigurator.configure("json", "INFO");

        assertThat(RootLoggerSnapshot.root().iteratorForAppenders())
                .toIterable()
                .singleElement()
                .extracting(a -> a.getName())
                .isEqualTo(LogbackConfigurator.APPENDER_NAME);
    }
}
