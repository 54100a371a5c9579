package io.tfsynth.standalone.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.tfsynth.standalone.config.SynthConfig;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback configuration for structured JSON or text logging, driven by {@code
 * logging.format} and {@code logging.level} of {@link SynthConfig}.
 *
 * <p>
 * JSON mode uses Logback's built-in {@link JsonEncoder} (timestamp, level, thread, logger,
 * message and MDC fields). Text mode uses a human-readable pattern.
 */
public final class LogbackConfigurator {

    /** Human-readable pattern for text mode. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    static final String APPENDER_NAME = "STDOUT";

    private LogbackConfigurator() {
        // utility class
    }

    public static void configure(SynthConfig config) {
        configure(config.loggingFormat(), config.loggingLevel());
    }

    /**
     * Replaces the root logger's appenders with a console appender.
     *
     * @param format "json" for structured output, anything else for text
     * @param level  root level name; unknown names fall back to INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);

        rootLogger.setLevel(Level.toLevel(level, Level.INFO));
        rootLogger.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setEncoder(encoder(context, format));
        appender.start();
        rootLogger.addAppender(appender);
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            return encoder;
        }
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }
}
