package io.eligian.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import java.util.Locale;
import java.util.Set;
import org.slf4j.LoggerFactory;

/**
 * Reconfigures Logback from {@code logging.format} and {@code logging.level}.
 *
 * <p>The level applies to the compiler's own loggers ({@value #COMPILER_LOGGER}); everything else,
 * including the schema validator used while loading the operation registry, stays at {@code WARN}.
 * Logs go to stderr so that {@code -o -} output on stdout stays valid JSON.
 */
public final class LogbackConfigurator {

    static final String COMPILER_LOGGER = "io.eligian";
    static final String APPENDER_NAME = "STDERR";
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    private static final Set<String> LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * @param format {@code json} for Logback's structured encoder, anything else for the text pattern
     * @param level compiler log level; unknown names fall back to {@code WARN} with a warning
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.setLevel(Level.WARN);
        rootLogger.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder(format, context));
        appender.start();
        rootLogger.addAppender(appender);

        boolean known = level != null && LEVELS.contains(level.trim().toUpperCase(Locale.ROOT));
        Logger compiler = context.getLogger(COMPILER_LOGGER);
        compiler.setLevel(known ? Level.toLevel(level.trim(), Level.WARN) : Level.WARN);
        context.getLogger("com.networknt").setLevel(Level.WARN);
        if (!known) {
            compiler.warn("Unknown logging.level '{}', using WARN", level);
        }
    }

    private static Encoder<ILoggingEvent> encoder(String format, LoggerContext context) {
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
