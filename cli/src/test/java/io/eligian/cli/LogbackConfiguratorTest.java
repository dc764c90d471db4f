package io.eligian.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.slf4j.LoggerFactory;

class LogbackConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void restoreDefaults() {
        LogbackConfigurator.configure("text", "WARN");
    }

    private ConsoleAppender<ILoggingEvent> rootAppender() {
        return (ConsoleAppender<ILoggingEvent>)
                context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender(LogbackConfigurator.APPENDER_NAME);
    }

    @Test
    @DisplayName("logs are written to stderr so stdout stays free for JSON output")
    void stderrTarget() {
        LogbackConfigurator.configure("text", "INFO");

        ConsoleAppender<ILoggingEvent> appender = rootAppender();
        assertThat(appender).isNotNull();
        assertThat(appender.getTarget()).isEqualTo("System.err");
        assertThat(appender.isStarted()).isTrue();
    }

    @Test
    @DisplayName("text format uses the pattern encoder, json the structured encoder")
    void encoders() {
        LogbackConfigurator.configure("text", "INFO");
        assertThat(rootAppender().getEncoder())
                .isInstanceOfSatisfying(PatternLayoutEncoder.class, encoder ->
                        assertThat(encoder.getPattern()).isEqualTo(LogbackConfigurator.TEXT_PATTERN));

        LogbackConfigurator.configure("JSON", "INFO");
        assertThat(rootAppender().getEncoder()).isInstanceOf(JsonEncoder.class);
    }

    @ParameterizedTest(name = "logging.level={0}")
    @DisplayName("the level applies to compiler loggers while the rest stays at WARN")
    @CsvSource(delimiter = '|', value = {"DEBUG | DEBUG", "info | INFO", "' error ' | ERROR", "OFF | OFF"})
    void compilerLevel(String configured, String expected) {
        LogbackConfigurator.configure("text", configured);

        assertThat(context.getLogger(LogbackConfigurator.COMPILER_LOGGER).getLevel())
                .isEqualTo(Level.toLevel(expected));
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
        assertThat(context.getLogger("com.networknt").getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    @DisplayName("an unknown level falls back to WARN and says so")
    void unknownLevel() {
        Logger compiler = context.getLogger(LogbackConfigurator.COMPILER_LOGGER);
        ListAppender<ILoggingEvent> captured = new ListAppender<>();
        captured.start();
        compiler.addAppender(captured);
        try {
            LogbackConfigurator.configure("text", "LOUD");

            assertThat(compiler.getLevel()).isEqualTo(Level.WARN);
            assertThat(captured.list)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .containsExactly("Unknown logging.level 'LOUD', using WARN");
        } finally {
            compiler.detachAppender(captured);
            captured.stop();
        }
    }
}
