package io.eligian.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EligianMainTest {

    @TempDir
    Path dir;

    private final Map<String, String> env = new HashMap<>();
    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    private int run(String... args) {
        return EligianMain.run(
                args,
                env::get,
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    @Test
    void missingArgumentsPrintUsage() {
        assertThat(run()).isEqualTo(CompileCommand.EXIT_USAGE);
        assertThat(stderr.toString(StandardCharsets.UTF_8))
                .contains("Error: Missing input file")
                .contains("Usage: eligian");
    }

    @Test
    void missingConfigFileIsAUsageError() {
        int exit = run("main.eligian", "--config", dir.resolve("absent.yaml").toString());

        assertThat(exit).isEqualTo(CompileCommand.EXIT_USAGE);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("Configuration file not found");
    }

    @Test
    void invalidLoggingFormatFromEnvironmentIsAUsageError() {
        env.put("ELIGIAN_LOG_FORMAT", "xml");

        assertThat(run("main.eligian")).isEqualTo(CompileCommand.EXIT_USAGE);
    }

    @Test
    void compilesWithConfigFile() throws Exception {
        Path input = Files.writeString(
                dir.resolve("main.eligian"), "timeline \"t\" in \"#app\" using raf { at 0s..1s [ log(1) ] }");
        Path config = Files.writeString(
                dir.resolve("eligian.yaml"), "output:\n  dir: " + dir.resolve("out") + "\nlogging:\n  level: ERROR\n");

        int exit = run(input.toString(), "--config", config.toString());

        assertThat(exit).isEqualTo(CompileCommand.EXIT_OK);
        assertThat(dir.resolve("out/main.json")).exists();
    }

    @Test
    void environmentEnablesMinifiedOutput() throws Exception {
        Path input = Files.writeString(
                dir.resolve("main.eligian"), "timeline \"t\" in \"#app\" using raf { at 0s..1s [ log(1) ] }");
        env.put("ELIGIAN_MINIFY", "true");

        assertThat(run(input.toString(), "-o", "-")).isEqualTo(CompileCommand.EXIT_OK);
        assertThat(stdout.toString(StandardCharsets.UTF_8).trim()).doesNotContain("\n");
    }
}
