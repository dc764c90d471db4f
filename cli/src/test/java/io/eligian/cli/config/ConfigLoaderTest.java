package io.eligian.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** YAML mapping, defaults and error paths of {@link ConfigLoader}. */
@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class
                .getClassLoader()
                .getResource("config/" + name)
                .toURI());
    }

    @Nested
    @DisplayName("Mapping")
    class Mapping {

        @Test
        @DisplayName("minimal config keeps defaults for missing keys")
        void minimal() throws Exception {
            CompilerConfig config = ConfigLoader.load(fixture("minimal-config.yaml"), Map.<String, String>of()::get);

            assertThat(config.minify()).isTrue();
            assertThat(config.optimize()).isTrue();
            assertThat(config.outputDir()).isNull();
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }

        @Test
        @DisplayName("full config maps every key")
        void full() throws Exception {
            CompilerConfig config = ConfigLoader.load(fixture("full-config.yaml"), Map.<String, String>of()::get);

            assertThat(config.optimize()).isFalse();
            assertThat(config.minify()).isTrue();
            assertThat(config.outputDir()).isEqualTo("build/eligius");
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }

        @Test
        @DisplayName("an empty file yields the defaults")
        void emptyFile(@TempDir Path dir) throws Exception {
            Path empty = Files.writeString(dir.resolve("eligian.yaml"), "");

            assertThat(ConfigLoader.load(empty, Map.<String, String>of()::get))
                    .isEqualTo(CompilerConfig.builder().build());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("a missing file names the path and the --config option")
        void missingFile(@TempDir Path dir) {
            Path missing = dir.resolve("absent.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining(missing.toString())
                    .hasMessageContaining("--config");
        }

        @Test
        @DisplayName("malformed YAML keeps the parser error as cause")
        void malformed() throws Exception {
            Path path = fixture("malformed.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(path))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Failed to parse YAML configuration: ")
                    .hasCauseInstanceOf(java.io.IOException.class);
        }

        @Test
        @DisplayName("an unknown logging format is rejected")
        void invalidFormat() throws Exception {
            Path path = fixture("invalid-format.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(path, Map.<String, String>of()::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Invalid logging.format 'xml': expected text or json");
        }
    }

    @Nested
    @DisplayName("Config path resolution")
    class PathResolution {

        @Test
        @DisplayName("--config wins")
        void explicit() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"main.eligian", "--config", "custom.yaml"}))
                    .contains(Path.of("custom.yaml"));
        }

        @Test
        @DisplayName("--config without a value is a usage error")
        void missingValue() {
            assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"main.eligian", "--config"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("--config requires a file path argument");
        }
    }
}
