package io.eligian.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link CompilerConfig} from {@code eligian.yaml} and overlays environment variables.
 *
 * <p>YAML keys: {@code compiler.optimize}, {@code compiler.minify}, {@code output.dir}, {@code
 * logging.format}, {@code logging.level}. Each can be overridden by {@code ELIGIAN_OPTIMIZE},
 * {@code ELIGIAN_MINIFY}, {@code ELIGIAN_OUTPUT_DIR}, {@code ELIGIAN_LOG_FORMAT} and {@code
 * ELIGIAN_LOG_LEVEL}. A variable counts as set only when its trimmed value is non-empty.
 */
public final class ConfigLoader {

    static final String DEFAULT_CONFIG_FILE = "eligian.yaml";
    static final Set<String> LOGGING_FORMATS = Set.of("text", "json");

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath} with overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CompilerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath} with overrides from {@code envLookup}.
     *
     * @param envLookup maps a variable name to its value, {@code null} when undefined
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CompilerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
    }

    /** Defaults plus environment overrides, for runs without a configuration file. */
    public static CompilerConfig defaults(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
    }

    /**
     * Resolves the configuration path from command-line arguments.
     *
     * @return the {@code --config} argument, else {@code eligian.yaml} in the working directory if it
     *     exists, else empty
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Optional<Path> resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Optional.of(Path.of(args[i + 1]));
            }
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        return Files.exists(fallback) ? Optional.of(fallback) : Optional.empty();
    }

    private static CompilerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CompilerConfig.Builder builder = CompilerConfig.builder();

        JsonNode compiler = root.path("compiler");
        if (compiler.has("optimize")) builder.optimize(compiler.get("optimize").asBoolean());
        if (compiler.has("minify")) builder.minify(compiler.get("minify").asBoolean());

        JsonNode output = root.path("output");
        if (output.has("dir")) builder.outputDir(output.get("dir").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        envBool(envLookup, "ELIGIAN_OPTIMIZE", builder::optimize);
        envBool(envLookup, "ELIGIAN_MINIFY", builder::minify);
        envString(envLookup, "ELIGIAN_OUTPUT_DIR", builder::outputDir);
        envString(envLookup, "ELIGIAN_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "ELIGIAN_LOG_LEVEL", builder::loggingLevel);

        CompilerConfig config = builder.build();
        String format = config.loggingFormat().toLowerCase(Locale.ROOT);
        if (!LOGGING_FORMATS.contains(format)) {
            throw new ConfigLoadException(
                    "Invalid logging.format '" + config.loggingFormat() + "': expected text or json");
        }
        return config;
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
