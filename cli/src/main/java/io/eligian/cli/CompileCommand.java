package io.eligian.cli;

import io.eligian.cli.config.CompilerConfig;
import io.eligian.core.compiler.CompilationPipeline;
import io.eligian.core.compiler.CompileOptions;
import io.eligian.core.compiler.CompileResult;
import io.eligian.core.compiler.CompiledConfiguration;
import io.eligian.core.validation.Diagnostic;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Compiles one {@code .eligian} file and writes the JSON configuration. */
public final class CompileCommand {

    private static final Logger LOG = LoggerFactory.getLogger(CompileCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_COMPILE_ERROR = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_IO_ERROR = 3;

    static final String USAGE =
            "Usage: eligian <input.eligian> [-o <file>|-] [--check] [--minify] [--no-optimize] [-q] [--config <path>]";

    /**
     * Parsed command line.
     *
     * @param input source file
     * @param output output file, {@code "-"} for stdout, or {@code null} for the default location
     * @param check validate only, write nothing
     * @param minify {@code --minify} was given
     * @param noOptimize {@code --no-optimize} was given
     * @param quiet suppress success messages
     */
    public record Arguments(
            Path input, String output, boolean check, boolean minify, boolean noOptimize, boolean quiet) {}

    private final CompilationPipeline pipeline;
    private final PrintStream out;
    private final PrintStream err;

    public CompileCommand(CompilationPipeline pipeline, PrintStream out, PrintStream err) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.err = Objects.requireNonNull(err, "err must not be null");
    }

    /**
     * Parses command-line arguments.
     *
     * @throws IllegalArgumentException on unknown options, missing values or a missing input file
     */
    public static Arguments parse(String[] args) {
        Path input = null;
        String output = null;
        boolean check = false;
        boolean minify = false;
        boolean noOptimize = false;
        boolean quiet = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-o", "--output" -> output = value(args, ++i, arg);
                // resolved separately by ConfigLoader.resolveConfigPath
                case "--config" -> value(args, ++i, arg);
                case "--check" -> check = true;
                case "--minify" -> minify = true;
                case "--no-optimize" -> noOptimize = true;
                case "-q", "--quiet" -> quiet = true;
                default -> {
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (input != null) {
                        throw new IllegalArgumentException("Only one input file is supported, got: " + arg);
                    }
                    input = Path.of(arg);
                }
            }
        }
        if (input == null) {
            throw new IllegalArgumentException("Missing input file");
        }
        return new Arguments(input, output, check, minify, noOptimize, quiet);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }

    /** Runs the compilation and returns the process exit code. */
    public int run(Arguments args, CompilerConfig config) {
        if (!Files.isRegularFile(args.input())) {
            err.println("I/O Error: input file not found: " + args.input());
            return EXIT_IO_ERROR;
        }
        CompileOptions options = CompileOptions.builder()
                .optimize(config.optimize() && !args.noOptimize())
                .minify(config.minify() || args.minify())
                .build();
        CompileResult<CompiledConfiguration> result = pipeline.compileFile(args.input(), options);
        if (!result.isSuccess()) {
            err.println("Compilation failed:");
            err.print(DiagnosticFormatter.formatAll(result.diagnostics()));
            return EXIT_COMPILE_ERROR;
        }
        List<Diagnostic> warnings = result.diagnostics();
        if (!warnings.isEmpty() && !args.quiet()) {
            err.print(DiagnosticFormatter.formatAll(warnings));
        }
        if (args.check()) {
            if (!args.quiet()) {
                out.println(args.input() + " is valid");
            }
            return EXIT_OK;
        }

        String json = result.value().json();
        if ("-".equals(args.output())) {
            out.println(json);
            return EXIT_OK;
        }
        Path target = outputPath(args, config);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.debug("Output write failed: target={}", target, e);
            err.println("I/O Error: cannot write " + target + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }
        if (!args.quiet()) {
            out.println("Compiled " + args.input() + " -> " + target);
        }
        return EXIT_OK;
    }

    /** {@code -o} wins, then {@code output.dir}, then the input path with a {@code .json} extension. */
    static Path outputPath(Arguments args, CompilerConfig config) {
        if (args.output() != null) {
            return Path.of(args.output());
        }
        String fileName = args.input().getFileName().toString();
        String jsonName = fileName.endsWith(".eligian")
                ? fileName.substring(0, fileName.length() - ".eligian".length()) + ".json"
                : fileName + ".json";
        if (config.outputDir() != null) {
            return Path.of(config.outputDir()).resolve(jsonName);
        }
        return args.input().resolveSibling(jsonName);
    }
}
