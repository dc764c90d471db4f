package io.eligian.cli;

import io.eligian.cli.config.CompilerConfig;
import io.eligian.cli.config.ConfigLoadException;
import io.eligian.cli.config.ConfigLoader;
import io.eligian.core.compiler.CompilationPipeline;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Command-line entry point: {@code eligian <file> [-o out] [--config path]}. */
public final class EligianMain {

    private static final Logger LOG = LoggerFactory.getLogger(EligianMain.class);

    private EligianMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(args, System::getenv, System.out, System.err);
        } catch (Exception e) {
            LOG.error("Compiler failed: {}", e.getMessage(), e);
            exitCode = CompileCommand.EXIT_IO_ERROR;
        }
        System.exit(exitCode);
    }

    /** Loads configuration, configures logging and runs the compile command. */
    static int run(String[] args, Function<String, String> envLookup, PrintStream out, PrintStream err) {
        CompileCommand.Arguments arguments;
        CompilerConfig config;
        try {
            arguments = CompileCommand.parse(args);
            Optional<Path> configPath = ConfigLoader.resolveConfigPath(args);
            config = configPath.isPresent()
                    ? ConfigLoader.load(configPath.get(), envLookup)
                    : ConfigLoader.defaults(envLookup);
        } catch (IllegalArgumentException | ConfigLoadException e) {
            err.println("Error: " + e.getMessage());
            err.println(CompileCommand.USAGE);
            return CompileCommand.EXIT_USAGE;
        }
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.debug("Configuration loaded: optimize={}, minify={}, output_dir={}",
                config.optimize(), config.minify(), config.outputDir());
        CompilationPipeline pipeline = CompilationPipeline.builder().build();
        return new CompileCommand(pipeline, out, err).run(arguments, config);
    }
}
