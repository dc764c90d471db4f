package io.eligian.core.compiler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eligian.core.asset.AssetLoader;
import io.eligian.core.asset.FileAssetLoader;
import io.eligian.core.ast.AssetImport;
import io.eligian.core.ast.Document;
import io.eligian.core.ast.Library;
import io.eligian.core.ast.Program;
import io.eligian.core.ast.SourceLocation;
import io.eligian.core.error.CompilerException;
import io.eligian.core.error.EmitException;
import io.eligian.core.error.OptimizationException;
import io.eligian.core.error.ParseException;
import io.eligian.core.error.TransformException;
import io.eligian.core.error.TypeCheckException;
import io.eligian.core.error.ValidationException;
import io.eligian.core.ir.EligiusIR;
import io.eligian.core.library.ContentLoader;
import io.eligian.core.library.FileContentLoader;
import io.eligian.core.library.LibraryCache;
import io.eligian.core.library.LibraryDocument;
import io.eligian.core.library.LibraryPathResolver;
import io.eligian.core.library.LibraryResolver;
import io.eligian.core.parse.SourceParser;
import io.eligian.core.registry.OperationRegistry;
import io.eligian.core.spi.CompilationListener;
import io.eligian.core.validation.AssetValidator;
import io.eligian.core.validation.Diagnostic;
import io.eligian.core.validation.OperationValidator;
import io.eligian.core.validation.ProgramValidator;
import io.eligian.core.validation.ValidationContext;
import io.eligian.core.validation.ValidationRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs source text through parse, library resolution, validation, transformation, type checking,
 * optimization and emission.
 *
 * <p>Each call builds its own {@link CompilationContext}, so a pipeline instance can serve many
 * compilations, including concurrent ones. Every failure surfaces as a {@link CompilerException}
 * inside a failed {@link CompileResult}; nothing else escapes {@link #compile}.
 *
 * <pre>{@code
 * CompilationPipeline pipeline = CompilationPipeline.builder().build();
 * CompileResult<CompiledConfiguration> result =
 *         pipeline.compileFile(Path.of("presentation.eligian"), CompileOptions.defaults());
 * }</pre>
 */
public final class CompilationPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(CompilationPipeline.class);

    static final String LIBRARY_ERROR_CODE = "library_error";

    private final OperationRegistry registry;
    private final ContentLoader contentLoader;
    private final AssetLoader assetLoader;
    private final LibraryCache libraryCache;
    private final CompilationListener listener;
    private final ValidationRegistry checks;
    private final SourceParser parser = new SourceParser();
    private final JsonEmitter emitter = new JsonEmitter();

    private CompilationPipeline(Builder builder) {
        this.registry = builder.registry != null ? builder.registry : OperationRegistry.defaultRegistry();
        this.contentLoader = builder.contentLoader != null ? builder.contentLoader : new FileContentLoader();
        this.assetLoader = builder.assetLoader != null ? builder.assetLoader : new FileAssetLoader();
        this.libraryCache = builder.libraryCache;
        this.listener = builder.listener;
        this.checks = builder.checks != null ? builder.checks : ValidationRegistry.defaults();
    }

    public static Builder builder() {
        return new Builder();
    }

    public OperationRegistry registry() {
        return registry;
    }

    /** Compiles source text into the runtime JSON configuration. */
    public CompileResult<CompiledConfiguration> compile(String source, CompileOptions options) {
        CompilationContext ctx = newContext(options);
        long start = System.nanoTime();
        try {
            EligiusIR ir = toIR(source, ctx);
            CompiledConfiguration compiled = stage(CompilationStage.EMIT, ctx, () -> {
                ObjectNode json = emitter.toJson(ir);
                String text = emitter.emit(ir, ctx.options().minify());
                return new CompiledConfiguration(ir, json, text);
            });
            logCompleted(ctx, start);
            return CompileResult.success(compiled, ctx.diagnostics());
        } catch (CompilerException e) {
            return failure(ctx, e);
        }
    }

    /** Reads {@code file} and compiles it; the file's path becomes the source URI. */
    public CompileResult<CompiledConfiguration> compileFile(Path file, CompileOptions options) {
        CompileOptions withUri = options.withSourceUri(file.toAbsolutePath().toString());
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            CompilerException error = new ParseException(
                    "Failed to read source file: " + file,
                    null,
                    "Check that the file exists and is readable",
                    e);
            return failure(newContext(withUri), error);
        }
        return compile(source, withUri);
    }

    /** Runs every stage except emission and returns the optimized IR. */
    public CompileResult<EligiusIR> compileToIR(String source, CompileOptions options) {
        CompilationContext ctx = newContext(options);
        long start = System.nanoTime();
        try {
            EligiusIR ir = toIR(source, ctx);
            logCompleted(ctx, start);
            return CompileResult.success(ir, ctx.diagnostics());
        } catch (CompilerException e) {
            return failure(ctx, e);
        }
    }

    /**
     * Parses, resolves and validates without transforming. Parse and library failures are
     * reported as diagnostics instead of exceptions, so editors always get a list back.
     *
     * @param source document text
     * @param uri document URI, or {@code null} for unsaved buffers
     * @return diagnostics in document order
     */
    public List<Diagnostic> analyze(String source, String uri) {
        CompilationContext ctx = newContext(CompileOptions.builder().sourceUri(uri).build());
        Document document;
        try {
            document = parser.parse(source, ctx.sourceUri());
        } catch (ParseException e) {
            return List.of(Diagnostic.error(
                    errorCode(CompilationStage.PARSE, e), e.detail(), locationOf(e, ctx), e.hint()));
        }
        try {
            List<LibraryDocument> libraries = resolveLibraries(document);
            link(document, libraries, ctx);
        } catch (ParseException e) {
            return List.of(Diagnostic.error(
                    errorCode(CompilationStage.RESOLVE_LIBRARIES, e), e.detail(), locationOf(e, ctx), e.hint()));
        }
        ctx.addDiagnostics(validate(document, ctx));
        return ctx.diagnostics();
    }

    private EligiusIR toIR(String source, CompilationContext ctx) {
        Document document = stage(CompilationStage.PARSE, ctx, () -> {
            Document parsed = parser.parse(source, ctx.sourceUri());
            if (parsed instanceof Library) {
                throw new ParseException(
                        "Cannot compile library files directly",
                        parsed.location(),
                        "Library files must be imported by a main program. Create a .eligian file with an"
                                + " \"import\" statement to use this library.");
            }
            return parsed;
        });
        Program program = (Program) document;
        ctx.program(program);

        List<LibraryDocument> libraries =
                stage(CompilationStage.RESOLVE_LIBRARIES, ctx, () -> resolveLibraries(program));
        stage(CompilationStage.VALIDATE, ctx, () -> {
            link(program, libraries, ctx);
            List<Diagnostic> found = validate(program, ctx);
            ctx.addDiagnostics(found);
            Optional<Diagnostic> firstError = ctx.diagnostics().stream()
                    .filter(Diagnostic::isError)
                    .findFirst();
            if (firstError.isPresent()) {
                Diagnostic error = firstError.get();
                throw new ValidationException(error.message(), error.location(), error.hint());
            }
            return found;
        });

        EligiusIR transformed = stage(CompilationStage.TRANSFORM, ctx, () -> {
            collectAssets(program, ctx);
            return new AstTransformer(registry).transform(ctx);
        });
        EligiusIR checked = stage(CompilationStage.TYPE_CHECK, ctx, () -> new TypeChecker().check(transformed));
        if (!ctx.options().optimize()) {
            return checked;
        }
        return stage(CompilationStage.OPTIMIZE, ctx, () -> new Optimizer().optimize(checked));
    }

    private List<LibraryDocument> resolveLibraries(Document document) {
        if (document.uri() == null || document.libraryImports().isEmpty()) {
            return List.of();
        }
        return new LibraryResolver(contentLoader, parser, libraryCache).resolveImports(document);
    }

    /** Indexes every document first, then links each one against the complete index. */
    private static void link(Document entry, List<LibraryDocument> libraries, CompilationContext ctx) {
        List<Document> all = new ArrayList<>();
        all.add(entry);
        for (LibraryDocument library : libraries) {
            all.add(library.library());
        }
        ctx.libraries(libraries);
        ctx.index().index(all);
        for (Document document : all) {
            ctx.scope(document, ctx.index().link(document));
        }
    }

    private List<Diagnostic> validate(Document entry, CompilationContext ctx) {
        OperationValidator operations = new OperationValidator(registry);
        ProgramValidator validator = new ProgramValidator(checks);
        List<Diagnostic> diagnostics = new ArrayList<>(
                validator.validate(new ValidationContext(entry, operations, ctx.scopeOf(entry.uri()))));
        for (LibraryDocument library : ctx.libraries()) {
            diagnostics.addAll(validator.validate(
                    new ValidationContext(library.library(), operations, ctx.scopeOf(library.uri()))));
        }
        if (entry instanceof Program program) {
            diagnostics.addAll(new AssetValidator(assetLoader).validate(program));
        }
        return diagnostics;
    }

    private void collectAssets(Program program, CompilationContext ctx) {
        for (AssetImport asset : program.assetImports()) {
            if (asset.form() == AssetImport.Form.STYLES) {
                ctx.addCssFile(asset.path());
            } else if (asset.form() == AssetImport.Form.LAYOUT && program.uri() != null) {
                String path = LibraryPathResolver.resolve(program.uri(), asset.path());
                assetLoader.readText(path).ifPresent(ctx::layoutTemplate);
            }
        }
    }

    private CompilationContext newContext(CompileOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        String uri = options.sourceUri();
        return new CompilationContext(
                uri == null ? options : options.withSourceUri(LibraryPathResolver.normalize(uri)));
    }

    /**
     * Runs one stage with listener notifications and timing. Unexpected runtime failures are
     * wrapped in the exception kind that belongs to the stage.
     */
    private <T> T stage(CompilationStage stage, CompilationContext ctx, Supplier<T> body) {
        notifyStarted(ctx, stage);
        long start = System.nanoTime();
        T result;
        try {
            result = body.get();
        } catch (CompilerException e) {
            ctx.failedStage(stage);
            notifyFailed(ctx, stage, e);
            throw e;
        } catch (RuntimeException e) {
            CompilerException wrapped = wrap(stage, e);
            ctx.failedStage(stage);
            notifyFailed(ctx, stage, wrapped);
            throw wrapped;
        }
        long durationMs = (System.nanoTime() - start) / 1_000_000;
        LOG.debug("Stage completed: source={}, stage={}, duration_ms={}", ctx.sourceUri(), stage, durationMs);
        notifyCompleted(ctx, stage, durationMs);
        return result;
    }

    static CompilerException wrap(CompilationStage stage, RuntimeException e) {
        String message = "Internal error during " + stage.name().toLowerCase(Locale.ROOT) + ": " + e.getMessage();
        SourceLocation location = null;
        return switch (stage) {
            case PARSE, RESOLVE_LIBRARIES -> new ParseException(message, location, null, e);
            case VALIDATE -> new ValidationException(message, location, null, e);
            case TRANSFORM -> new TransformException(message, location, null, e);
            case TYPE_CHECK -> new TypeCheckException(message, location, null, e);
            case OPTIMIZE -> new OptimizationException(message, location, null, e);
            case EMIT -> new EmitException(message, location, null, e);
        };
    }

    private static <T> CompileResult<T> failure(CompilationContext ctx, CompilerException e) {
        LOG.info("Compilation failed: source={}, kind={}, detail={}", ctx.sourceUri(), e.kind(), e.detail());
        List<Diagnostic> diagnostics = ctx.diagnostics();
        if (diagnostics.isEmpty()) {
            diagnostics = List.of(Diagnostic.error(
                    errorCode(ctx.failedStage(), e), e.detail(), locationOf(e, ctx), e.hint()));
        }
        return CompileResult.failure(e, diagnostics);
    }

    /**
     * Diagnostic code for a fatal error: {@code library_error} for anything raised while loading
     * libraries, otherwise derived from the exception kind ({@code parse_error}, {@code
     * validation_error}, ...). {@code stage} is {@code null} when no stage had started.
     */
    static String errorCode(CompilationStage stage, CompilerException e) {
        if (stage == CompilationStage.RESOLVE_LIBRARIES) {
            return LIBRARY_ERROR_CODE;
        }
        return e.kind().name().toLowerCase(Locale.ROOT) + "_error";
    }

    private static SourceLocation locationOf(CompilerException e, CompilationContext ctx) {
        return e.location() != null ? e.location() : SourceLocation.start(ctx.sourceUri());
    }

    private static void logCompleted(CompilationContext ctx, long startNanos) {
        LOG.info(
                "Compilation completed: source={}, diagnostics={}, duration_ms={}",
                ctx.sourceUri(),
                ctx.diagnostics().size(),
                (System.nanoTime() - startNanos) / 1_000_000);
    }

    private void notifyStarted(CompilationContext ctx, CompilationStage stage) {
        if (listener == null) {
            return;
        }
        try {
            listener.onStageStarted(new CompilationListener.StageStartedEvent(ctx.sourceUri(), stage.name()));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onStageStarted failed", e);
        }
    }

    private void notifyCompleted(CompilationContext ctx, CompilationStage stage, long durationMs) {
        if (listener == null) {
            return;
        }
        try {
            listener.onStageCompleted(
                    new CompilationListener.StageCompletedEvent(ctx.sourceUri(), stage.name(), durationMs));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onStageCompleted failed", e);
        }
    }

    private void notifyFailed(CompilationContext ctx, CompilationStage stage, CompilerException error) {
        if (listener == null) {
            return;
        }
        try {
            listener.onCompilationFailed(new CompilationListener.CompilationFailedEvent(
                    ctx.sourceUri(), stage.name(), error.kind().name(), error.detail()));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onCompilationFailed failed", e);
        }
    }

    /** Builder for {@link CompilationPipeline}. Unset collaborators fall back to file-based defaults. */
    public static final class Builder {

        private OperationRegistry registry;
        private ContentLoader contentLoader;
        private AssetLoader assetLoader;
        private LibraryCache libraryCache;
        private CompilationListener listener;
        private ValidationRegistry checks;

        Builder() {}

        public Builder registry(OperationRegistry value) {
            this.registry = value;
            return this;
        }

        public Builder contentLoader(ContentLoader value) {
            this.contentLoader = value;
            return this;
        }

        public Builder assetLoader(AssetLoader value) {
            this.assetLoader = value;
            return this;
        }

        public Builder libraryCache(LibraryCache value) {
            this.libraryCache = value;
            return this;
        }

        public Builder listener(CompilationListener value) {
            this.listener = value;
            return this;
        }

        public Builder checks(ValidationRegistry value) {
            this.checks = value;
            return this;
        }

        public CompilationPipeline build() {
            return new CompilationPipeline(this);
        }
    }
}
