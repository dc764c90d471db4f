package io.eligian.core.compiler;

import io.eligian.core.error.CompilerException;
import io.eligian.core.validation.Diagnostic;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a compilation. Exactly one of two states:
 *
 * <ul>
 *   <li>{@link Type#SUCCESS}: {@code value} holds the output; {@code diagnostics} may still
 *       contain warnings.
 *   <li>{@link Type#FAILURE}: {@code error} holds the first fatal error; {@code diagnostics}
 *       holds every diagnostic collected before the pipeline stopped.
 * </ul>
 *
 * @param <T> output type
 */
public final class CompileResult<T> {

    /** The type of compile outcome. */
    public enum Type {
        SUCCESS,
        FAILURE
    }

    private final Type type;
    private final T value;
    private final CompilerException error;
    private final List<Diagnostic> diagnostics;

    private CompileResult(Type type, T value, CompilerException error, List<Diagnostic> diagnostics) {
        this.type = type;
        this.value = value;
        this.error = error;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public static <T> CompileResult<T> success(T value, List<Diagnostic> diagnostics) {
        Objects.requireNonNull(value, "value must not be null for SUCCESS");
        return new CompileResult<>(Type.SUCCESS, value, null, diagnostics);
    }

    public static <T> CompileResult<T> failure(CompilerException error, List<Diagnostic> diagnostics) {
        Objects.requireNonNull(error, "error must not be null for FAILURE");
        return new CompileResult<>(Type.FAILURE, null, error, diagnostics);
    }

    public Type type() {
        return type;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    /** The output; only present on success. */
    public T value() {
        return value;
    }

    /** The fatal error; only present on failure. */
    public CompilerException error() {
        return error;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "CompileResult{SUCCESS, diagnostics=" + diagnostics.size() + "}";
            case FAILURE -> "CompileResult{FAILURE, error=" + error.format() + ", diagnostics=" + diagnostics.size()
                    + "}";
        };
    }
}
