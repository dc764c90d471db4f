package io.eligian.core.error;

import io.eligian.core.ast.SourceLocation;

/**
 * Abstract base for every error the compile pipeline can surface. The set of kinds is closed: the
 * constructor is package-private, so the concrete subclasses in this package are the only
 * variants, and a {@code switch} over {@link #kind()} covers all of them.
 */
public abstract class CompilerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline stage that produced the error. */
    public enum Kind {
        PARSE,
        VALIDATION,
        TYPE,
        TRANSFORM,
        OPTIMIZATION,
        EMIT
    }

    private final Kind kind;
    private final transient SourceLocation location;
    private final String hint;

    CompilerException(Kind kind, String message, SourceLocation location, String hint, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.location = location;
        this.hint = hint;
    }

    /** The stage that produced this error. */
    public Kind kind() {
        return kind;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** Where the error was detected, or {@code null} when no source position applies. */
    public SourceLocation location() {
        return location;
    }

    /** Suggested fix, or {@code null}. */
    public String hint() {
        return hint;
    }

    /** Single-line rendering used by loggers and the command-line output. */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(label(kind)).append(": ").append(getMessage());
        if (location != null) {
            sb.append(" at ").append(location);
        }
        if (hint != null) {
            sb.append(" (hint: ").append(hint).append(')');
        }
        return sb.toString();
    }

    static String label(Kind kind) {
        return switch (kind) {
            case PARSE -> "Parse error";
            case VALIDATION -> "Validation error";
            case TYPE -> "Type error";
            case TRANSFORM -> "Transform error";
            case OPTIMIZATION -> "Optimization error";
            case EMIT -> "Emit error";
        };
    }
}
