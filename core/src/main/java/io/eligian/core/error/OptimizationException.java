package io.eligian.core.error;

import io.eligian.core.ast.SourceLocation;

/** An internal invariant was violated while optimizing the intermediate representation. */
public final class OptimizationException extends CompilerException {

    private static final long serialVersionUID = 1L;

    public OptimizationException(String message, SourceLocation location) {
        super(Kind.OPTIMIZATION, message, location, null, null);
    }

    public OptimizationException(String message, SourceLocation location, String hint) {
        super(Kind.OPTIMIZATION, message, location, hint, null);
    }

    public OptimizationException(String message, SourceLocation location, String hint, Throwable cause) {
        super(Kind.OPTIMIZATION, message, location, hint, cause);
    }
}
