package io.eligian.core.error;

import io.eligian.core.ast.SourceLocation;

/**
 * The first error-severity diagnostic of a failed semantic check. The full diagnostic list travels
 * with the failed compile result.
 */
public final class ValidationException extends CompilerException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message, SourceLocation location) {
        super(Kind.VALIDATION, message, location, null, null);
    }

    public ValidationException(String message, SourceLocation location, String hint) {
        super(Kind.VALIDATION, message, location, hint, null);
    }

    public ValidationException(String message, SourceLocation location, String hint, Throwable cause) {
        super(Kind.VALIDATION, message, location, hint, cause);
    }
}
