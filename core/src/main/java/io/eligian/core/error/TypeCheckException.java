package io.eligian.core.error;

import io.eligian.core.ast.SourceLocation;

/** The transformed configuration is structurally incomplete, for example a missing id or an empty timeline list. */
public final class TypeCheckException extends CompilerException {

    private static final long serialVersionUID = 1L;

    public TypeCheckException(String message, SourceLocation location) {
        super(Kind.TYPE, message, location, null, null);
    }

    public TypeCheckException(String message, SourceLocation location, String hint) {
        super(Kind.TYPE, message, location, hint, null);
    }

    public TypeCheckException(String message, SourceLocation location, String hint, Throwable cause) {
        super(Kind.TYPE, message, location, hint, cause);
    }
}
