package io.eligian.core.error;

import io.eligian.core.ast.SourceLocation;

/** The intermediate representation could not be serialized to JSON. */
public final class EmitException extends CompilerException {

    private static final long serialVersionUID = 1L;

    public EmitException(String message, SourceLocation location) {
        super(Kind.EMIT, message, location, null, null);
    }

    public EmitException(String message, SourceLocation location, String hint) {
        super(Kind.EMIT, message, location, hint, null);
    }

    public EmitException(String message, SourceLocation location, String hint, Throwable cause) {
        super(Kind.EMIT, message, location, hint, cause);
    }
}
