package io.eligian.core.error;

import io.eligian.core.ast.SourceLocation;

/** Syntax errors, unreadable or cyclic library imports, and attempts to compile a library file directly. */
public final class ParseException extends CompilerException {

    private static final long serialVersionUID = 1L;

    public ParseException(String message, SourceLocation location) {
        super(Kind.PARSE, message, location, null, null);
    }

    public ParseException(String message, SourceLocation location, String hint) {
        super(Kind.PARSE, message, location, hint, null);
    }

    public ParseException(String message, SourceLocation location, String hint, Throwable cause) {
        super(Kind.PARSE, message, location, hint, cause);
    }
}
