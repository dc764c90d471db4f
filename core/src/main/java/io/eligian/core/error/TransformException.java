package io.eligian.core.error;

import io.eligian.core.ast.SourceLocation;

/**
 * The AST could not be lowered to the intermediate representation, for example a call to an action
 * that does not exist.
 */
public final class TransformException extends CompilerException {

    private static final long serialVersionUID = 1L;

    public TransformException(String message, SourceLocation location) {
        super(Kind.TRANSFORM, message, location, null, null);
    }

    public TransformException(String message, SourceLocation location, String hint) {
        super(Kind.TRANSFORM, message, location, hint, null);
    }

    public TransformException(String message, SourceLocation location, String hint, Throwable cause) {
        super(Kind.TRANSFORM, message, location, hint, cause);
    }
}
