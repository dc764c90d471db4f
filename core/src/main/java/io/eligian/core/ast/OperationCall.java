package io.eligian.core.ast;

import java.util.List;

/**
 * A call by name with positional arguments. The name resolves either to a registered operation or
 * to a user-defined action.
 */
public record OperationCall(String operationName, List<Expression> args, SourceLocation location)
        implements Statement {

    public OperationCall {
        args = List.copyOf(args);
    }

    @Override
    public List<? extends Node> children() {
        return args;
    }
}
