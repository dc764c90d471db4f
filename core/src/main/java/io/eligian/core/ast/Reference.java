package io.eligian.core.ast;

import java.util.List;

/** Expressions whose value is only known at runtime. */
public final class Reference {

    private Reference() {}

    /** Bare identifier: an action parameter, a constant or a loop variable. */
    public record NameReference(String name, SourceLocation location) implements Expression {}

    /** {@code @@name}: a system property of the running scope, such as {@code @@currentItem}. */
    public record SystemPropertyReference(String name, SourceLocation location) implements Expression {}

    /** {@code @name}: a variable set with a local {@code const}. */
    public record VariableReference(String name, SourceLocation location) implements Expression {}

    /** {@code $scope.a.b} or {@code $operationdata.x}: passed through to the runtime unchanged. */
    public record PropertyChain(List<String> segments, SourceLocation location) implements Expression {

        public PropertyChain {
            segments = List.copyOf(segments);
        }

        /** The chain as written, {@code $root.seg1.seg2}. */
        public String path() {
            return "$" + String.join(".", segments);
        }
    }

    public record BinaryExpression(String operator, Expression left, Expression right, SourceLocation location)
            implements Expression {

        @Override
        public List<? extends Node> children() {
            return List.of(left, right);
        }
    }

    public record UnaryExpression(String operator, Expression operand, SourceLocation location)
            implements Expression {

        @Override
        public List<? extends Node> children() {
            return List.of(operand);
        }
    }
}
