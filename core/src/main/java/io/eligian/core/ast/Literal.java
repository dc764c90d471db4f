package io.eligian.core.ast;

import java.util.ArrayList;
import java.util.List;

/** Literal expression forms. */
public final class Literal {

    private Literal() {}

    public record StringLiteral(String value, SourceLocation location) implements Expression {}

    public record NumberLiteral(double value, SourceLocation location) implements Expression {}

    public record BooleanLiteral(boolean value, SourceLocation location) implements Expression {}

    public record NullLiteral(SourceLocation location) implements Expression {}

    /** One {@code key: value} entry of an object literal. */
    public record Property(String key, Expression value) {}

    public record ObjectLiteral(List<Property> properties, SourceLocation location) implements Expression {

        public ObjectLiteral {
            properties = List.copyOf(properties);
        }

        @Override
        public List<? extends Node> children() {
            List<Node> values = new ArrayList<>();
            for (Property p : properties) {
                values.add(p.value());
            }
            return values;
        }
    }

    public record ArrayLiteral(List<Expression> elements, SourceLocation location) implements Expression {

        public ArrayLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public List<? extends Node> children() {
            return elements;
        }
    }
}
