package io.eligian.core.validation;

import io.eligian.core.ast.Expression;
import io.eligian.core.ast.Literal;
import io.eligian.core.ast.Reference;
import io.eligian.core.registry.TypeTag;
import java.util.Locale;

/** Coarse static type of a call argument, inferred from its syntax alone. */
public enum ArgumentType {
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,
    OBJECT,
    ARRAY,
    /** References, property chains and operator expressions: only known when the action runs. */
    RUNTIME;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Infers the type of an argument expression. */
    public static ArgumentType infer(Expression expression) {
        if (expression instanceof Literal.StringLiteral) {
            return STRING;
        }
        if (expression instanceof Literal.NumberLiteral) {
            return NUMBER;
        }
        if (expression instanceof Literal.BooleanLiteral) {
            return BOOLEAN;
        }
        if (expression instanceof Literal.NullLiteral) {
            return NULL;
        }
        if (expression instanceof Literal.ObjectLiteral) {
            return OBJECT;
        }
        if (expression instanceof Literal.ArrayLiteral) {
            return ARRAY;
        }
        // "-5" is written as a unary minus applied to a number literal
        if (expression instanceof Reference.UnaryExpression unary) {
            if (unary.operator().equals("-") && unary.operand() instanceof Literal.NumberLiteral) {
                return NUMBER;
            }
        }
        return RUNTIME;
    }

    /**
     * Returns whether a value of this type may be passed where {@code expected} is declared.
     * Runtime values and {@code null} are always accepted; constant-valued parameters are not
     * checked statically.
     */
    public boolean isCompatibleWith(TypeTag expected) {
        if (this == RUNTIME || this == NULL || expected.isConstant()) {
            return true;
        }
        return expected.allows(TypeTag.Kind.valueOf(name()));
    }
}
