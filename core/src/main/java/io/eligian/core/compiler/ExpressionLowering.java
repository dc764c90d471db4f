package io.eligian.core.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eligian.core.ast.Expression;
import io.eligian.core.ast.Literal;
import io.eligian.core.ast.Reference;
import io.eligian.core.error.TransformException;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns expressions into {@code operationData} values. Expressions made only of literals and
 * program constants are folded to a JSON value; everything else becomes a runtime expression
 * string such as {@code "$operationdata.count"} or {@code "($scope.currentItem > 2)"}.
 */
final class ExpressionLowering {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final Map<String, JsonNode> constants;

    ExpressionLowering(Map<String, JsonNode> constants) {
        this.constants = constants;
    }

    /**
     * Names bound inside an action body.
     *
     * @param parameters action parameters, read from {@code $operationdata}
     * @param loopItems loop variables, read from {@code $scope.currentItem}
     * @param locals local constants, read from {@code $scope.variables}
     */
    record Names(Set<String> parameters, Set<String> loopItems, Set<String> locals) {

        static Names empty() {
            return new Names(Set.of(), Set.of(), Set.of());
        }

        Names withLoopItem(String item) {
            return new Names(parameters, union(loopItems, item), locals);
        }

        Names withLocal(String local) {
            return new Names(parameters, loopItems, union(locals, local));
        }

        private static Set<String> union(Set<String> names, String extra) {
            LinkedHashSet<String> copy = new LinkedHashSet<>(names);
            copy.add(extra);
            return Set.copyOf(copy);
        }
    }

    /** Lowers an expression to the JSON value stored in {@code operationData}. */
    JsonNode toValue(Expression expression, Names names) {
        Optional<JsonNode> folded = fold(expression);
        if (folded.isPresent()) {
            return folded.get();
        }
        if (expression instanceof Literal.ObjectLiteral objectLiteral) {
            ObjectNode object = NODES.objectNode();
            for (Literal.Property property : objectLiteral.properties()) {
                object.set(property.key(), toValue(property.value(), names));
            }
            return object;
        }
        if (expression instanceof Literal.ArrayLiteral arrayLiteral) {
            ArrayNode array = NODES.arrayNode();
            for (Expression element : arrayLiteral.elements()) {
                array.add(toValue(element, names));
            }
            return array;
        }
        return NODES.textNode(render(expression, names));
    }

    /** Evaluates an expression built only from literals and program constants. */
    Optional<JsonNode> fold(Expression expression) {
        if (expression instanceof Literal.StringLiteral string) {
            return Optional.of(NODES.textNode(string.value()));
        }
        if (expression instanceof Literal.NumberLiteral numberLiteral) {
            return Optional.of(number(numberLiteral.value()));
        }
        if (expression instanceof Literal.BooleanLiteral bool) {
            return Optional.of(NODES.booleanNode(bool.value()));
        }
        if (expression instanceof Literal.NullLiteral) {
            return Optional.of(NODES.nullNode());
        }
        if (expression instanceof Literal.ObjectLiteral objectLiteral) {
            ObjectNode object = NODES.objectNode();
            for (Literal.Property property : objectLiteral.properties()) {
                Optional<JsonNode> value = fold(property.value());
                if (value.isEmpty()) {
                    return Optional.empty();
                }
                object.set(property.key(), value.get());
            }
            return Optional.of(object);
        }
        if (expression instanceof Literal.ArrayLiteral arrayLiteral) {
            ArrayNode array = NODES.arrayNode();
            for (Expression element : arrayLiteral.elements()) {
                Optional<JsonNode> value = fold(element);
                if (value.isEmpty()) {
                    return Optional.empty();
                }
                array.add(value.get());
            }
            return Optional.of(array);
        }
        if (expression instanceof Reference.NameReference reference) {
            JsonNode constant = constants.get(reference.name());
            return constant == null ? Optional.empty() : Optional.of(constant.deepCopy());
        }
        if (expression instanceof Reference.UnaryExpression unary) {
            return fold(unary.operand()).flatMap(operand -> foldUnary(unary.operator(), operand));
        }
        if (expression instanceof Reference.BinaryExpression binary) {
            Optional<JsonNode> left = fold(binary.left());
            Optional<JsonNode> right = fold(binary.right());
            if (left.isEmpty() || right.isEmpty()) {
                return Optional.empty();
            }
            return foldBinary(binary.operator(), left.get(), right.get());
        }
        return Optional.empty();
    }

    /** Source-like text of a runtime expression. */
    String render(Expression expression, Names names) {
        Optional<JsonNode> folded = fold(expression);
        if (folded.isPresent()) {
            return folded.get().toString();
        }
        if (expression instanceof Reference.NameReference reference) {
            String name = reference.name();
            if (names.locals().contains(name)) {
                return "$scope.variables." + name;
            }
            if (names.loopItems().contains(name)) {
                return "$scope.currentItem";
            }
            if (names.parameters().contains(name)) {
                return "$operationdata." + name;
            }
            throw new TransformException("Unknown reference '" + name + "'", expression.location());
        }
        if (expression instanceof Reference.SystemPropertyReference property) {
            return "$scope." + property.name();
        }
        if (expression instanceof Reference.VariableReference variable) {
            return "$scope.variables." + variable.name();
        }
        if (expression instanceof Reference.PropertyChain chain) {
            return chain.path();
        }
        if (expression instanceof Reference.UnaryExpression unary) {
            return unary.operator() + render(unary.operand(), names);
        }
        if (expression instanceof Reference.BinaryExpression binary) {
            return "(" + render(binary.left(), names) + " " + binary.operator() + " " + render(binary.right(), names)
                    + ")";
        }
        return toValue(expression, names).toString();
    }

    private static Optional<JsonNode> foldUnary(String operator, JsonNode operand) {
        if (operator.equals("-") && operand.isNumber()) {
            return Optional.of(number(-operand.doubleValue()));
        }
        if (operator.equals("!") && operand.isBoolean()) {
            return Optional.of(NODES.booleanNode(!operand.booleanValue()));
        }
        return Optional.empty();
    }

    private static Optional<JsonNode> foldBinary(String operator, JsonNode left, JsonNode right) {
        return switch (operator) {
            case "==" -> Optional.of(NODES.booleanNode(left.equals(right)));
            case "!=" -> Optional.of(NODES.booleanNode(!left.equals(right)));
            case "&&" -> left.isBoolean() && right.isBoolean()
                    ? Optional.of(NODES.booleanNode(left.booleanValue() && right.booleanValue()))
                    : Optional.empty();
            case "||" -> left.isBoolean() && right.isBoolean()
                    ? Optional.of(NODES.booleanNode(left.booleanValue() || right.booleanValue()))
                    : Optional.empty();
            default -> foldArithmetic(operator, left, right);
        };
    }

    private static Optional<JsonNode> foldArithmetic(String operator, JsonNode left, JsonNode right) {
        if (operator.equals("+") && (left.isTextual() || right.isTextual())) {
            return left.isValueNode() && right.isValueNode()
                    ? Optional.of(NODES.textNode(left.asText() + right.asText()))
                    : Optional.empty();
        }
        if (!left.isNumber() || !right.isNumber()) {
            return Optional.empty();
        }
        double l = left.doubleValue();
        double r = right.doubleValue();
        return switch (operator) {
            case "+" -> Optional.of(number(l + r));
            case "-" -> Optional.of(number(l - r));
            case "*" -> Optional.of(number(l * r));
            case "/" -> r == 0 ? Optional.empty() : Optional.of(number(l / r));
            case "%" -> r == 0 ? Optional.empty() : Optional.of(number(l % r));
            case "<" -> Optional.of(NODES.booleanNode(l < r));
            case ">" -> Optional.of(NODES.booleanNode(l > r));
            case "<=" -> Optional.of(NODES.booleanNode(l <= r));
            case ">=" -> Optional.of(NODES.booleanNode(l >= r));
            default -> Optional.empty();
        };
    }

    /** Integral values are emitted without a fraction ({@code 5}, not {@code 5.0}). */
    static JsonNode number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < Long.MAX_VALUE) {
            return NODES.numberNode((long) value);
        }
        return NODES.numberNode(value);
    }
}
