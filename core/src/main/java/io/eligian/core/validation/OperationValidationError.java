package io.eligian.core.validation;

import io.eligian.core.registry.TypeTag;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Structured result of checking one operation call. Each variant keeps the raw facts of the
 * problem; {@link #message()} and {@link #hint()} are derived from those facts alone, so the
 * same error always renders the same text.
 */
public sealed interface OperationValidationError
        permits OperationValidationError.UnknownOperation,
                OperationValidationError.ParameterCount,
                OperationValidationError.ParameterType,
                OperationValidationError.MissingDependency,
                OperationValidationError.ControlFlow {

    /** Stable error codes. */
    enum Code {
        UNKNOWN_OPERATION,
        PARAMETER_COUNT,
        PARAMETER_TYPE,
        MISSING_DEPENDENCY,
        CONTROL_FLOW;

        /** Lowercase identifier used in diagnostics, e.g. {@code unknown_operation}. */
        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    Code code();

    String message();

    String hint();

    /**
     * The called name is not registered.
     *
     * @param name the name as written
     * @param suggestions up to three close matches, nearest first
     * @param available a sample of registered names, shown when there is no close match
     */
    record UnknownOperation(String name, List<String> suggestions, List<String> available)
            implements OperationValidationError {

        public UnknownOperation {
            suggestions = List.copyOf(suggestions);
            available = List.copyOf(available);
        }

        @Override
        public Code code() {
            return Code.UNKNOWN_OPERATION;
        }

        @Override
        public String message() {
            return "Unknown operation: \"" + name + "\"";
        }

        @Override
        public String hint() {
            if (!suggestions.isEmpty()) {
                return "Did you mean: " + String.join(", ", suggestions) + "?";
            }
            if (available.isEmpty()) {
                return "No operations are registered";
            }
            return "Available operations: " + String.join(", ", available) + "...";
        }
    }

    /** The call passes too few or too many arguments. */
    record ParameterCount(
            String operation,
            int expectedMin,
            int expectedMax,
            int actual,
            List<String> requiredNames,
            List<String> optionalNames)
            implements OperationValidationError {

        public ParameterCount {
            requiredNames = List.copyOf(requiredNames);
            optionalNames = List.copyOf(optionalNames);
        }

        @Override
        public Code code() {
            return Code.PARAMETER_COUNT;
        }

        @Override
        public String message() {
            String expected =
                    expectedMin == expectedMax ? String.valueOf(expectedMin) : expectedMin + "-" + expectedMax;
            return "Operation \"" + operation + "\" expects " + expected + " parameter(s), but got " + actual;
        }

        @Override
        public String hint() {
            List<String> shown = new ArrayList<>(requiredNames);
            for (String optional : optionalNames) {
                shown.add("[" + optional + "]");
            }
            return "Expected: " + operation + "(" + String.join(", ", shown) + ")";
        }
    }

    /**
     * An argument's statically known type is not allowed by its parameter.
     *
     * @param operation operation or action being called
     * @param index zero-based argument position
     * @param name parameter name
     * @param expected allowed type
     * @param actual inferred argument type
     */
    record ParameterType(String operation, int index, String name, TypeTag expected, ArgumentType actual)
            implements OperationValidationError {

        @Override
        public Code code() {
            return Code.PARAMETER_TYPE;
        }

        @Override
        public String message() {
            return "Parameter '" + name + "' expects type '" + expected.format() + "' but got '" + actual.label() + "'";
        }

        @Override
        public String hint() {
            return "Provide a " + expected.format() + " value for parameter '" + name + "'";
        }
    }

    /**
     * A value the operation depends on is not available at this point of the action body.
     *
     * @param operation the operation that needs the value
     * @param name the missing value
     * @param requiredType the declared dependency type
     * @param erasedBy the operation that consumed the value earlier, or {@code null} if it was never
     *     produced
     * @param providers operations that produce the value, sorted
     */
    record MissingDependency(
            String operation, String name, TypeTag requiredType, String erasedBy, List<String> providers)
            implements OperationValidationError {

        public MissingDependency {
            providers = List.copyOf(providers);
        }

        @Override
        public Code code() {
            return Code.MISSING_DEPENDENCY;
        }

        @Override
        public String message() {
            if (erasedBy != null) {
                return "Operation '" + operation + "' requires '" + name + "' but it was erased by '" + erasedBy
                        + "'";
            }
            return "Operation '" + operation + "' requires '" + name + "' but it is not available";
        }

        @Override
        public String hint() {
            if (providers.isEmpty()) {
                return "No operation in the registry provides '" + name + "'";
            }
            String call = "Call " + String.join(" or ", providers);
            return erasedBy != null
                    ? call + " again to provide a new '" + name + "'"
                    : call + " first to provide '" + name + "'";
        }
    }

    /**
     * Block-structure violation found by {@link ControlFlowPairingChecker}.
     *
     * @param blockType which opener/closer pair is affected
     * @param issue what is wrong
     * @param position zero-based index of the offending call in the checked sequence
     */
    record ControlFlow(BlockType blockType, Issue issue, int position) implements OperationValidationError {

        /** Opener/closer pairs. */
        public enum BlockType {
            WHEN("when", "endWhen"),
            FOR_EACH("forEach", "endForEach");

            private final String opener;
            private final String closer;

            BlockType(String opener, String closer) {
                this.opener = opener;
                this.closer = closer;
            }

            public String opener() {
                return opener;
            }

            public String closer() {
                return closer;
            }
        }

        /** Kinds of pairing problems. */
        public enum Issue {
            UNCLOSED,
            UNMATCHED,
            INVALID_OTHERWISE
        }

        @Override
        public Code code() {
            return Code.CONTROL_FLOW;
        }

        @Override
        public String message() {
            return switch (issue) {
                case UNMATCHED -> "Unmatched '" + blockType.closer() + "' at position " + position
                        + ": no corresponding '" + blockType.opener() + "' found";
                case INVALID_OTHERWISE -> "'otherwise' at position " + position + " appears outside a 'when' block";
                case UNCLOSED -> "Unclosed '" + blockType.opener() + "' block starting at position " + position
                        + ": missing '" + blockType.closer() + "'";
            };
        }

        @Override
        public String hint() {
            return switch (issue) {
                case UNMATCHED -> "Remove this '" + blockType.closer() + "' or add a '" + blockType.opener()
                        + "' before it";
                case INVALID_OTHERWISE -> "Use 'otherwise' only between 'when' and 'endWhen'";
                case UNCLOSED -> "Add '" + blockType.closer() + "' to close the '" + blockType.opener() + "' block";
            };
        }
    }
}
