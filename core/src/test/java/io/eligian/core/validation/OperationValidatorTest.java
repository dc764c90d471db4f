package io.eligian.core.validation;

import static org.assertj.core.api.Assertions.assertThat;

import io.eligian.core.ast.Expression;
import io.eligian.core.ast.Literal;
import io.eligian.core.ast.OperationCall;
import io.eligian.core.ast.Reference;
import io.eligian.core.ast.SourceLocation;
import io.eligian.core.registry.OperationRegistry;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("OperationValidator")
class OperationValidatorTest {

    private static final SourceLocation AT = SourceLocation.start("test.eligian");

    private final OperationValidator validator = new OperationValidator(OperationRegistry.defaultRegistry());

    private static OperationCall call(String name, Expression... args) {
        return new OperationCall(name, List.of(args), AT);
    }

    private static Expression str(String value) {
        return new Literal.StringLiteral(value, AT);
    }

    private static Expression num(double value) {
        return new Literal.NumberLiteral(value, AT);
    }

    @Nested
    @DisplayName("Unknown operations")
    class Unknown {

        @Test
        @DisplayName("misspelled name yields exactly one error with a suggestion")
        void misspelledName() {
            OperationValidationResult result = validator.validateCall(call("selectElemnt", num(1), num(2), num(3)));

            assertThat(result.isKnownOperation()).isFalse();
            assertThat(result.errors()).hasSize(1);
            OperationValidationError error = result.errors().get(0);
            assertThat(error.message()).isEqualTo("Unknown operation: \"selectElemnt\"");
            assertThat(error).isInstanceOfSatisfying(OperationValidationError.UnknownOperation.class, unknown ->
                    assertThat(unknown.suggestions()).startsWith("selectElement"));
            assertThat(error.hint()).startsWith("Did you mean: selectElement");
        }

        @Test
        @DisplayName("names are case-sensitive")
        void caseSensitive() {
            OperationValidationResult result = validator.validateOperation("SelectElement", 1);

            assertThat(result.errors()).singleElement().isInstanceOf(OperationValidationError.UnknownOperation.class);
        }

        @Test
        @DisplayName("without close matches the hint lists available operations")
        void noCloseMatch() {
            OperationValidationResult result = validator.validateOperation("completelyDifferent", null);

            assertThat(result.errors().get(0).hint()).startsWith("Available operations: ");
        }

        @Test
        @DisplayName("an empty registry has nothing to offer")
        void emptyRegistry() {
            OperationValidationResult result =
                    new OperationValidator(OperationRegistry.empty()).validateOperation("anything", 0);

            assertThat(result.errors().get(0).hint()).isEqualTo("No operations are registered");
        }
    }

    @Nested
    @DisplayName("Arity")
    class Arity {

        @ParameterizedTest
        @ValueSource(ints = {1, 2})
        @DisplayName("counts between required and total are accepted")
        void acceptedCounts(int count) {
            assertThat(validator.validateOperation("selectElement", count).isValid()).isTrue();
        }

        @Test
        @DisplayName("too many arguments report the allowed range")
        void tooMany() {
            OperationValidationResult result = validator.validateOperation("selectElement", 3);

            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.code()).isEqualTo(OperationValidationError.Code.PARAMETER_COUNT);
                assertThat(error.message())
                        .isEqualTo("Operation \"selectElement\" expects 1-2 parameter(s), but got 3");
                assertThat(error.hint()).isEqualTo("Expected: selectElement(selector, [useSelectedElementAsRoot])");
            });
        }

        @Test
        @DisplayName("missing required argument reports the exact count")
        void tooFew() {
            OperationValidationResult result = validator.validateOperation("wait", 0);

            assertThat(result.errors().get(0).message())
                    .isEqualTo("Operation \"wait\" expects 1 parameter(s), but got 0");
        }

        @Test
        @DisplayName("null count skips the arity check")
        void nullCountSkipsArity() {
            assertThat(validator.validateOperation("wait", null).isValid()).isTrue();
        }
    }

    @Nested
    @DisplayName("Argument types")
    class Types {

        @Test
        @DisplayName("literal of the wrong type is reported with both type names")
        void wrongLiteralType() {
            OperationValidationResult result = validator.validateCall(call("addClass", num(5)));

            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.code()).isEqualTo(OperationValidationError.Code.PARAMETER_TYPE);
                assertThat(error.message()).isEqualTo("Parameter 'className' expects type 'string' but got 'number'");
            });
        }

        @Test
        @DisplayName("runtime references are not checked statically")
        void runtimeReference() {
            OperationValidationResult result = validator.validateCall(
                    call("addClass", new Reference.PropertyChain(List.of("operationdata", "cls"), AT)));

            assertThat(result.isValid()).isTrue();
        }

        @Test
        @DisplayName("union types accept each member")
        void unionType() {
            assertThat(validator.validateCall(call("when", str("a > b"))).isValid()).isTrue();
            assertThat(validator.validateCall(call("when", new Literal.BooleanLiteral(true, AT))).isValid())
                    .isTrue();
            assertThat(validator.validateCall(call("when", num(1))).isValid()).isFalse();
        }

        @Test
        @DisplayName("negative number literals count as numbers")
        void negativeNumber() {
            Expression minusFive = new Reference.UnaryExpression("-", num(5), AT);

            assertThat(validator.validateCall(call("wait", minusFive)).isValid()).isTrue();
        }

        @Test
        @DisplayName("constant-valued parameters accept any literal")
        void constantParameter() {
            assertThat(validator.validateCall(call("setElementContent", str("<b>x</b>"), str("sideways"))).isValid())
                    .isTrue();
        }

        @Test
        @DisplayName("type errors and arity errors are reported together")
        void arityAndType() {
            OperationValidationResult result = validator.validateCall(call("selectElement", num(1), num(2), num(3)));

            assertThat(result.errors())
                    .extracting(OperationValidationError::code)
                    .containsExactly(
                            OperationValidationError.Code.PARAMETER_COUNT,
                            OperationValidationError.Code.PARAMETER_TYPE,
                            OperationValidationError.Code.PARAMETER_TYPE);
        }
    }

    @Nested
    @DisplayName("Error variants")
    class Variants {

        @Test
        @DisplayName("the error type is closed over its five variants")
        void sealedVariants() {
            assertThat(OperationValidationError.class.isSealed()).isTrue();
            assertThat(OperationValidationError.class.getPermittedSubclasses())
                    .extracting(Class::getSimpleName)
                    .containsExactlyInAnyOrder(
                            "UnknownOperation", "ParameterCount", "ParameterType", "MissingDependency", "ControlFlow");
        }

        @ParameterizedTest
        @DisplayName("every pairing issue renders its own message and hint")
        @EnumSource(OperationValidationError.ControlFlow.Issue.class)
        void controlFlowText(OperationValidationError.ControlFlow.Issue issue) {
            OperationValidationError.ControlFlow error =
                    new OperationValidationError.ControlFlow(OperationValidationError.ControlFlow.BlockType.WHEN, issue, 2);

            assertThat(error.code()).isEqualTo(OperationValidationError.Code.CONTROL_FLOW);
            assertThat(error.message()).isNotBlank();
            assertThat(error.hint()).isNotBlank();
        }
    }
}
