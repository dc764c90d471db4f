package io.eligian.core.validation;

import io.eligian.core.ast.ActionDefinition;
import io.eligian.core.ast.OperationCall;
import io.eligian.core.ast.Parameter;
import io.eligian.core.registry.TypeTag;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks calls to user-defined actions. Every declared parameter is required; parameters with a
 * type annotation are checked like operation parameters.
 */
final class ActionCallValidator {

    /** Type annotations accepted on action parameters. */
    static final Set<String> PARAMETER_TYPES = Set.of("string", "number", "boolean", "object", "array");

    private ActionCallValidator() {}

    static List<OperationValidationError> validate(OperationCall call, ActionDefinition action) {
        List<OperationValidationError> errors = new ArrayList<>();
        List<Parameter> parameters = action.parameters();
        if (call.args().size() != parameters.size()) {
            errors.add(new OperationValidationError.ParameterCount(
                    action.name(),
                    parameters.size(),
                    parameters.size(),
                    call.args().size(),
                    parameters.stream().map(Parameter::name).collect(Collectors.toList()),
                    List.of()));
        }
        int checked = Math.min(call.args().size(), parameters.size());
        for (int i = 0; i < checked; i++) {
            Parameter parameter = parameters.get(i);
            TypeTag expected = typeOf(parameter);
            if (expected == null) {
                continue;
            }
            ArgumentType actual = ArgumentType.infer(call.args().get(i));
            if (!actual.isCompatibleWith(expected)) {
                errors.add(new OperationValidationError.ParameterType(
                        action.name(), i, parameter.name(), expected, actual));
            }
        }
        return errors;
    }

    /** Declared type of a parameter, or {@code null} when unannotated or unknown. */
    static TypeTag typeOf(Parameter parameter) {
        if (parameter.type() == null || !PARAMETER_TYPES.contains(parameter.type())) {
            return null;
        }
        return TypeTag.of(TypeTag.Kind.valueOf(parameter.type().toUpperCase(Locale.ROOT)));
    }
}
