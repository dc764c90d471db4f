package io.eligian.core.validation;

import io.eligian.core.ast.Expression;
import io.eligian.core.ast.OperationCall;
import io.eligian.core.registry.OperationParameter;
import io.eligian.core.registry.OperationRegistry;
import io.eligian.core.registry.OperationSignature;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Checks operation calls against the {@link OperationRegistry}: the operation must exist, the
 * argument count must be within the parameter bounds, and every argument whose type is known
 * statically must match its parameter.
 *
 * <p>Thread-safe: holds only the immutable registry.
 */
public final class OperationValidator {

    private static final int AVAILABLE_SAMPLE_SIZE = 5;

    private final OperationRegistry registry;

    public OperationValidator(OperationRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public OperationRegistry registry() {
        return registry;
    }

    /**
     * Validates an operation name and, when {@code argCount} is given, its arity. An unknown name
     * yields a single {@link OperationValidationError.UnknownOperation} and no further checks.
     *
     * @param name operation name, case-sensitive
     * @param argCount number of supplied arguments, or {@code null} to skip the arity check
     */
    public OperationValidationResult validateOperation(String name, Integer argCount) {
        Optional<OperationSignature> found = registry.find(name);
        if (found.isEmpty()) {
            return new OperationValidationResult(null, List.of(unknownOperation(name)));
        }
        OperationSignature signature = found.get();
        List<OperationValidationError> errors = new ArrayList<>();
        if (argCount != null) {
            checkArity(signature, argCount).ifPresent(errors::add);
        }
        return new OperationValidationResult(signature, errors);
    }

    /** Validates existence, arity and argument types of a call. */
    public OperationValidationResult validateCall(OperationCall call) {
        OperationValidationResult result = validateOperation(call.operationName(), call.args().size());
        if (!result.isKnownOperation()) {
            return result;
        }
        List<OperationValidationError> errors = new ArrayList<>(result.errors());
        errors.addAll(validateArgumentTypes(result.signature(), call.args()));
        return new OperationValidationResult(result.signature(), errors);
    }

    /**
     * Checks positional arguments against parameter types, up to the shorter of the two lists.
     */
    public List<OperationValidationError> validateArgumentTypes(OperationSignature signature, List<Expression> args) {
        List<OperationValidationError> errors = new ArrayList<>();
        List<OperationParameter> parameters = signature.parameters();
        int checked = Math.min(args.size(), parameters.size());
        for (int i = 0; i < checked; i++) {
            OperationParameter parameter = parameters.get(i);
            ArgumentType actual = ArgumentType.infer(args.get(i));
            if (!actual.isCompatibleWith(parameter.type())) {
                errors.add(new OperationValidationError.ParameterType(
                        signature.name(), i, parameter.name(), parameter.type(), actual));
            }
        }
        return errors;
    }

    private Optional<OperationValidationError> checkArity(OperationSignature signature, int argCount) {
        int min = signature.requiredCount();
        int max = signature.totalCount();
        if (argCount >= min && argCount <= max) {
            return Optional.empty();
        }
        return Optional.of(new OperationValidationError.ParameterCount(
                signature.name(),
                min,
                max,
                argCount,
                signature.requiredParameterNames(),
                signature.optionalParameterNames()));
    }

    private OperationValidationError unknownOperation(String name) {
        List<String> suggestions = EditDistance.suggestions(name, registry.names());
        List<String> sample = suggestions.isEmpty()
                ? registry.names().stream().limit(AVAILABLE_SAMPLE_SIZE).collect(Collectors.toList())
                : List.of();
        return new OperationValidationError.UnknownOperation(name, suggestions, sample);
    }
}
