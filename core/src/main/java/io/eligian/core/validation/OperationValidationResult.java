package io.eligian.core.validation;

import io.eligian.core.registry.OperationSignature;
import java.util.List;

/**
 * Outcome of validating one call.
 *
 * @param signature the resolved signature, or {@code null} if the operation is unknown
 * @param errors problems found, empty when the call is valid
 */
public record OperationValidationResult(OperationSignature signature, List<OperationValidationError> errors) {

    public OperationValidationResult {
        errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean isKnownOperation() {
        return signature != null;
    }
}
