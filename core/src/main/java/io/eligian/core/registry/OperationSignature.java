package io.eligian.core.registry;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable description of one runtime operation: its parameters, the values it depends on and
 * the values it produces.
 */
public record OperationSignature(
        String name,
        String description,
        String category,
        List<OperationParameter> parameters,
        List<DependencyInfo> dependencies,
        List<OutputInfo> outputs) {

    public OperationSignature {
        Objects.requireNonNull(name, "name must not be null");
        parameters = List.copyOf(parameters);
        dependencies = List.copyOf(dependencies);
        outputs = List.copyOf(outputs);
    }

    /** Number of parameters that must be supplied. */
    public int requiredCount() {
        return (int) parameters.stream().filter(OperationParameter::required).count();
    }

    /** Total number of positional parameters. */
    public int totalCount() {
        return parameters.size();
    }

    /** Names of required parameters, in declaration order. */
    public List<String> requiredParameterNames() {
        return parameters.stream()
                .filter(OperationParameter::required)
                .map(OperationParameter::name)
                .collect(Collectors.toList());
    }

    /** Names of optional parameters, in declaration order. */
    public List<String> optionalParameterNames() {
        return parameters.stream()
                .filter(p -> !p.required())
                .map(OperationParameter::name)
                .collect(Collectors.toList());
    }

    /** {@code true} if this operation writes {@code outputName} without erasing it. */
    public boolean provides(String outputName) {
        return outputs.stream().anyMatch(o -> o.name().equals(outputName) && !o.erased());
    }

    /** {@code true} if this operation declares {@code outputName} as an erased output. */
    public boolean erases(String outputName) {
        return outputs.stream().anyMatch(o -> o.name().equals(outputName) && o.erased());
    }
}
