package io.eligian.core.ir;

import java.util.List;

/**
 * A named action definition.
 *
 * @param id unique action id
 * @param name action name, used by {@code requestAction}
 * @param startOperations operations run when the action starts
 * @param endOperations operations run when an endable action ends; empty otherwise
 */
public record ActionIR(String id, String name, List<OperationIR> startOperations, List<OperationIR> endOperations) {

    public ActionIR {
        startOperations = List.copyOf(startOperations);
        endOperations = List.copyOf(endOperations);
    }
}
