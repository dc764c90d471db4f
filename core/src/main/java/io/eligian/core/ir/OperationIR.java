package io.eligian.core.ir;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One operation in an action's start or end list.
 *
 * @param id unique operation id
 * @param systemName registered operation name
 * @param operationData named arguments; never {@code null}, possibly empty
 */
public record OperationIR(String id, String systemName, ObjectNode operationData) {

    public OperationIR {
        operationData = operationData.deepCopy();
    }

    @Override
    public ObjectNode operationData() {
        return operationData.deepCopy();
    }
}
