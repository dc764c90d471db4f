package io.eligian.core.ir;

import java.util.List;

/**
 * An action bound to a time range on a timeline.
 *
 * @param id unique id
 * @param name descriptive name
 * @param start start time in seconds
 * @param end end time in seconds
 * @param startOperations operations run at {@code start}
 * @param endOperations operations run at {@code end}
 */
public record TimelineActionIR(
        String id,
        String name,
        double start,
        double end,
        List<OperationIR> startOperations,
        List<OperationIR> endOperations) {

    public TimelineActionIR {
        startOperations = List.copyOf(startOperations);
        endOperations = List.copyOf(endOperations);
    }
}
