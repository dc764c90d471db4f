package io.eligian.core.validation;

import io.eligian.core.validation.OperationValidationError.ControlFlow;
import io.eligian.core.validation.OperationValidationError.ControlFlow.BlockType;
import io.eligian.core.validation.OperationValidationError.ControlFlow.Issue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Checks that {@code when}/{@code endWhen} and {@code forEach}/{@code endForEach} calls in a flat
 * operation sequence are properly paired, and that {@code otherwise} only appears inside an open
 * {@code when} block.
 */
public final class ControlFlowPairingChecker {

    private ControlFlowPairingChecker() {}

    /**
     * Validates the pairing of control-flow operations.
     *
     * @param operationNames operation names in execution order
     * @return pairing errors: unmatched closers and misplaced {@code otherwise} in sequence order,
     *     followed by unclosed openers
     */
    public static List<ControlFlow> validatePairing(List<String> operationNames) {
        List<ControlFlow> errors = new ArrayList<>();
        Deque<Integer> whenStack = new ArrayDeque<>();
        Deque<Integer> forEachStack = new ArrayDeque<>();

        for (int i = 0; i < operationNames.size(); i++) {
            switch (operationNames.get(i)) {
                case "when" -> whenStack.push(i);
                case "otherwise" -> {
                    if (whenStack.isEmpty()) {
                        errors.add(new ControlFlow(BlockType.WHEN, Issue.INVALID_OTHERWISE, i));
                    }
                }
                case "endWhen" -> {
                    if (whenStack.isEmpty()) {
                        errors.add(new ControlFlow(BlockType.WHEN, Issue.UNMATCHED, i));
                    } else {
                        whenStack.pop();
                    }
                }
                case "forEach" -> forEachStack.push(i);
                case "endForEach" -> {
                    if (forEachStack.isEmpty()) {
                        errors.add(new ControlFlow(BlockType.FOR_EACH, Issue.UNMATCHED, i));
                    } else {
                        forEachStack.pop();
                    }
                }
                default -> {
                    // other operations do not affect pairing
                }
            }
        }

        // report outermost unclosed blocks first
        whenStack
                .descendingIterator()
                .forEachRemaining(i -> errors.add(new ControlFlow(BlockType.WHEN, Issue.UNCLOSED, i)));
        forEachStack
                .descendingIterator()
                .forEachRemaining(i -> errors.add(new ControlFlow(BlockType.FOR_EACH, Issue.UNCLOSED, i)));
        return errors;
    }
}
