package io.eligian.core.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code at 0s..5s fadeIn("#box")} or {@code at 0s..5s [ start ] [ end ]}. Exactly one of {@code
 * actionCall} and the inline bodies is used.
 *
 * @param start start time in seconds
 * @param end end time in seconds
 * @param actionCall invocation of a named action, or {@code null} for inline events
 * @param startBody inline start operations
 * @param endBody inline end operations
 * @param location position of the {@code at} keyword
 */
public record TimelineEvent(
        Expression start,
        Expression end,
        OperationCall actionCall,
        List<Statement> startBody,
        List<Statement> endBody,
        SourceLocation location)
        implements Node {

    public TimelineEvent {
        startBody = List.copyOf(startBody);
        endBody = List.copyOf(endBody);
    }

    public boolean isInline() {
        return actionCall == null;
    }

    @Override
    public List<? extends Node> children() {
        List<Node> all = new ArrayList<>();
        all.add(start);
        all.add(end);
        if (actionCall != null) {
            all.add(actionCall);
        }
        all.addAll(startBody);
        all.addAll(endBody);
        return all;
    }
}
