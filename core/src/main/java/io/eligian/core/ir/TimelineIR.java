package io.eligian.core.ir;

import java.util.List;

/**
 * A timeline of the runtime configuration.
 *
 * @param id unique id
 * @param uri media source for {@code mediaplayer} timelines, otherwise {@code null}
 * @param type runtime timeline type: {@code animation}, {@code mediaplayer} or {@code custom}
 * @param duration total duration in seconds, the latest end time of its actions
 * @param loop whether the timeline restarts when it ends
 * @param selector CSS selector of the timeline container
 * @param timelineActions actions in source order
 */
public record TimelineIR(
        String id,
        String uri,
        String type,
        double duration,
        boolean loop,
        String selector,
        List<TimelineActionIR> timelineActions) {

    public TimelineIR {
        timelineActions = List.copyOf(timelineActions);
    }

    /** Copy with a different action list and a duration recomputed from it. */
    public TimelineIR withActions(List<TimelineActionIR> actions) {
        double max = 0;
        for (TimelineActionIR action : actions) {
            max = Math.max(max, action.end());
        }
        return new TimelineIR(id, uri, type, max, loop, selector, actions);
    }
}
