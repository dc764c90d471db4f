package io.eligian.core.ast;

import java.util.List;

/**
 * {@code timeline "main" in "#container" using video from "./movie.mp4" { ... }}.
 *
 * @param name timeline name
 * @param containerSelector CSS selector of the timeline container
 * @param provider provider keyword as written ({@code video}, {@code audio}, {@code raf}, {@code
 *     custom})
 * @param source media source for video and audio providers, otherwise {@code null}
 * @param events timed events in source order
 * @param location position of the {@code timeline} keyword
 */
public record Timeline(
        String name,
        String containerSelector,
        String provider,
        String source,
        List<TimelineEvent> events,
        SourceLocation location)
        implements Node {

    public Timeline {
        events = List.copyOf(events);
    }

    @Override
    public List<? extends Node> children() {
        return events;
    }
}
