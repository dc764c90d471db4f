package io.eligian.core.ir;

import java.util.List;

/**
 * Typed form of the runtime engine configuration; {@link io.eligian.core.compiler.JsonEmitter}
 * serializes it field by field.
 */
public record ConfigurationIR(
        String id,
        String engineSystemName,
        String containerSelector,
        String language,
        String layoutTemplate,
        List<LanguageIR> availableLanguages,
        List<String> cssFiles,
        List<ActionIR> actions,
        List<TimelineIR> timelines) {

    public ConfigurationIR {
        availableLanguages = List.copyOf(availableLanguages);
        cssFiles = List.copyOf(cssFiles);
        actions = List.copyOf(actions);
        timelines = List.copyOf(timelines);
    }

    public ConfigurationIR withTimelines(List<TimelineIR> newTimelines) {
        return new ConfigurationIR(
                id,
                engineSystemName,
                containerSelector,
                language,
                layoutTemplate,
                availableLanguages,
                cssFiles,
                actions,
                newTimelines);
    }
}
