package io.eligian.core.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eligian.core.error.EmitException;
import io.eligian.core.ir.ActionIR;
import io.eligian.core.ir.ConfigurationIR;
import io.eligian.core.ir.EligiusIR;
import io.eligian.core.ir.LanguageIR;
import io.eligian.core.ir.OperationIR;
import io.eligian.core.ir.TimelineActionIR;
import io.eligian.core.ir.TimelineIR;
import java.util.List;

/** Serializes the IR into the runtime engine's JSON configuration. */
public final class JsonEmitter {

    public static final String SCHEMA_URL =
            "https://rolandzwaga.github.io/eligius/jsonschema/eligius-configuration.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Builds the configuration tree. Field order matches the runtime schema. */
    public ObjectNode toJson(EligiusIR ir) {
        ConfigurationIR config = ir.config();
        ObjectNode root = MAPPER.createObjectNode();
        root.put("$schema", SCHEMA_URL);
        root.put("id", config.id());
        ObjectNode engine = root.putObject("engine");
        engine.put("systemName", config.engineSystemName());
        root.put("containerSelector", config.containerSelector());
        root.put("language", config.language());
        root.put("layoutTemplate", config.layoutTemplate());
        ArrayNode languages = root.putArray("availableLanguages");
        for (LanguageIR language : config.availableLanguages()) {
            ObjectNode entry = languages.addObject();
            entry.put("languageCode", language.code());
            entry.put("label", language.label());
        }
        ArrayNode css = root.putArray("cssFiles");
        config.cssFiles().forEach(css::add);
        root.putArray("initActions");
        ArrayNode actions = root.putArray("actions");
        for (ActionIR action : config.actions()) {
            ObjectNode entry = actions.addObject();
            entry.put("id", action.id());
            entry.put("name", action.name());
            operations(entry.putArray("startOperations"), action.startOperations());
            operations(entry.putArray("endOperations"), action.endOperations());
        }
        ArrayNode timelines = root.putArray("timelines");
        for (TimelineIR timeline : config.timelines()) {
            ObjectNode entry = timelines.addObject();
            entry.put("id", timeline.id());
            entry.put("uri", timeline.uri());
            entry.put("type", timeline.type());
            entry.set("duration", ExpressionLowering.number(timeline.duration()));
            entry.put("loop", timeline.loop());
            entry.put("selector", timeline.selector());
            ArrayNode timelineActions = entry.putArray("timelineActions");
            for (TimelineActionIR action : timeline.timelineActions()) {
                ObjectNode item = timelineActions.addObject();
                item.put("id", action.id());
                item.put("name", action.name());
                ObjectNode duration = item.putObject("duration");
                duration.set("start", ExpressionLowering.number(action.start()));
                duration.set("end", ExpressionLowering.number(action.end()));
                operations(item.putArray("startOperations"), action.startOperations());
                operations(item.putArray("endOperations"), action.endOperations());
            }
        }
        return root;
    }

    /**
     * Renders the configuration as text.
     *
     * @throws EmitException if serialization fails
     */
    public String emit(EligiusIR ir, boolean minify) {
        ObjectNode json = toJson(ir);
        try {
            return minify
                    ? MAPPER.writeValueAsString(json)
                    : MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new EmitException(
                    "Failed to serialize configuration: " + e.getOriginalMessage(), ir.sourceMap().root(), null, e);
        }
    }

    private static void operations(ArrayNode target, List<OperationIR> operations) {
        for (OperationIR operation : operations) {
            ObjectNode entry = target.addObject();
            entry.put("id", operation.id());
            entry.put("systemName", operation.systemName());
            entry.set("operationData", operation.operationData());
        }
    }
}
