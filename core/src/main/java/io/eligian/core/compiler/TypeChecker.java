package io.eligian.core.compiler;

import io.eligian.core.ast.SourceLocation;
import io.eligian.core.error.TypeCheckException;
import io.eligian.core.ir.ActionIR;
import io.eligian.core.ir.ConfigurationIR;
import io.eligian.core.ir.EligiusIR;
import io.eligian.core.ir.OperationIR;
import io.eligian.core.ir.TimelineActionIR;
import io.eligian.core.ir.TimelineIR;
import java.util.List;
import java.util.Set;

/** Structural checks on the IR before it is optimized and emitted. */
final class TypeChecker {

    static final Set<String> TIMELINE_TYPES = Set.of("animation", "mediaplayer", "custom");

    EligiusIR check(EligiusIR ir) {
        ConfigurationIR config = ir.config();
        SourceLocation root = ir.sourceMap().root();
        requireText(config.id(), "Configuration id", root);
        requireText(config.containerSelector(), "Container selector", root);
        requireText(config.language(), "Default language", root);
        if (config.timelines().isEmpty()) {
            throw new TypeCheckException(
                    "Configuration must contain at least one timeline", root, "Add a timeline declaration");
        }
        for (TimelineIR timeline : config.timelines()) {
            SourceLocation at = ir.sourceMap().locationOf(timeline.id()).orElse(root);
            if (!TIMELINE_TYPES.contains(timeline.type())) {
                throw new TypeCheckException(
                        "Invalid timeline type '" + timeline.type() + "'",
                        at,
                        "Expected one of: animation, mediaplayer, custom");
            }
            requireText(timeline.selector(), "Timeline selector", at);
            for (TimelineActionIR action : timeline.timelineActions()) {
                operations(action.startOperations(), ir);
                operations(action.endOperations(), ir);
            }
        }
        for (ActionIR action : config.actions()) {
            requireText(action.name(), "Action name", ir.sourceMap().locationOf(action.id()).orElse(root));
            operations(action.startOperations(), ir);
            operations(action.endOperations(), ir);
        }
        return ir;
    }

    private static void operations(List<OperationIR> operations, EligiusIR ir) {
        for (OperationIR operation : operations) {
            requireText(
                    operation.systemName(),
                    "Operation systemName",
                    ir.sourceMap().locationOf(operation.id()).orElse(ir.sourceMap().root()));
        }
    }

    private static void requireText(String value, String what, SourceLocation location) {
        if (value == null || value.isBlank()) {
            throw new TypeCheckException(what + " must not be empty", location);
        }
    }
}
