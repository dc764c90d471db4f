package io.eligian.core.compiler;

import io.eligian.core.error.OptimizationException;
import io.eligian.core.ir.EligiusIR;
import io.eligian.core.ir.TimelineActionIR;
import io.eligian.core.ir.TimelineIR;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes timeline actions that can never run: those with a negative start or an end that is not
 * after the start. Timeline durations are recomputed from what remains.
 */
final class Optimizer {

    private static final Logger LOG = LoggerFactory.getLogger(Optimizer.class);

    EligiusIR optimize(EligiusIR ir) {
        try {
            int removed = 0;
            List<TimelineIR> timelines = new ArrayList<>();
            for (TimelineIR timeline : ir.config().timelines()) {
                List<TimelineActionIR> kept = new ArrayList<>();
                for (TimelineActionIR action : timeline.timelineActions()) {
                    if (action.start() >= 0 && action.end() > action.start()) {
                        kept.add(action);
                    } else {
                        removed++;
                    }
                }
                timelines.add(timeline.withActions(kept));
            }
            LOG.debug("Optimization completed: removed_timeline_actions={}", removed);
            return ir.withConfig(ir.config().withTimelines(timelines));
        } catch (RuntimeException e) {
            throw new OptimizationException(
                    "Optimization failed: " + e.getMessage(), ir.sourceMap().root(), null, e);
        }
    }
}
