package io.eligian.core.compiler;

import static org.assertj.core.api.Assertions.assertThat;

import io.eligian.core.ir.EligiusIR;
import io.eligian.core.ir.TimelineActionIR;
import io.eligian.core.ir.TimelineIR;
import java.util.List;
import org.junit.jupiter.api.Test;

class OptimizerTest {

    private static TimelineActionIR event(String id, double start, double end) {
        return new TimelineActionIR(id, id, start, end, List.of(), List.of());
    }

    @Test
    void removesEventsThatCanNeverRunAndRecomputesDuration() {
        TimelineIR timeline = new TimelineIR(
                "t1",
                null,
                "animation",
                9,
                false,
                "#app",
                List.of(event("ok", 0, 2), event("negative", -1, 1), event("empty", 3, 3), event("late", 5, 9)));
        EligiusIR ir = TypeCheckerTest.ir(List.of(timeline), List.of(), "#app");

        EligiusIR optimized = new Optimizer().optimize(ir);

        TimelineIR result = optimized.config().timelines().get(0);
        assertThat(result.timelineActions()).extracting(TimelineActionIR::id).containsExactly("ok", "late");
        assertThat(result.duration()).isEqualTo(9.0);
    }

    @Test
    void durationShrinksWhenTheLastEventIsRemoved() {
        TimelineIR timeline = new TimelineIR(
                "t1", null, "animation", 10, false, "#app", List.of(event("ok", 0, 2), event("bad", 10, 4)));
        EligiusIR ir = TypeCheckerTest.ir(List.of(timeline), List.of(), "#app");

        TimelineIR result = new Optimizer().optimize(ir).config().timelines().get(0);

        assertThat(result.duration()).isEqualTo(2.0);
        assertThat(ir.config().timelines().get(0).timelineActions()).hasSize(2);
    }
}
