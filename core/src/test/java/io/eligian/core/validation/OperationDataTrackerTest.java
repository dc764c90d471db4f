package io.eligian.core.validation;

import static org.assertj.core.api.Assertions.assertThat;

import io.eligian.core.registry.OperationRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("OperationDataTracker")
class OperationDataTrackerTest {

    private final OperationDataTracker tracker = new OperationDataTracker(OperationRegistry.defaultRegistry());

    @Test
    @DisplayName("a dependency provided by an earlier output is satisfied")
    void providedDependency() {
        assertThat(tracker.processOperation("selectElement")).isEmpty();
        assertThat(tracker.processOperation("addClass")).isEmpty();
        assertThat(tracker.isAvailable("selectedElement")).isTrue();
    }

    @Test
    @DisplayName("a dependency that was never produced is missing without an erasure point")
    void neverProduced() {
        assertThat(tracker.processOperation("addClass")).containsExactly("selectedElement");
        assertThat(tracker.findErasurePoint("selectedElement")).isEmpty();
    }

    @Test
    @DisplayName("startAction consumes the action instance requested before it")
    void erasedByStartAction() {
        assertThat(tracker.processOperation("requestAction")).isEmpty();
        assertThat(tracker.processOperation("startAction")).isEmpty();
        assertThat(tracker.processOperation("startAction")).containsExactly("actionInstance");

        assertThat(tracker.findErasurePoint("actionInstance")).contains("startAction");
    }

    @Test
    @DisplayName("producing a value again clears the erasure point")
    void reProduced() {
        tracker.processOperation("requestAction");
        tracker.processOperation("startAction");
        tracker.processOperation("requestAction");

        assertThat(tracker.processOperation("endAction")).isEmpty();
        assertThat(tracker.history())
                .extracting(OperationDataTracker.Event::change)
                .containsExactly(
                        OperationDataTracker.Change.ADDED,
                        OperationDataTracker.Change.REMOVED,
                        OperationDataTracker.Change.ADDED,
                        OperationDataTracker.Change.REMOVED);
    }

    @Test
    @DisplayName("unknown operations change nothing")
    void unknownOperation() {
        assertThat(tracker.processOperation("noSuchOperation")).isEmpty();
        assertThat(tracker.available()).isEmpty();
        assertThat(tracker.history()).isEmpty();
    }

    @Test
    @DisplayName("copies evolve independently")
    void copyIsIndependent() {
        tracker.processOperation("selectElement");
        OperationDataTracker branch = tracker.copy();
        branch.processOperation("requestAction");

        assertThat(branch.isAvailable("actionInstance")).isTrue();
        assertThat(tracker.isAvailable("actionInstance")).isFalse();
        assertThat(branch.isAvailable("selectedElement")).isTrue();
    }
}
