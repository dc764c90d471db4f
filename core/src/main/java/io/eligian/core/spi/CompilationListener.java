package io.eligian.core.spi;

/**
 * Observability hook for compilations. Implementations bridge to whatever metrics or tracing the
 * host uses; the core has no telemetry dependency.
 *
 * <p>Exceptions thrown by listeners are caught and logged; they never affect the compilation.
 */
public interface CompilationListener {

    /** Called before a stage runs. */
    default void onStageStarted(StageStartedEvent event) {}

    /** Called after a stage finished without a fatal error. */
    default void onStageCompleted(StageCompletedEvent event) {}

    /** Called once when a compilation stops with a fatal error. */
    default void onCompilationFailed(CompilationFailedEvent event) {}

    // --- Event records ---

    /** Emitted when a stage starts. */
    record StageStartedEvent(String sourceUri, String stage) {}

    /** Emitted when a stage completes. */
    record StageCompletedEvent(String sourceUri, String stage, long durationMs) {}

    /** Emitted when a compilation fails. */
    record CompilationFailedEvent(String sourceUri, String stage, String errorKind, String errorDetail) {}
}
