package ca.gc.cra.trail.application.pipeline;

/**
 * Lifecycle of a {@link DurableEventWriter}. Transitions only move forward:
 * {@code UNINITIALIZED -> RUNNING -> DRAINING -> STOPPED}.
 *
 * @since 0.1.0
 */
public enum WriterState {
  /** Created but not started; submissions fail with {@code NotInitializedException}. */
  UNINITIALIZED,
  /** Writer thread running; submissions accepted. */
  RUNNING,
  /** Shutdown requested; queued events are being written, new submissions fail. */
  DRAINING,
  /** Sink closed; submissions fail with {@code LoggerStoppedException}. */
  STOPPED
}
