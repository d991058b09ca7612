/**
 * Configuration loading and composition root wiring for the activity trail.
 * <p><strong>Role:</strong> Bootstrap layer; merges defaults, YAML, environment, and explicit overrides into a
 * {@link ca.gc.cra.trail.config.TrailConfig} and builds a ready {@code ActivityLogger} from it.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.
 * {@link ca.gc.cra.trail.config.ActivityLogs} guards the process-wide logger with a lock.</p>
 * <p><strong>Security:</strong> Session ids become file names and are checked by {@code ca.gc.cra.trail.validation}
 * before any file is opened.</p>
 */
package ca.gc.cra.trail.config;
