/**
 * Producer API of the activity trail.
 * <p><strong>Role:</strong> Driving side of the application layer; turns calls such as
 * {@code logToolUsage(...)} into stamped, validated {@link ca.gc.cra.trail.domain.events.ActivityEvent}s.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.trail.application.events.ActivityLogger} is shared by all producer
 * threads; scopes are confined to the thread that opened them.</p>
 * <p><strong>Metrics:</strong> {@code trail.events.<kind>}, {@code trail.events.schema.rejected},
 * {@code trail.scope.agent.durationMillis}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.application.events;
