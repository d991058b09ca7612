/**
 * <strong>Purpose:</strong> Activity event model: the seven event kinds, their payload records, and the identifier and
 * timestamp formats they are persisted with.
 * <p><strong>Pipeline role:</strong> Domain layer; produced by the logger, validated by the schema registry, written by
 * sink adapters.</p>
 * <p><strong>Concurrency:</strong> All types are immutable.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.domain.events;
