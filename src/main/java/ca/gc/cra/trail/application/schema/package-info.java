/**
 * Schema registry and validation for activity events.
 *
 * <p>{@link ca.gc.cra.trail.application.schema.EventSchemaRegistry#standard()} holds one
 * {@link ca.gc.cra.trail.application.schema.EventSchema} per event kind. The
 * {@link ca.gc.cra.trail.application.schema.ValidationMode} decides whether a failing event is rejected, annotated, or
 * not checked at all.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.application.schema;
