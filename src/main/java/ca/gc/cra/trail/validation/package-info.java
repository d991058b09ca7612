/**
 * <strong>Purpose:</strong> Input validation helpers shared by configuration, CLI, and identifier code.
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.validation;
