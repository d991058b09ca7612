/**
 * Unchecked failure types surfaced by the activity trail: schema rejections, queue saturation, sink I/O,
 * shutdown timeouts, and lifecycle violations.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.application.errors;
