/**
 * Session identity, event id allocation, and per-thread scope tracking.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.application.session;
