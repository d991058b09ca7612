/**
 * Thread and executor helpers for background writers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.infrastructure.exec;
