/**
 * CLI entry points that record a sample session and inspect, rotate, and verify session logs.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, and invokes the
 * configuration, lifecycle, and persistence components.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded; only {@code demo} starts the writer thread.</p>
 */
package ca.gc.cra.trail.api;
