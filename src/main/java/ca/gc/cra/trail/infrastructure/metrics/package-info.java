/**
 * OpenTelemetry-backed implementation of {@link ca.gc.cra.trail.application.port.MetricsPort}.
 * <p>Export is off unless {@code metricsExporter=otlp}; metric names follow the {@code trail.*} namespace, e.g.
 * {@code trail.writer.dropped} and {@code trail.writer.sink.error}.</p>
 */
package ca.gc.cra.trail.infrastructure.metrics;
