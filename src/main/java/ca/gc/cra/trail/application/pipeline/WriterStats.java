package ca.gc.cra.trail.application.pipeline;

/**
 * Point-in-time counters of a {@link DurableEventWriter}.
 *
 * @param state writer state when the snapshot was taken
 * @param submitted events accepted for processing, including those later dropped
 * @param written events successfully appended to the sink
 * @param dropped events lost to queue saturation
 * @param sinkErrors events the sink failed to write
 * @param queueDepth events currently queued
 * @param queueHighWater largest queue depth observed
 * @since 0.1.0
 */
public record WriterStats(
    WriterState state,
    long submitted,
    long written,
    long dropped,
    long sinkErrors,
    int queueDepth,
    int queueHighWater) {}
