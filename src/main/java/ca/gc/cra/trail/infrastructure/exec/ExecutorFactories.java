package ca.gc.cra.trail.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Factory helpers for the executors backing TRAIL background work.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a single-thread executor for a long-running writer loop.
   *
   * <p>The thread is a daemon so an application that never calls shutdown can still exit; the exit hook
   * registered by the lifecycle drains the queue in that case. A second submission is rejected because the
   * hand-off queue holds nothing and the only thread is busy.</p>
   *
   * @param threadName name given to the worker thread
   * @param handler uncaught exception handler installed on the worker thread
   * @return configured executor service
   */
  public static ExecutorService newWriterExecutor(String threadName, UncaughtExceptionHandler handler) {
    String name = (threadName == null || threadName.isBlank()) ? "trail-writer" : threadName;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(name);
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
