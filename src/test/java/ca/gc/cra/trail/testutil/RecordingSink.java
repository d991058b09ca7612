package ca.gc.cra.trail.testutil;

import ca.gc.cra.trail.application.errors.SinkWriteException;
import ca.gc.cra.trail.application.port.EventSinkPort;
import ca.gc.cra.trail.domain.events.ActivityEvent;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/** In-memory sink that can be paused or told to fail. */
public final class RecordingSink implements EventSinkPort {
  private final List<ActivityEvent> events = new CopyOnWriteArrayList<>();
  private final AtomicInteger flushes = new AtomicInteger();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicInteger failuresRemaining = new AtomicInteger();
  private volatile CountDownLatch gate = new CountDownLatch(0);

  @Override
  public void persist(ActivityEvent event) {
    try {
      if (!gate.await(10, TimeUnit.SECONDS)) {
        throw new SinkWriteException("gate never opened");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new SinkWriteException("interrupted while paused", ex);
    }
    if (failuresRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
      throw new SinkWriteException("simulated failure for " + event.eventId());
    }
    events.add(event);
  }

  @Override
  public void flush() {
    flushes.incrementAndGet();
  }

  @Override
  public void close() {
    closed.set(true);
  }

  /** Blocks writes until {@link #resume()}. */
  public void pause() {
    gate = new CountDownLatch(1);
  }

  public void resume() {
    gate.countDown();
  }

  public void failNext(int count) {
    failuresRemaining.set(count);
  }

  public List<ActivityEvent> events() {
    return List.copyOf(events);
  }

  public List<String> eventIds() {
    return events.stream().map(ActivityEvent::eventId).toList();
  }

  public int flushes() {
    return flushes.get();
  }

  public boolean closed() {
    return closed.get();
  }
}
