package ca.gc.cra.trail.application.session;

/**
 * Open hierarchy scope. Closing it pops the scope from the owning thread's stack.
 *
 * <p>Use with try-with-resources so the scope is closed on every exit path:</p>
 * <pre>{@code
 * try (HierarchyScope scope = tracker.scopeBegin(eventId)) {
 *   // events logged here are parented to eventId
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class HierarchyScope implements AutoCloseable {
  private final HierarchyTracker tracker;
  private final String eventId;
  private final Thread owner;
  private boolean closed;

  HierarchyScope(HierarchyTracker tracker, String eventId) {
    this.tracker = tracker;
    this.eventId = eventId;
    this.owner = Thread.currentThread();
  }

  public String eventId() {
    return eventId;
  }

  /**
   * Pops this scope. Calling close twice is a no-op.
   *
   * @throws IllegalStateException when called from another thread or when this scope is not the innermost open scope
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    if (Thread.currentThread() != owner) {
      throw new IllegalStateException(
          "Scope " + eventId + " opened on " + owner.getName() + " closed on " + Thread.currentThread().getName());
    }
    tracker.scopeEnd(eventId);
    closed = true;
  }
}
