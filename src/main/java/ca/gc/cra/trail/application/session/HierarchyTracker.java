package ca.gc.cra.trail.application.session;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Per-thread stack of open scopes; the innermost scope is the default parent of new events.
 * <p><strong>Why:</strong> Nested agent and tool work must link child events to the enclosing event without callers
 * threading ids through every call.</p>
 * <p><strong>Thread-safety:</strong> Each thread owns an independent stack, so scopes never observe another thread's
 * parent. Nesting is strictly LIFO; out-of-order or unmatched pops fail with {@link IllegalStateException}.</p>
 *
 * @since 0.1.0
 */
public final class HierarchyTracker {
  private final ThreadLocal<Deque<String>> stacks = ThreadLocal.withInitial(ArrayDeque::new);

  /**
   * Pushes an event id as the innermost scope of the calling thread.
   *
   * @param eventId id of the event that owns the scope
   * @return handle that pops the scope when closed
   */
  public HierarchyScope scopeBegin(String eventId) {
    Objects.requireNonNull(eventId, "eventId");
    stacks.get().push(eventId);
    return new HierarchyScope(this, eventId);
  }

  /**
   * Pops the innermost scope of the calling thread.
   *
   * @return id of the popped scope
   * @throws IllegalStateException when no scope is open
   */
  public String scopeEnd() {
    Deque<String> stack = stacks.get();
    String popped = stack.poll();
    if (popped == null) {
      stacks.remove();
      throw new IllegalStateException("scopeEnd called with no open scope");
    }
    if (stack.isEmpty()) {
      stacks.remove();
    }
    return popped;
  }

  /**
   * Pops the innermost scope after checking it is the expected one.
   *
   * @param expected id the caller believes is innermost
   * @throws IllegalStateException when another scope is innermost or no scope is open
   */
  void scopeEnd(String expected) {
    Deque<String> stack = stacks.get();
    String top = stack.peek();
    if (!expected.equals(top)) {
      if (stack.isEmpty()) {
        stacks.remove();
      }
      throw new IllegalStateException(
          "Out-of-order scope close: expected innermost " + expected + " but was " + (top == null ? "none" : top));
    }
    scopeEnd();
  }

  /**
   * Returns the innermost open scope of the calling thread without modifying the stack.
   *
   * @return innermost scope id, or empty at top level
   */
  public Optional<String> currentParent() {
    return Optional.ofNullable(stacks.get().peek());
  }

  /**
   * Returns the open scopes of the calling thread, innermost first.
   *
   * @return snapshot of the stack
   */
  public List<String> openScopes() {
    return List.copyOf(stacks.get());
  }
}
