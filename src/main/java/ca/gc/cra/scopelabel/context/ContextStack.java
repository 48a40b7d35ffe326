package ca.gc.cra.scopelabel.context;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Keyed last-in-first-out stacks of arbitrary values describing "what is active".
 * <p><strong>Why:</strong> Lets scoped code publish state (such as the active label scope) that deeply nested
 * callers can look up without threading it through every signature.</p>
 * <p><strong>Role:</strong> Generic primitive underneath {@code LabelScope}; usable by any collaborator needing
 * ad hoc scoped state under its own key.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Push, pop and peek values per key, failing with {@link NoContextException} on empty keys.</li>
 *   <li>Offer {@link #enter(String, Object)} frames so try-with-resources pairs each push with one pop.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; intended for a single logical execution context.</p>
 * <p><strong>Performance:</strong> Amortized O(1) deque operations; {@link #snapshot(String)} copies.</p>
 * <p><strong>Observability:</strong> No logging; {@link #snapshot(String)} exists for tests and diagnostics.</p>
 *
 * @implNote Stacks are created lazily per key and never removed except by {@link #clear()}.
 * @since 0.1.0
 */
public final class ContextStack {
  private final Map<String, Deque<Object>> stacks = new HashMap<>();

  /**
   * Pushes {@code value} on top of the stack stored under {@code key}.
   *
   * @param key context kind; must not be {@code null}
   * @param value value to publish; must not be {@code null}
   * @throws NullPointerException if {@code key} or {@code value} is {@code null}
   */
  public void push(String key, Object value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    stacks.computeIfAbsent(key, k -> new ArrayDeque<>()).push(value);
  }

  /**
   * Removes and returns the most recently pushed value under {@code key}.
   *
   * @param key context kind; must not be {@code null}
   * @return the former top value
   * @throws NoContextException if nothing is pushed under {@code key}
   */
  public Object pop(String key) {
    return nonEmpty(key).pop();
  }

  /**
   * Returns the most recently pushed value under {@code key} without removing it.
   *
   * @param key context kind; must not be {@code null}
   * @return the current top value
   * @throws NoContextException if nothing is pushed under {@code key}
   */
  public Object peek(String key) {
    return nonEmpty(key).peek();
  }

  /**
   * Typed variant of {@link #peek(String)}.
   *
   * @param key context kind; must not be {@code null}
   * @param type expected value type
   * @param <T> value type
   * @return the current top value cast to {@code type}
   * @throws NoContextException if nothing is pushed under {@code key}
   * @throws ClassCastException if the top value is not a {@code type}
   */
  public <T> T peek(String key, Class<T> type) {
    return type.cast(peek(key));
  }

  /**
   * Returns a copy of the values under {@code key}, bottom first.
   *
   * @param key context kind; must not be {@code null}
   * @return unmodifiable snapshot; empty when nothing is pushed
   */
  public List<Object> snapshot(String key) {
    Objects.requireNonNull(key, "key");
    Deque<Object> stack = stacks.get(key);
    if (stack == null || stack.isEmpty()) {
      return List.of();
    }
    List<Object> copy = new ArrayList<>(stack);
    Collections.reverse(copy);
    return Collections.unmodifiableList(copy);
  }

  /**
   * Reports whether nothing is pushed under {@code key}.
   *
   * @param key context kind; must not be {@code null}
   * @return {@code true} when {@link #peek(String)} would fail
   */
  public boolean isEmpty(String key) {
    Objects.requireNonNull(key, "key");
    Deque<Object> stack = stacks.get(key);
    return stack == null || stack.isEmpty();
  }

  /**
   * Pushes {@code value} and returns a frame that pops it when closed.
   *
   * <p>Use with try-with-resources so the pop runs on every exit path:</p>
   * <pre>{@code
   * try (ContextStack.Frame frame = stack.enter("tenant", tenant)) {
   *   ...
   * }
   * }</pre>
   *
   * @param key context kind; must not be {@code null}
   * @param value value to publish; must not be {@code null}
   * @return frame owning the pushed value
   */
  public Frame enter(String key, Object value) {
    push(key, value);
    return new Frame(this, key, value);
  }

  /** Drops every stack. Intended for test teardown. */
  public void clear() {
    stacks.clear();
  }

  private Deque<Object> nonEmpty(String key) {
    Objects.requireNonNull(key, "key");
    Deque<Object> stack = stacks.get(key);
    if (stack == null || stack.isEmpty()) {
      throw new NoContextException(key);
    }
    return stack;
  }

  /**
   * Handle returned by {@link ContextStack#enter(String, Object)}; closing it pops the pushed value once.
   *
   * @since 0.1.0
   */
  public static final class Frame implements AutoCloseable {
    private final ContextStack owner;
    private final String key;
    private final Object value;
    private boolean closed;

    private Frame(ContextStack owner, String key, Object value) {
      this.owner = owner;
      this.key = key;
      this.value = value;
    }

    /**
     * Returns the key this frame pushed under.
     *
     * @return context key
     */
    public String key() {
      return key;
    }

    /**
     * Returns the value this frame pushed.
     *
     * @return pushed value
     */
    public Object value() {
      return value;
    }

    /**
     * Pops the pushed value. Subsequent calls do nothing.
     *
     * @throws IllegalStateException if another value sits on top, meaning frames were closed out of order;
     *     the stack is left untouched in that case
     */
    @Override
    public void close() {
      if (closed) {
        return;
      }
      if (owner.peek(key) != value) {
        throw new IllegalStateException("Context frame for key " + key + " closed out of order");
      }
      owner.pop(key);
      closed = true;
    }
  }
}
