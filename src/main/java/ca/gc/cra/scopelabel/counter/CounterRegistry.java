package ca.gc.cra.scopelabel.counter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Namespace-keyed registry of monotonically increasing counters.
 * <p><strong>Why:</strong> Supplies the deterministic numbering behind generated labels and unnamed scopes.</p>
 * <p><strong>Role:</strong> Leaf state object owned by a {@code LabelingContext}; scopes reset their own
 * namespace on entry and draw from it when asked for the next label.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return {@code 1..k} for {@code k} consecutive {@link #next(String)} calls on one namespace.</li>
 *   <li>Restart a namespace at zero on {@link #reset(String)}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Callers sharing a namespace across threads must
 * serialize access externally.</p>
 * <p><strong>Performance:</strong> One hash lookup per call.</p>
 * <p><strong>Observability:</strong> No logs or metrics; {@link #current(String)} exposes values for tests.</p>
 *
 * @since 0.1.0
 */
public final class CounterRegistry {
  private final Map<String, Long> counters = new HashMap<>();

  /**
   * Increments and returns the counter for {@code namespace}.
   *
   * @param namespace counter key; must not be {@code null}
   * @return the incremented value; the first call for a namespace returns {@code 1}
   * @throws NullPointerException if {@code namespace} is {@code null}
   */
  public long next(String namespace) {
    Objects.requireNonNull(namespace, "namespace");
    return counters.merge(namespace, 1L, Long::sum);
  }

  /**
   * Sets the counter for {@code namespace} back to zero. Unused namespaces are accepted.
   *
   * @param namespace counter key; must not be {@code null}
   * @throws NullPointerException if {@code namespace} is {@code null}
   */
  public void reset(String namespace) {
    Objects.requireNonNull(namespace, "namespace");
    counters.put(namespace, 0L);
  }

  /**
   * Returns the value most recently handed out for {@code namespace}.
   *
   * @param namespace counter key; must not be {@code null}
   * @return last value returned by {@link #next(String)}, or {@code 0} when unused or reset
   */
  public long current(String namespace) {
    Objects.requireNonNull(namespace, "namespace");
    return counters.getOrDefault(namespace, 0L);
  }

  /** Forgets every namespace. Intended for test teardown. */
  public void clear() {
    counters.clear();
  }
}
