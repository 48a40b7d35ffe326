package ca.gc.cra.scopelabel.api;

import ca.gc.cra.scopelabel.context.ContextStack;
import ca.gc.cra.scopelabel.label.Label;
import ca.gc.cra.scopelabel.label.LabelScope;
import ca.gc.cra.scopelabel.label.LabelingContext;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Static entry points over the default {@link LabelingContext}.
 * <p><strong>Why:</strong> Model-authoring code labels entities from anywhere without carrying a context
 * object around.</p>
 * <p><strong>Role:</strong> Public surface consumed by collaborators.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; every call mutates process-wide state.</p>
 *
 * <pre>{@code
 * try (LabelScope.Activation model = Labels.scope("model").enter()) {
 *   Label first = Labels.autoLabel();   // model/1
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Labels {
  private Labels() {
    // Utility
  }

  /**
   * Increments the counter of the default namespace ({@code "default"} unless configured otherwise).
   *
   * @return next value, starting at {@code 1}
   */
  public static long uid() {
    return LabelingContext.getDefault().uid();
  }

  /**
   * Increments the counter of {@code namespace}.
   *
   * @param namespace counter key
   * @return next value, starting at {@code 1}
   */
  public static long uid(String namespace) {
    return LabelingContext.getDefault().uid(namespace);
  }

  /** Resets the counter of the default namespace. */
  public static void resetUid() {
    LabelingContext.getDefault().resetUid();
  }

  /**
   * Resets the counter of {@code namespace}.
   *
   * @param namespace counter key
   */
  public static void resetUid(String namespace) {
    LabelingContext.getDefault().resetUid(namespace);
  }

  /**
   * Returns the process-wide context stack, shared with the label scope layer.
   *
   * @return default context stack
   */
  public static ContextStack contextStack() {
    return LabelingContext.getDefault().contextStack();
  }

  /**
   * Returns the innermost value pushed under {@code key}.
   *
   * @param key context kind
   * @return current value
   * @throws ca.gc.cra.scopelabel.context.NoContextException if nothing is pushed under {@code key}
   */
  public static Object currentContext(String key) {
    return contextStack().peek(key);
  }

  /**
   * Creates an unresolved scope named {@code basename}.
   *
   * @param basename last path segment
   * @return scope ready to be entered
   */
  public static LabelScope scope(String basename) {
    return LabelingContext.getDefault().scope(basename);
  }

  /**
   * Creates an unnamed scope numbered by its parent on entry.
   *
   * @return scope ready to be entered
   */
  public static LabelScope scope() {
    return LabelingContext.getDefault().unnamedScope();
  }

  public static Optional<LabelScope> current() {
    return LabelingContext.getDefault().currentScope();
  }

  public static LabelScope global() {
    return LabelingContext.getDefault().globalScope();
  }

  public static Label autoLabel() {
    return LabelingContext.getDefault().autoLabel();
  }

  public static Label autoLabel(CharSequence name) {
    return LabelingContext.getDefault().autoLabel(name);
  }

  public static Label autoLabel(CharSequence name, LabelScope scope) {
    return LabelingContext.getDefault().autoLabel(name, scope);
  }

  public static Label label(String value) {
    return Label.of(value);
  }

  public static Label label(List<String> parts) {
    return Label.of(parts);
  }
}
