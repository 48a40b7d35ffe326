package ca.gc.cra.scopelabel.label;

import ca.gc.cra.scopelabel.validation.Segments;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Node of the hierarchical naming tree that prefixes labels generated while it is active.
 * <p><strong>Why:</strong> Lets callers name a region of code once ({@code model}) and have every entity created
 * inside it receive a reproducible label ({@code model/1}, {@code model/2}, {@code model/3/1}).</p>
 * <p><strong>Role:</strong> Built on the {@link ca.gc.cra.scopelabel.context.ContextStack} and
 * {@link ca.gc.cra.scopelabel.counter.CounterRegistry} of its {@link LabelingContext}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve its full path from the nearest active parent on first entry.</li>
 *   <li>Publish itself as the active scope and restart its own counter on every entry.</li>
 *   <li>Hand out the next numeric label of its namespace.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one logical execution context per labeling context.</p>
 * <p><strong>Observability:</strong> Logs a WARN when falling back to the global scope and DEBUG on enter/exit.</p>
 *
 * <pre>{@code
 * try (LabelScope.Activation model = LabelScope.fromBasename("model").enter()) {
 *   Labels.autoLabel();        // model/1
 *   Labels.autoLabel();        // model/2
 *   Labels.autoLabel("foo");   // model/foo
 *   try (LabelScope.Activation nested = LabelScope.unnamed().enter()) {
 *     Labels.autoLabel();      // model/3/1
 *   }
 * }
 * }</pre>
 *
 * <p>Entering an already resolved instance again, for example the same scope object in every iteration of a
 * loop, pushes it again and restarts its numbering from {@code 1}. Repeated runs therefore produce identical
 * labels.</p>
 *
 * <p>Two scopes are equal when their resolved paths are equal. The hash code follows the path, so it changes
 * when an unresolved scope is first entered.</p>
 *
 * @since 0.1.0
 */
public final class LabelScope {
  /** Context stack key under which active label scopes are published. */
  public static final String CONTEXT_KEY = "label_namespace";

  private static final Logger log = LoggerFactory.getLogger(LabelScope.class);

  private final LabelingContext context;
  private String basename;
  private List<String> path;
  private boolean activated;

  private LabelScope(LabelingContext context, String basename, List<String> path) {
    this.context = Objects.requireNonNull(context, "context");
    this.basename = basename;
    this.path = path;
  }

  /**
   * Creates an unresolved scope named {@code basename} in the default labeling context.
   *
   * @param basename last path segment
   * @return unresolved scope
   * @throws ca.gc.cra.scopelabel.validation.LabelValidationException if the name is empty or contains {@code /}
   */
  public static LabelScope fromBasename(String basename) {
    return fromBasename(LabelingContext.getDefault(), basename);
  }

  /**
   * Creates an unresolved scope named {@code basename}.
   *
   * @param context owning labeling context
   * @param basename last path segment
   * @return unresolved scope
   * @throws ca.gc.cra.scopelabel.validation.LabelValidationException if the name is not a valid segment
   */
  public static LabelScope fromBasename(LabelingContext context, String basename) {
    Segments.requireSegment(basename, context.config().forbidUnderscore());
    return new LabelScope(context, basename, null);
  }

  /**
   * Creates an unresolved scope in the default context whose basename is numbered by its parent on entry.
   *
   * @return unnamed unresolved scope
   */
  public static LabelScope unnamed() {
    return unnamed(LabelingContext.getDefault());
  }

  /**
   * Creates an unresolved scope whose basename is numbered by its parent on entry.
   *
   * @param context owning labeling context
   * @return unnamed unresolved scope
   */
  public static LabelScope unnamed(LabelingContext context) {
    return new LabelScope(context, null, null);
  }

  /**
   * Creates a pre-resolved scope in the default context whose path equals the label's parts.
   *
   * @param label source label
   * @return resolved, inactive scope
   */
  public static LabelScope fromLabel(Label label) {
    return fromLabel(LabelingContext.getDefault(), label);
  }

  /**
   * Creates a pre-resolved scope whose path equals the label's parts.
   *
   * @param context owning labeling context
   * @param label source label
   * @return resolved, inactive scope
   */
  public static LabelScope fromLabel(LabelingContext context, Label label) {
    Objects.requireNonNull(label, "label");
    return fromPath(context, label.parts());
  }

  /**
   * Creates a pre-resolved copy of {@code other}, sharing its context and path.
   *
   * @param other scope to copy; must have been entered at least once
   * @return new resolved, inactive scope equal to {@code other}
   * @throws UnresolvedScopeException if {@code other} was never entered
   */
  public static LabelScope fromExistingScope(LabelScope other) {
    Objects.requireNonNull(other, "other");
    other.checkEntered();
    return fromPath(other.context, other.path);
  }

  /**
   * Returns a fresh global scope of the default context.
   *
   * @return resolved scope with path {@code [global]}
   */
  public static LabelScope global() {
    return global(LabelingContext.getDefault());
  }

  /**
   * Returns a fresh global scope. It can be used without ever being entered.
   *
   * @param context owning labeling context
   * @return resolved scope whose single segment is the configured global scope name
   */
  public static LabelScope global(LabelingContext context) {
    return fromPath(context, List.of(context.config().globalScopeName()));
  }

  /**
   * Returns the innermost active scope of the default context.
   *
   * @return active scope, or empty when no scope is entered
   */
  public static Optional<LabelScope> current() {
    return current(LabelingContext.getDefault());
  }

  /**
   * Returns the innermost active scope. An empty stack is a normal state here, not an error.
   *
   * @param context labeling context to inspect
   * @return active scope, or empty when no scope is entered
   */
  public static Optional<LabelScope> current(LabelingContext context) {
    if (context.contextStack().isEmpty(CONTEXT_KEY)) {
      return Optional.empty();
    }
    return Optional.of(context.contextStack().peek(CONTEXT_KEY, LabelScope.class));
  }

  static LabelScope fromPath(LabelingContext context, List<String> path) {
    List<String> copy = List.copyOf(path);
    if (copy.isEmpty()) {
      throw new IllegalArgumentException("path should not be empty");
    }
    return new LabelScope(context, copy.get(copy.size() - 1), copy);
  }

  /**
   * Activates this scope, resolving its path first when needed.
   *
   * <p>Always use with try-with-resources so the scope is popped on every exit path.</p>
   *
   * @return activation handle that deactivates the scope when closed
   */
  public Activation enter() {
    if (path == null) {
      LabelScope parent = current(context).orElse(null);
      if (basename == null) {
        if (parent == null) {
          if (context.config().warnOnGlobalFallback()) {
            log.warn("Label is not provided, and label scope is also missing. Global numbering will be used. "
                + "Note that we always recommend specifying the label manually.");
          }
          parent = global(context);
        }
        basename = parent.nextLabel();
      }
      if (parent == null) {
        path = List.of(basename);
      } else {
        List<String> resolved = new ArrayList<>(parent.path);
        resolved.add(basename);
        path = List.copyOf(resolved);
      }
    }

    context.contextStack().push(CONTEXT_KEY, this);
    context.counters().reset(absoluteScope());
    activated = true;
    log.debug("Entered {}", this);
    return new Activation(this);
  }

  /**
   * Returns the next numeric label of this scope's namespace.
   *
   * @return decimal string of the incremented counter
   * @throws UnresolvedScopeException if the scope was never entered
   */
  public String nextLabel() {
    return String.valueOf(context.counters().next(absoluteScope()));
  }

  /**
   * Alias of {@link #name()}.
   *
   * @return slash-joined full path
   * @throws UnresolvedScopeException if the scope was never entered
   */
  public String absoluteScope() {
    return name();
  }

  /**
   * Returns the full name of this scope, for example {@code model/cell/2}.
   *
   * @return slash-joined full path
   * @throws UnresolvedScopeException if the scope was never entered
   */
  public String name() {
    checkEntered();
    return Segments.join(path);
  }

  /**
   * Fails unless the path is resolved.
   *
   * @throws UnresolvedScopeException if the scope was never entered
   */
  public void checkEntered() {
    if (path == null) {
      throw new UnresolvedScopeException(basename);
    }
  }

  public Optional<String> basename() {
    return Optional.ofNullable(basename);
  }

  public Optional<List<String>> path() {
    return Optional.ofNullable(path);
  }

  public boolean isResolved() {
    return path != null;
  }

  public boolean isActivated() {
    return activated;
  }

  LabelingContext context() {
    return context;
  }

  List<String> segments() {
    checkEntered();
    return path;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof LabelScope other && Objects.equals(path, other.path);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(path);
  }

  @Override
  public String toString() {
    if (path == null) {
      return "label_scope(<unresolved: " + basename + ">)";
    }
    return "label_scope('" + Segments.join(path) + "')";
  }

  /**
   * Handle returned by {@link LabelScope#enter()}; closing it deactivates the scope exactly once.
   *
   * @since 0.1.0
   */
  public static final class Activation implements AutoCloseable {
    private final LabelScope scope;
    private boolean closed;

    private Activation(LabelScope scope) {
      this.scope = scope;
    }

    /**
     * Returns the scope this handle activated.
     *
     * @return the entered scope
     */
    public LabelScope scope() {
      return scope;
    }

    /**
     * Pops the scope from the context stack and clears its activated flag. Subsequent calls do nothing.
     *
     * @throws IllegalStateException if a different scope is on top, meaning scopes were exited out of order
     */
    @Override
    public void close() {
      if (closed) {
        return;
      }
      var stack = scope.context.contextStack();
      if (stack.peek(CONTEXT_KEY) != scope) {
        throw new IllegalStateException("Label scope " + scope + " exited out of order");
      }
      stack.pop(CONTEXT_KEY);
      scope.activated = false;
      closed = true;
      log.debug("Exited {}", scope);
    }
  }
}
