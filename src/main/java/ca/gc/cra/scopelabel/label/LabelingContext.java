package ca.gc.cra.scopelabel.label;

import ca.gc.cra.scopelabel.config.ConfigLoader;
import ca.gc.cra.scopelabel.config.LabelingConfig;
import ca.gc.cra.scopelabel.context.ContextStack;
import ca.gc.cra.scopelabel.counter.CounterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Explicit holder of all labeling state: active scopes, counters and configuration.
 * <p><strong>Why:</strong> Keeps the process-wide registries constructible so tests and independent tasks can
 * own isolated instances, while {@link #getDefault()} serves code that relies on global state.</p>
 * <p><strong>Role:</strong> Composition root of the labeling subsystem.</p>
 * <p><strong>Thread-safety:</strong> Instances are not thread-safe. Use one instance per logical task when
 * labels are generated concurrently.</p>
 * <p><strong>Observability:</strong> Default configuration is read from the file named by the
 * {@value ConfigLoader#CONFIG_PROPERTY} system property.</p>
 *
 * @since 0.1.0
 */
public final class LabelingContext {
  private static LabelingContext defaultContext;

  private final LabelingConfig config;
  private final ContextStack contextStack;
  private final CounterRegistry counters;
  private final LabelGenerator generator;

  /** Creates a context with {@link LabelingConfig#defaults()}. */
  public LabelingContext() {
    this(LabelingConfig.defaults());
  }

  /**
   * Creates a context with fresh state and the given settings.
   *
   * @param config labeling settings
   */
  public LabelingContext(LabelingConfig config) {
    this(config, new ContextStack(), new CounterRegistry());
  }

  /**
   * Creates a context over existing state, for example a context stack shared with other scoped concerns.
   *
   * @param config labeling settings
   * @param contextStack stack publishing active scopes
   * @param counters counter registry
   */
  public LabelingContext(LabelingConfig config, ContextStack contextStack, CounterRegistry counters) {
    this.config = Objects.requireNonNull(config, "config");
    this.contextStack = Objects.requireNonNull(contextStack, "contextStack");
    this.counters = Objects.requireNonNull(counters, "counters");
    this.generator = new LabelGenerator(this);
  }

  /**
   * Returns the process-wide context, creating it on first use.
   *
   * @return default labeling context
   * @throws UncheckedIOException if the configured file exists but cannot be read
   */
  public static synchronized LabelingContext getDefault() {
    if (defaultContext == null) {
      try {
        defaultContext = new LabelingContext(ConfigLoader.fromSystemProperty());
      } catch (IOException ex) {
        throw new UncheckedIOException("Failed to load labeling configuration", ex);
      }
    }
    return defaultContext;
  }

  /**
   * Replaces the process-wide context.
   *
   * @param context new default; {@code null} recreates it lazily on the next {@link #getDefault()}
   */
  public static synchronized void setDefault(LabelingContext context) {
    defaultContext = context;
  }

  public LabelingConfig config() {
    return config;
  }

  public ContextStack contextStack() {
    return contextStack;
  }

  public CounterRegistry counters() {
    return counters;
  }

  public LabelGenerator generator() {
    return generator;
  }

  /** Clears every context stack and counter. Intended for test teardown. */
  public void reset() {
    contextStack.clear();
    counters.clear();
  }

  public LabelScope scope(String basename) {
    return LabelScope.fromBasename(this, basename);
  }

  public LabelScope unnamedScope() {
    return LabelScope.unnamed(this);
  }

  public Optional<LabelScope> currentScope() {
    return LabelScope.current(this);
  }

  public LabelScope globalScope() {
    return LabelScope.global(this);
  }

  public Label autoLabel() {
    return generator.autoLabel();
  }

  public Label autoLabel(CharSequence name) {
    return generator.autoLabel(name);
  }

  public Label autoLabel(CharSequence name, LabelScope scope) {
    return generator.autoLabel(name, scope);
  }

  /**
   * Increments the counter of the configured default namespace.
   *
   * @return next value
   */
  public long uid() {
    return counters.next(config.defaultNamespace());
  }

  public long uid(String namespace) {
    return counters.next(namespace);
  }

  /** Resets the counter of the configured default namespace. */
  public void resetUid() {
    counters.reset(config.defaultNamespace());
  }

  public void resetUid(String namespace) {
    counters.reset(namespace);
  }
}
