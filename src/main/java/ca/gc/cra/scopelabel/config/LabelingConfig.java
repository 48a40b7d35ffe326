package ca.gc.cra.scopelabel.config;

import ca.gc.cra.scopelabel.validation.Segments;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable settings shared by every scope and label of one labeling context.
 * <p><strong>Why:</strong> Provides naming defaults when no external configuration is supplied.</p>
 * <p><strong>Role:</strong> Configuration record consumed by {@code LabelingContext}.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param globalScopeName single segment used for the fallback scope when no scope or name is available
 * @param defaultNamespace counter namespace used by {@code uid()} without an explicit namespace
 * @param forbidUnderscore {@code true} to reject {@code _} in segment names as well as {@code /}
 * @param warnOnGlobalFallback {@code true} to log a warning whenever the global fallback scope is used
 * @since 0.1.0
 */
public record LabelingConfig(
    String globalScopeName,
    String defaultNamespace,
    boolean forbidUnderscore,
    boolean warnOnGlobalFallback) {

  /** Name of the fallback scope in {@link #defaults()}. */
  public static final String DEFAULT_GLOBAL_SCOPE = "global";
  /** Counter namespace in {@link #defaults()}. */
  public static final String DEFAULT_NAMESPACE = "default";

  /**
   * Validates components.
   *
   * @throws NullPointerException if a name is {@code null}
   * @throws IllegalArgumentException if the global scope name is not a valid segment
   */
  public LabelingConfig {
    Segments.requireSegment(globalScopeName, forbidUnderscore);
    Objects.requireNonNull(defaultNamespace, "defaultNamespace");
  }

  /**
   * Provides default configuration values used when no external config is supplied.
   *
   * @return global scope {@code "global"}, namespace {@code "default"}, underscores allowed, warnings on
   */
  public static LabelingConfig defaults() {
    return new LabelingConfig(DEFAULT_GLOBAL_SCOPE, DEFAULT_NAMESPACE, false, true);
  }
}
