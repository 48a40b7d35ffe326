package ca.gc.cra.scopelabel.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for single label and scope path segments.
 * <p><strong>Why:</strong> A segment containing the separator would silently change the depth of every label
 * generated beneath it, so bad names are rejected where they enter the system.</p>
 * <p><strong>Role:</strong> Support utility invoked by scope construction and the label generator.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject empty segments.</li>
 *   <li>Reject segments containing {@link #SEPARATOR}.</li>
 *   <li>Optionally reject {@link #UNDERSCORE} when the configuration asks for the stricter rule.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities; safe for concurrent access.</p>
 * <p><strong>Performance:</strong> O(n) character scan per segment.</p>
 * <p><strong>Observability:</strong> No logs or metrics; violations raise {@link LabelValidationException}.</p>
 *
 * @since 0.1.0
 */
public final class Segments {
  /** Separator between path segments. */
  public static final char SEPARATOR = '/';
  /** Character rejected only under the strict naming rule. */
  public static final char UNDERSCORE = '_';

  private Segments() {
    // Utility
  }

  /**
   * Validates a segment under the default rule: non-empty and free of {@link #SEPARATOR}.
   *
   * @param segment candidate name; must not be {@code null}
   * @return {@code segment} unchanged
   * @throws NullPointerException if {@code segment} is {@code null}
   * @throws LabelValidationException if the segment is empty or contains the separator
   */
  public static String requireSegment(String segment) {
    return requireSegment(segment, false);
  }

  /**
   * Validates a segment, optionally forbidding underscores as well.
   *
   * @param segment candidate name; must not be {@code null}
   * @param forbidUnderscore {@code true} to also reject {@link #UNDERSCORE}
   * @return {@code segment} unchanged; no trimming is applied
   * @throws NullPointerException if {@code segment} is {@code null}
   * @throws LabelValidationException if the segment violates the active rule
   */
  public static String requireSegment(String segment, boolean forbidUnderscore) {
    Objects.requireNonNull(segment, "label");
    if (segment.isEmpty()) {
      throw new LabelValidationException("label cannot be empty");
    }
    if (segment.indexOf(SEPARATOR) >= 0) {
      throw new LabelValidationException("label cannot contain slash (`/`): '" + segment
          + "'. Please use label scopes to build hierarchical labels.");
    }
    if (forbidUnderscore && segment.indexOf(UNDERSCORE) >= 0) {
      throw new LabelValidationException("label cannot contain underscore (`_`): '" + segment + "'");
    }
    return segment;
  }

  /**
   * Joins path segments with {@link #SEPARATOR}.
   *
   * @param segments ordered segments; must not be {@code null}
   * @return slash-joined path
   */
  public static String join(Iterable<String> segments) {
    return String.join(String.valueOf(SEPARATOR), segments);
  }
}
