package ca.gc.cra.scopelabel.validation;

/**
 * Thrown when a caller-supplied label or scope segment is empty or contains a reserved character.
 *
 * @since 0.1.0
 */
public final class LabelValidationException extends IllegalArgumentException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public LabelValidationException(String msg) { super(msg); }
}
