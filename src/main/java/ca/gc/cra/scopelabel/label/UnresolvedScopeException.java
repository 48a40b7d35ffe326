package ca.gc.cra.scopelabel.label;

/**
 * Thrown when a {@link LabelScope} is asked for its name or next label before it was ever entered.
 *
 * @since 0.1.0
 */
public final class UnresolvedScopeException extends IllegalStateException {
  /**
   * Creates an exception naming the unresolved scope.
   *
   * @param basename basename of the scope, or {@code null} when unnamed
   */
  public UnresolvedScopeException(String basename) {
    super("label_scope \"" + basename + "\" is not entered yet.");
  }
}
