package ca.gc.cra.scopelabel.context;

/**
 * Unchecked exception thrown when a {@link ContextStack} key has nothing pushed under it.
 *
 * @since 0.1.0
 */
public final class NoContextException extends RuntimeException {
  private final String key;

  /**
   * Creates an exception naming the empty key.
   *
   * @param key context key whose stack was empty
   */
  public NoContextException(String key) {
    super("Context with key " + key + " is empty.");
    this.key = key;
  }

  /**
   * Returns the key that had no pushed values.
   *
   * @return the empty context key
   */
  public String key() {
    return key;
  }
}
