package org.aiforge;

/**
 * An exception indicating a failure while resolving, binding or loading a model. Load failures are
 * unchecked: the resolution engine decides per tier whether they are fatal or recovered
 */
public class ModelLoadingException extends RuntimeException {
  /**
   * Constructs an exception
   *
   * @param message The user-readable error message associated with this exception
   */
  public ModelLoadingException(String message) {
    super(message);
  }

  /**
   * Constructs an exception with contents from a causal exception
   *
   * @param message The user-readable error message associated with this exception
   * @param cause The causal exception to include in the ModelLoadingException
   */
  public ModelLoadingException(String message, Throwable cause) {
    super(message, cause);
  }
}
