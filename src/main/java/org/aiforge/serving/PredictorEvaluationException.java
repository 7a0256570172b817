package org.aiforge.serving;

/**
 * An exception indicating a failure while running a prediction against the model loaded by a
 * {@link ModelGateway}
 */
public class PredictorEvaluationException extends Exception {
  /**
   * Constructs an exception
   *
   * @param message The user-readable error message associated with this exception
   */
  public PredictorEvaluationException(String message) {
    super(message);
  }

  /**
   * Constructs an exception with contents from a causal exception
   *
   * @param message The user-readable error message associated with this exception
   * @param cause The causal exception to include in the PredictorEvaluationException
   */
  public PredictorEvaluationException(String message, Throwable cause) {
    super(message, cause);
  }
}
