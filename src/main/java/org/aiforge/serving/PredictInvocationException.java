package org.aiforge.serving;

/** The predict function committed to at load time raised an exception */
public class PredictInvocationException extends PredictorEvaluationException {
  private final String function;

  public PredictInvocationException(String function, Throwable cause) {
    super(
        String.format(
            "Prediction failed: `%s` raised %s: %s",
            function, cause.getClass().getSimpleName(), cause.getMessage()),
        cause);
    this.function = function;
  }

  public String getFunction() {
    return function;
  }
}
