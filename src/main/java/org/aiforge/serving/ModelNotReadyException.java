package org.aiforge.serving;

/** A prediction was requested while no model is loaded */
public class ModelNotReadyException extends PredictorEvaluationException {
  public ModelNotReadyException(String message) {
    super(message);
  }
}
