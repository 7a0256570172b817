package org.aiforge.serving;

import org.aiforge.Framework;

/** A normalized prediction together with the model that produced it */
public class PredictionResult {
  private final Object prediction;
  private final String modelIdentifier;
  private final Framework framework;
  private final double inferenceTimeMillis;

  PredictionResult(
      Object prediction, String modelIdentifier, Framework framework, double inferenceTimeMillis) {
    this.prediction = prediction;
    this.modelIdentifier = modelIdentifier;
    this.framework = framework;
    this.inferenceTimeMillis = inferenceTimeMillis;
  }

  /** @return The JSON-compatible prediction */
  public Object getPrediction() {
    return prediction;
  }

  public String getModelIdentifier() {
    return modelIdentifier;
  }

  public Framework getFramework() {
    return framework;
  }

  /** @return Wall time of the prediction and its normalization, rounded to two decimals */
  public double getInferenceTimeMillis() {
    return inferenceTimeMillis;
  }
}
