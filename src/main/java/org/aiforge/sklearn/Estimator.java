package org.aiforge.sklearn;

import java.io.Serializable;

/**
 * A serializable, sklearn-style estimator. Files with the `.pkl` or `.joblib` suffix hold a single
 * Java-serialized object implementing this interface
 */
public interface Estimator extends Serializable {
  /**
   * Predicts outputs for the specified features
   *
   * @param features Either a list of strings (text pipelines) or a `double[][]` of feature rows
   */
  Object predict(Object features) throws Exception;
}
