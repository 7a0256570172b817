package org.aiforge.sklearn;

import java.util.ArrayList;
import java.util.List;

/** Predicts the sum of each feature row, or the length of each text. Used as a test fixture */
public class RowSumEstimator implements Estimator {
  private static final long serialVersionUID = 1L;

  private transient Object lastFeatures;

  @Override
  public Object predict(Object features) {
    lastFeatures = features;
    if (features instanceof double[][]) {
      double[][] rows = (double[][]) features;
      double[] sums = new double[rows.length];
      for (int i = 0; i < rows.length; ++i) {
        for (double value : rows[i]) {
          sums[i] += value;
        }
      }
      return sums;
    }
    List<Integer> lengths = new ArrayList<>();
    for (Object text : (List<?>) features) {
      lengths.add(String.valueOf(text).length());
    }
    return lengths;
  }

  public Object getLastFeatures() {
    return lastFeatures;
  }
}
