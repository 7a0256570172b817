package org.aiforge.sklearn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.aiforge.Tensor;

/**
 * Converts raw prediction inputs to the shape expected by {@link Estimator Estimators}. Text
 * pipelines receive lists of strings; every other input is coerced to a matrix of feature rows
 */
public class TextAwareInputCoercion {

  private TextAwareInputCoercion() {}

  /**
   * Applies, in order: a string becomes a one-element list; a list whose first element is a string
   * passes through; a list of lists whose first inner element is a string is flattened by taking
   * each item's first element; anything else becomes a `double[][]`
   *
   * @throws IllegalArgumentException If a non-text input cannot be coerced to a numeric matrix
   */
  public static Object coerce(Object input) {
    if (input instanceof String) {
      return Collections.singletonList(input);
    }
    if (input instanceof List && !((List<?>) input).isEmpty()) {
      List<?> items = (List<?>) input;
      Object first = items.get(0);
      if (first instanceof String) {
        return input;
      }
      if (first instanceof List
          && !((List<?>) first).isEmpty()
          && ((List<?>) first).get(0) instanceof String) {
        List<Object> flattened = new ArrayList<>();
        for (Object item : items) {
          if (item instanceof List && !((List<?>) item).isEmpty()) {
            flattened.add(((List<?>) item).get(0));
          } else {
            flattened.add(item);
          }
        }
        return flattened;
      }
    }
    if (input instanceof double[][]) {
      return input;
    }
    return Tensor.fromNested(input).toMatrix();
  }
}
