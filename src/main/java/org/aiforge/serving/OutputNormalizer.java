package org.aiforge.serving;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import org.aiforge.ArrayConvertible;
import org.aiforge.NestedListConvertible;

/** Converts raw prediction outputs into JSON-compatible values */
public class OutputNormalizer {

  private OutputNormalizer() {}

  /**
   * Applies the first matching rule: {@link NestedListConvertible#toNestedList()}; {@link
   * ArrayConvertible#toArray()} followed by array-to-list conversion; array-to-list conversion of a
   * Java array. Any other value is returned unchanged
   */
  public static Object normalize(Object rawOutput) {
    if (rawOutput instanceof NestedListConvertible) {
      return ((NestedListConvertible) rawOutput).toNestedList();
    }
    if (rawOutput instanceof ArrayConvertible) {
      return arrayToNestedList(((ArrayConvertible) rawOutput).toArray());
    }
    return arrayToNestedList(rawOutput);
  }

  private static Object arrayToNestedList(Object value) {
    if (value == null || !value.getClass().isArray()) {
      return value;
    }
    int length = Array.getLength(value);
    List<Object> items = new ArrayList<>(length);
    for (int i = 0; i < length; ++i) {
      items.add(arrayToNestedList(Array.get(value, i)));
    }
    return items;
  }
}
