package org.aiforge.sklearn;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Assert;
import org.junit.Test;

public class TextAwareInputCoercionTest {
  @Test
  public void testStringBecomesASingleElementList() {
    Assert.assertEquals(
        Collections.singletonList("great movie"), TextAwareInputCoercion.coerce("great movie"));
  }

  @Test
  public void testListOfStringsPassesThrough() {
    List<String> texts = Arrays.asList("a", "b");
    Assert.assertSame(texts, TextAwareInputCoercion.coerce(texts));
  }

  @Test
  public void testListOfTextRowsIsFlattenedToFirstElements() {
    Object coerced =
        TextAwareInputCoercion.coerce(
            Arrays.asList(Arrays.asList("first", "ignored"), Collections.singletonList("second")));
    Assert.assertEquals(Arrays.asList("first", "second"), coerced);
  }

  @Test
  public void testNumericRowsBecomeAMatrix() {
    Object coerced =
        TextAwareInputCoercion.coerce(
            Arrays.asList(Arrays.asList(5.1, 3.5), Arrays.asList(6.2, 2.9)));
    Assert.assertTrue(coerced instanceof double[][]);
    double[][] matrix = (double[][]) coerced;
    Assert.assertEquals(2, matrix.length);
    Assert.assertArrayEquals(new double[] {6.2, 2.9}, matrix[1], 0.0);
  }

  @Test
  public void testFlatNumericListBecomesASingleRow() {
    double[][] matrix = (double[][]) TextAwareInputCoercion.coerce(Arrays.asList(1, 2, 3));
    Assert.assertEquals(1, matrix.length);
    Assert.assertEquals(3, matrix[0].length);
  }

  @Test
  public void testMatrixPassesThrough() {
    double[][] matrix = new double[][] {{1.0}};
    Assert.assertSame(matrix, TextAwareInputCoercion.coerce(matrix));
  }

  @Test
  public void testNonNumericNonTextInputIsRejected() {
    try {
      TextAwareInputCoercion.coerce(Arrays.asList(Collections.singletonMap("a", 1)));
      Assert.fail("Expected a list of maps to be rejected");
    } catch (IllegalArgumentException e) {
      // Success
    }
  }
}
