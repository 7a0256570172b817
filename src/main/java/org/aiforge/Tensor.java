package org.aiforge;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A dense, rectangular numeric array stored in row-major order. Tensors are the common currency
 * between JSON prediction inputs and the built-in numeric framework adapters
 */
public class Tensor implements NestedListConvertible {
  private final long[] shape;
  private final double[] data;

  /**
   * @param shape The extent of each dimension. An empty shape denotes a scalar
   * @param data The elements in row-major order; its length must equal the product of the shape
   */
  public Tensor(long[] shape, double[] data) {
    if (elementCount(shape) != data.length) {
      throw new IllegalArgumentException(
          String.format(
              "Tensor shape %s requires %d elements, but %d were provided",
              Arrays.toString(shape), elementCount(shape), data.length));
    }
    this.shape = shape.clone();
    this.data = data;
  }

  /**
   * Creates a tensor from single-precision elements, keeping their shortest decimal representation
   * so that outputs such as `0.1f` are not rendered as `0.10000000149011612`
   */
  public static Tensor ofFloats(long[] shape, float[] values) {
    double[] data = new double[values.length];
    for (int i = 0; i < values.length; ++i) {
      data[i] = Double.parseDouble(Float.toString(values[i]));
    }
    return new Tensor(shape, data);
  }

  /**
   * Converts nested {@link List Lists} of numbers, or Java arrays of numbers of any rank, to a
   * tensor. A {@link Tensor} is returned as is
   *
   * @throws IllegalArgumentException If the value is ragged or contains non-numeric elements
   */
  public static Tensor fromNested(Object value) {
    if (value instanceof Tensor) {
      return (Tensor) value;
    }
    if (value == null) {
      throw new IllegalArgumentException("Cannot convert a null value to a numeric tensor");
    }
    List<Long> dims = new ArrayList<>();
    Object current = value;
    while (!(current instanceof Number)) {
      int length = lengthOf(current);
      dims.add((long) length);
      if (length == 0) {
        break;
      }
      current = elementAt(current, 0);
    }
    long[] shape = new long[dims.size()];
    for (int i = 0; i < shape.length; ++i) {
      shape[i] = dims.get(i);
    }
    double[] data = new double[(int) elementCount(shape)];
    int[] cursor = new int[] {0};
    flatten(value, 0, shape, data, cursor);
    return new Tensor(shape, data);
  }

  private static void flatten(Object value, int depth, long[] shape, double[] data, int[] cursor) {
    if (depth == shape.length) {
      if (!(value instanceof Number)) {
        throw new IllegalArgumentException(
            String.format(
                "Expected a numeric element at depth %d, but found: %s", depth, describe(value)));
      }
      data[cursor[0]++] = ((Number) value).doubleValue();
      return;
    }
    int length = lengthOf(value);
    if (length != shape[depth]) {
      throw new IllegalArgumentException(
          String.format(
              "Ragged input: expected %d elements at depth %d, but found %d",
              shape[depth], depth, length));
    }
    for (int i = 0; i < length; ++i) {
      flatten(elementAt(value, i), depth + 1, shape, data, cursor);
    }
  }

  private static int lengthOf(Object value) {
    if (value instanceof List) {
      return ((List<?>) value).size();
    }
    if (value != null && value.getClass().isArray()) {
      return Array.getLength(value);
    }
    throw new IllegalArgumentException(
        String.format("Expected a list, an array or a number, but found: %s", describe(value)));
  }

  private static Object elementAt(Object value, int index) {
    if (value instanceof List) {
      return ((List<?>) value).get(index);
    }
    return Array.get(value, index);
  }

  private static String describe(Object value) {
    return value == null ? "null" : value.getClass().getName();
  }

  private static long elementCount(long[] shape) {
    long count = 1;
    for (long dim : shape) {
      count *= dim;
    }
    return count;
  }

  /** @return A copy of the tensor's shape */
  public long[] getShape() {
    return shape.clone();
  }

  public int getRank() {
    return shape.length;
  }

  /** @return A copy of the elements, narrowed to single precision */
  public float[] toFloatArray() {
    float[] values = new float[data.length];
    for (int i = 0; i < data.length; ++i) {
      values[i] = (float) data[i];
    }
    return values;
  }

  /**
   * Views a rank-1 or rank-2 tensor as a matrix of rows. A rank-1 tensor becomes a single row
   *
   * @throws IllegalArgumentException If the tensor has any other rank
   */
  public double[][] toMatrix() {
    if (shape.length == 1) {
      return new double[][] {data.clone()};
    }
    if (shape.length != 2) {
      throw new IllegalArgumentException(
          String.format(
              "Expected a one or two dimensional input, but found shape %s",
              Arrays.toString(shape)));
    }
    int rows = (int) shape[0];
    int columns = (int) shape[1];
    double[][] matrix = new double[rows][];
    for (int row = 0; row < rows; ++row) {
      matrix[row] = Arrays.copyOfRange(data, row * columns, (row + 1) * columns);
    }
    return matrix;
  }

  @Override
  public List<?> toNestedList() {
    if (shape.length == 0) {
      List<Object> scalar = new ArrayList<>();
      scalar.add(data[0]);
      return scalar;
    }
    int[] cursor = new int[] {0};
    return (List<?>) buildNested(0, cursor);
  }

  private Object buildNested(int depth, int[] cursor) {
    if (depth == shape.length) {
      return data[cursor[0]++];
    }
    List<Object> level = new ArrayList<>();
    for (long i = 0; i < shape[depth]; ++i) {
      level.add(buildNested(depth + 1, cursor));
    }
    return level;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Tensor)) {
      return false;
    }
    Tensor tensor = (Tensor) other;
    return Arrays.equals(shape, tensor.shape) && Arrays.equals(data, tensor.data);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return String.format("Tensor(shape=%s)", Arrays.toString(shape));
  }
}
