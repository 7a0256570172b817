package org.aiforge;

/**
 * Implemented by prediction outputs that can be materialized as a (possibly multidimensional) Java
 * array. The output normalizer turns the array into nested lists
 */
public interface ArrayConvertible {
  Object toArray();
}
