package org.aiforge;

import java.util.List;

/**
 * Implemented by prediction outputs that know how to express themselves as nested lists. The
 * output normalizer prefers this conversion over every other
 */
public interface NestedListConvertible {
  List<?> toNestedList();
}
