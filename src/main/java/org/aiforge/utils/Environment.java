package org.aiforge.utils;

import java.util.Optional;

/**
 * Interface defining functions that should be implemented by an environment consisting of keys and
 * values
 */
public interface Environment {
  /** @return The raw value of the specified variable, if it is set */
  Optional<String> getValue(String varName);

  /** Attempt to parse the value of the specified environment variable as an integer */
  default int getIntegerValue(String varName, int defaultValue) {
    Optional<String> rawValue = getValue(varName);
    if (!rawValue.isPresent()) {
      return defaultValue;
    }
    try {
      return Integer.valueOf(rawValue.get().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format(
              "Environment variable %s must be an integer, found: `%s`", varName, rawValue.get()),
          e);
    }
  }

  /** Interprets `true`, `1` and `yes` (in any case) as true */
  default boolean getBooleanValue(String varName, boolean defaultValue) {
    Optional<String> rawValue = getValue(varName);
    if (!rawValue.isPresent()) {
      return defaultValue;
    }
    String value = rawValue.get().trim().toLowerCase();
    return value.equals("true") || value.equals("1") || value.equals("yes");
  }
}
