package org.aiforge.utils;

import java.util.Optional;

/** Utilities for reading from / writing to the system enviroment */
public class SystemEnvironment implements Environment {
  private static final SystemEnvironment systemEnvironment = new SystemEnvironment();

  private SystemEnvironment() {}

  /** Obtains the system environment */
  public static SystemEnvironment get() {
    return systemEnvironment;
  }

  @Override
  public Optional<String> getValue(String varName) {
    String rawValue = System.getenv(varName);
    if (rawValue == null || rawValue.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(rawValue);
  }
}
