package org.aiforge;

import java.util.ArrayList;
import java.util.List;

/** The model frameworks a gateway session can be bound to */
public enum Framework {
  PYTORCH("pytorch"),
  TENSORFLOW("tensorflow"),
  ONNX("onnx"),
  SKLEARN("sklearn"),
  CUSTOM("custom");

  private final String value;

  Framework(String value) {
    this.value = value;
  }

  /** @return The wire name of the framework, as used in manifests and status responses */
  public String getValue() {
    return value;
  }

  /**
   * @throws IllegalArgumentException If the specified name is not the wire name of any framework
   */
  public static Framework fromValue(String value) {
    for (Framework framework : values()) {
      if (framework.value.equals(value)) {
        return framework;
      }
    }
    throw new IllegalArgumentException(String.format("Unknown framework: `%s`", value));
  }

  /** @return The wire names of all frameworks, in declaration order */
  public static List<String> allValues() {
    List<String> names = new ArrayList<>();
    for (Framework framework : values()) {
      names.add(framework.value);
    }
    return names;
  }

  @Override
  public String toString() {
    return value;
  }
}
