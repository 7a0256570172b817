package org.aiforge.models;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** The closed vocabulary of argument tokens a manifest may use to describe a function's arguments */
public enum ArgumentToken {
  /** The model directory joined with the manifest's `model_file` */
  MODEL_PATH("model_path"),
  /** The model directory */
  MODEL_DIR("model_dir"),
  /** The raw prediction input */
  INPUT_DATA("input_data"),
  /** The handle returned by the load function */
  MODEL("model");

  private final String value;

  ArgumentToken(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public static Optional<ArgumentToken> fromValue(String value) {
    for (ArgumentToken token : values()) {
      if (token.value.equals(value)) {
        return Optional.of(token);
      }
    }
    return Optional.empty();
  }

  public static List<ArgumentToken> allTokens() {
    return Collections.unmodifiableList(Arrays.asList(values()));
  }

  static List<String> toValues(List<ArgumentToken> tokens) {
    List<String> names = new ArrayList<>();
    for (ArgumentToken token : tokens) {
      names.add(token.value);
    }
    return names;
  }
}
