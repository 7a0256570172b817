package org.aiforge.serving;

import com.fasterxml.jackson.annotation.JsonValue;

/** The load tiers, in priority order */
public enum LoadStrategy {
  MANIFEST("manifest"),
  CUSTOM_SCRIPT("custom_script"),
  AUTO_DETECT("auto_detect"),
  FRAMEWORK("framework");

  private final String value;

  LoadStrategy(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
