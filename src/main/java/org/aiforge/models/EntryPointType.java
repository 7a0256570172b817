package org.aiforge.models;

/** Whether a manifest's entry point is a script of functions or a class to instantiate */
public enum EntryPointType {
  MODULE("module"),
  CLASS("class");

  private final String value;

  EntryPointType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
