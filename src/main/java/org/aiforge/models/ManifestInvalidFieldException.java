package org.aiforge.models;

import java.util.List;

/** A manifest field has the wrong type or a value outside its permitted set */
public class ManifestInvalidFieldException extends ManifestValidationException {
  private final String value;

  public ManifestInvalidFieldException(String field, String value, List<String> allowedValues) {
    super(
        String.format(
            "Invalid value `%s` for field `%s`. Expected: %s",
            value, field, String.join(", ", allowedValues)),
        field,
        allowedValues);
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
