package org.aiforge.models;

import java.util.List;

/** A manifest function declares an argument token outside the permitted vocabulary */
public class ManifestInvalidArgException extends ManifestValidationException {
  private final String token;

  public ManifestInvalidArgException(String field, String token, List<String> allowedTokens) {
    super(
        String.format(
            "Invalid argument `%s` in `%s`. Must be one of: %s",
            token, field, String.join(", ", allowedTokens)),
        field,
        allowedTokens);
    this.token = token;
  }

  public String getToken() {
    return token;
  }
}
