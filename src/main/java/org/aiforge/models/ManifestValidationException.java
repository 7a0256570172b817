package org.aiforge.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.aiforge.ModelLoadingException;

/**
 * Base class for failures to parse or validate a `model_config.json` manifest. Carries the
 * offending field and, where the field has a closed set of valid values, that set
 */
public class ManifestValidationException extends ModelLoadingException {
  private final String field;
  private final List<String> allowedValues;

  protected ManifestValidationException(String message, String field, List<String> allowedValues) {
    super(message);
    this.field = field;
    this.allowedValues = Collections.unmodifiableList(new ArrayList<>(allowedValues));
  }

  protected ManifestValidationException(String message, Throwable cause) {
    super(message, cause);
    this.field = null;
    this.allowedValues = Collections.emptyList();
  }

  /** @return The dotted name of the offending field, e.g. `load.name` */
  public Optional<String> getField() {
    return Optional.ofNullable(field);
  }

  public List<String> getAllowedValues() {
    return allowedValues;
  }
}
