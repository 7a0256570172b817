package org.aiforge.models;

import java.util.Collections;

/** A required manifest field is absent or null */
public class ManifestMissingFieldException extends ManifestValidationException {
  public ManifestMissingFieldException(String field) {
    super(
        String.format(
            "%s is missing the required field `%s`", ModelConfig.MANIFEST_FILE_NAME, field),
        field,
        Collections.<String>emptyList());
  }
}
