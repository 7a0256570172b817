package org.aiforge.models;

/** The manifest is not a well-formed JSON document */
public class ManifestSyntaxException extends ManifestValidationException {
  private final int line;
  private final int column;

  public ManifestSyntaxException(String detail, int line, int column, Throwable cause) {
    super(
        String.format(
            "Invalid JSON in %s at line %d, column %d: %s",
            ModelConfig.MANIFEST_FILE_NAME, line, column, detail),
        cause);
    this.line = line;
    this.column = column;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }
}
