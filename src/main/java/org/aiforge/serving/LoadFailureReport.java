package org.aiforge.serving;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Everything an operator needs to debug a failed deployment: the error, every resolution step, the
 * files that were actually present and, for manifest failures, the offending field and its valid
 * values
 */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoadFailureReport {

  /** A file observed in the model directory */
  @JsonAutoDetect(
      fieldVisibility = JsonAutoDetect.Visibility.ANY,
      getterVisibility = JsonAutoDetect.Visibility.NONE,
      isGetterVisibility = JsonAutoDetect.Visibility.NONE)
  public static class FileEntry {
    @JsonProperty("path")
    private final String path;

    @JsonProperty("size")
    private final long size;

    public FileEntry(String path, long size) {
      this.path = path;
      this.size = size;
    }

    /** @return The path relative to the model directory */
    public String getPath() {
      return path;
    }

    public long getSize() {
      return size;
    }
  }

  @JsonProperty("error_type")
  private final String errorType;

  @JsonProperty("message")
  private final String message;

  @JsonProperty("resolution_trace")
  private final List<ResolutionTrace.Entry> trace;

  @JsonProperty("model_directory")
  private final String modelDirectory;

  @JsonProperty("directory_contents")
  private final List<FileEntry> directoryContents;

  @JsonProperty("directory_listing_error")
  private final String directoryListingError;

  @JsonProperty("manifest_field")
  private final String manifestField;

  @JsonProperty("invalid_value")
  private final String invalidValue;

  @JsonProperty("allowed_values")
  private final List<String> allowedValues;

  LoadFailureReport(
      String errorType,
      String message,
      List<ResolutionTrace.Entry> trace,
      String modelDirectory,
      List<FileEntry> directoryContents,
      String directoryListingError,
      String manifestField,
      String invalidValue,
      List<String> allowedValues) {
    this.errorType = errorType;
    this.message = message;
    this.trace = Collections.unmodifiableList(new ArrayList<>(trace));
    this.modelDirectory = modelDirectory;
    this.directoryContents = Collections.unmodifiableList(new ArrayList<>(directoryContents));
    this.directoryListingError = directoryListingError;
    this.manifestField = manifestField;
    this.invalidValue = invalidValue;
    this.allowedValues = allowedValues;
  }

  /** @return The simple class name of the fatal exception */
  public String getErrorType() {
    return errorType;
  }

  public String getMessage() {
    return message;
  }

  public List<ResolutionTrace.Entry> getTrace() {
    return trace;
  }

  public Optional<String> getModelDirectory() {
    return Optional.ofNullable(modelDirectory);
  }

  public List<FileEntry> getDirectoryContents() {
    return directoryContents;
  }

  public Optional<String> getDirectoryListingError() {
    return Optional.ofNullable(directoryListingError);
  }

  /** @return The dotted name of the offending manifest field, for manifest failures */
  public Optional<String> getManifestField() {
    return Optional.ofNullable(manifestField);
  }

  /** @return The rejected value or argument token, for manifest failures */
  public Optional<String> getInvalidValue() {
    return Optional.ofNullable(invalidValue);
  }

  public List<String> getAllowedValues() {
    return allowedValues == null ? Collections.<String>emptyList() : allowedValues;
  }

  /** Renders the report as a multi-line block for logs */
  public String render() {
    StringBuilder builder = new StringBuilder();
    builder.append(String.format("Model loading failed with %s: %s%n", errorType, message));
    if (manifestField != null) {
      builder.append(String.format("  Manifest field: %s%n", manifestField));
    }
    if (invalidValue != null) {
      builder.append(String.format("  Invalid value: %s%n", invalidValue));
    }
    if (allowedValues != null && !allowedValues.isEmpty()) {
      builder.append(String.format("  Valid values: %s%n", String.join(", ", allowedValues)));
    }
    builder.append("  Resolution trace:").append(System.lineSeparator());
    for (ResolutionTrace.Entry entry : trace) {
      builder.append("    ").append(entry).append(System.lineSeparator());
    }
    builder.append(
        String.format(
            "  Contents of %s:%n", modelDirectory == null ? "(no model directory)" :
                modelDirectory));
    if (directoryListingError != null) {
      builder.append(String.format("    (listing failed: %s)%n", directoryListingError));
    }
    for (FileEntry file : directoryContents) {
      builder.append(String.format("    %s (%d bytes)%n", file.getPath(), file.getSize()));
    }
    return builder.toString();
  }
}
