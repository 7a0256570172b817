package org.aiforge.serving;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.aiforge.Framework;

/** The inputs of one model resolution. Instances are created with {@link #builder()} */
public class LoadRequest {
  private final Path modelPath;
  private final Path modelDirectory;
  private final Path customScript;
  private final Path manifestPath;
  private final Framework frameworkHint;
  private final String modelIdentifier;

  private LoadRequest(Builder builder) {
    this.modelPath = builder.modelPath;
    this.modelDirectory = builder.modelDirectory;
    this.customScript = builder.customScript;
    this.manifestPath = builder.manifestPath;
    this.frameworkHint = builder.frameworkHint;
    this.modelIdentifier = builder.modelIdentifier;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** @return The model file or directory to load, if one was given */
  public Optional<Path> getModelPath() {
    return Optional.ofNullable(modelPath);
  }

  public Optional<Path> getModelDirectory() {
    return Optional.ofNullable(modelDirectory);
  }

  /** @return An inference script named explicitly by the caller, outside of any manifest */
  public Optional<Path> getCustomScript() {
    return Optional.ofNullable(customScript);
  }

  /** @return A manifest file named explicitly by the caller */
  public Optional<Path> getManifestPath() {
    return Optional.ofNullable(manifestPath);
  }

  /** @return A framework to use instead of suffix detection for built-in loading */
  public Optional<Framework> getFrameworkHint() {
    return Optional.ofNullable(frameworkHint);
  }

  public Optional<String> getModelIdentifier() {
    return Optional.ofNullable(modelIdentifier);
  }

  /**
   * The directory the model lives in: the explicit model directory, else the model path if it is
   * a directory, else the model path's parent, else the manifest's parent, else the custom
   * script's parent
   */
  public Optional<Path> resolveModelDirectory() {
    if (modelDirectory != null) {
      return Optional.of(modelDirectory);
    }
    if (modelPath != null) {
      if (Files.isDirectory(modelPath)) {
        return Optional.of(modelPath);
      }
      return Optional.ofNullable(modelPath.toAbsolutePath().getParent());
    }
    if (manifestPath != null) {
      return Optional.ofNullable(manifestPath.toAbsolutePath().getParent());
    }
    if (customScript != null) {
      return Optional.ofNullable(customScript.toAbsolutePath().getParent());
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return String.format(
        "LoadRequest(modelPath=%s, modelDirectory=%s, customScript=%s, manifestPath=%s,"
            + " frameworkHint=%s)",
        modelPath, modelDirectory, customScript, manifestPath, frameworkHint);
  }

  public static class Builder {
    private Path modelPath;
    private Path modelDirectory;
    private Path customScript;
    private Path manifestPath;
    private Framework frameworkHint;
    private String modelIdentifier;

    public Builder setModelPath(Path modelPath) {
      this.modelPath = modelPath;
      return this;
    }

    public Builder setModelDirectory(Path modelDirectory) {
      this.modelDirectory = modelDirectory;
      return this;
    }

    public Builder setCustomScript(Path customScript) {
      this.customScript = customScript;
      return this;
    }

    public Builder setManifestPath(Path manifestPath) {
      this.manifestPath = manifestPath;
      return this;
    }

    public Builder setFrameworkHint(Framework frameworkHint) {
      this.frameworkHint = frameworkHint;
      return this;
    }

    public Builder setModelIdentifier(String modelIdentifier) {
      this.modelIdentifier = modelIdentifier;
      return this;
    }

    public LoadRequest build() {
      return new LoadRequest(this);
    }
  }
}
