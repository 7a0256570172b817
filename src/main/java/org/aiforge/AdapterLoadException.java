package org.aiforge;

import java.nio.file.Path;

/**
 * Thrown when a built-in framework adapter cannot deserialize a model file, including when the
 * framework's native runtime is unavailable
 */
public class AdapterLoadException extends ModelLoadingException {
  private final Framework framework;
  private final Path path;

  public AdapterLoadException(Framework framework, Path path, Throwable cause) {
    super(
        String.format(
            "The %s adapter failed to load the model at path `%s`: %s",
            framework.getValue(), path, cause.getMessage()),
        cause);
    this.framework = framework;
    this.path = path;
  }

  public Framework getFramework() {
    return framework;
  }

  public Path getPath() {
    return path;
  }
}
