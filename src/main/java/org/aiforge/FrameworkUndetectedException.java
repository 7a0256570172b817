package org.aiforge;

import java.nio.file.Path;

/** Thrown when no built-in framework recognizes the suffix or layout of a model path */
public class FrameworkUndetectedException extends ModelLoadingException {
  private final Path path;

  public FrameworkUndetectedException(Path path, String detail) {
    super(String.format("Could not detect the framework of the model at `%s`: %s", path, detail));
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}
