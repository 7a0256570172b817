package org.aiforge.scripting;

import java.nio.file.Path;
import org.aiforge.ModelLoadingException;

/**
 * Thrown when an entry-point script cannot be turned into an {@link ExecutableUnit}: the file is
 * missing, fails to compile, references an unresolvable class, or throws while its top-level code
 * or constructor runs
 */
public class EntryPointBindException extends ModelLoadingException {
  private final Path path;

  public EntryPointBindException(Path path, Throwable cause) {
    super(
        String.format("Failed to bind the entry point `%s`: %s", path, describe(cause)), cause);
    this.path = path;
  }

  private static String describe(Throwable cause) {
    String message = cause.getMessage();
    return message == null ? cause.getClass().getName() : message;
  }

  public Path getPath() {
    return path;
  }
}
