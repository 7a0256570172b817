package org.aiforge.artifacts;

/** A model bundle could not be fetched, or the fetch left no files behind */
public class ArtifactFetchException extends RuntimeException {
  public ArtifactFetchException(String message) {
    super(message);
  }

  public ArtifactFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
