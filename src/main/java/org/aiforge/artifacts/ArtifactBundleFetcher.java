package org.aiforge.artifacts;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Fetches a model bundle from remote storage into a local directory. Bundle identifiers have the
 * form `owner/model`, and are fetched into `<cacheDirectory>/owner/model`
 */
public interface ArtifactBundleFetcher {
  /**
   * Fetches the bundle with the specified identifier
   *
   * @return The local directory holding the bundle's files
   * @throws ArtifactFetchException If the transfer fails or the directory is left empty
   */
  Path fetchArtifactBundle(String identifier);

  /**
   * Resolves the local destination of a bundle below the cache directory
   *
   * @throws ArtifactFetchException If the identifier is blank or escapes the cache directory
   */
  static Path destinationFor(Path cacheDirectory, String identifier) {
    if (identifier == null || identifier.trim().isEmpty()) {
      throw new ArtifactFetchException("A model identifier is required to fetch a model bundle");
    }
    Path root = cacheDirectory.toAbsolutePath().normalize();
    Path destination = root.resolve(identifier).normalize();
    if (!destination.startsWith(root) || destination.equals(root)) {
      throw new ArtifactFetchException(
          String.format("Invalid model identifier `%s`", identifier));
    }
    return destination;
  }

  /** @throws ArtifactFetchException If the directory is missing or holds no files */
  static void requireNonEmpty(Path directory, String identifier) {
    if (!Files.isDirectory(directory)) {
      throw new ArtifactFetchException(
          String.format("Fetching `%s` did not create %s", identifier, directory));
    }
    try (Stream<Path> files = Files.walk(directory)) {
      if (!files.anyMatch(Files::isRegularFile)) {
        throw new ArtifactFetchException(
            String.format("Fetching `%s` left %s empty", identifier, directory));
      }
    } catch (IOException e) {
      throw new ArtifactFetchException(
          String.format("Failed to inspect %s after fetching `%s`", directory, identifier), e);
    }
  }
}
