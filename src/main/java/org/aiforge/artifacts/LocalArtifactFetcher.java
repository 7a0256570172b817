package org.aiforge.artifacts;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Copies model bundles from a locally mounted mirror of the model store */
public class LocalArtifactFetcher implements ArtifactBundleFetcher {
  private static final Logger logger = LoggerFactory.getLogger(LocalArtifactFetcher.class);

  private final Path mirrorRoot;
  private final Path cacheDirectory;

  /**
   * @param mirrorRoot The directory holding one subdirectory per bundle identifier
   * @param cacheDirectory The directory bundles are copied into
   */
  public LocalArtifactFetcher(Path mirrorRoot, Path cacheDirectory) {
    this.mirrorRoot = mirrorRoot;
    this.cacheDirectory = cacheDirectory;
  }

  @Override
  public Path fetchArtifactBundle(String identifier) {
    Path source = ArtifactBundleFetcher.destinationFor(mirrorRoot, identifier);
    Path destination = ArtifactBundleFetcher.destinationFor(cacheDirectory, identifier);
    if (!Files.isDirectory(source)) {
      throw new ArtifactFetchException(
          String.format("Model bundle `%s` does not exist in %s", identifier, mirrorRoot));
    }
    try {
      FileUtils.copyDirectory(source.toFile(), destination.toFile());
    } catch (IOException e) {
      throw new ArtifactFetchException(
          String.format("Failed to copy model bundle `%s` to %s", identifier, destination), e);
    }
    ArtifactBundleFetcher.requireNonEmpty(destination, identifier);
    logger.info(String.format("Fetched model bundle `%s` into %s", identifier, destination));
    return destination;
  }
}
