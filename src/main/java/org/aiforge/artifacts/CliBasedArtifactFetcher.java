package org.aiforge.artifacts;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shells out to a copy command to download model bundles, e.g. `gsutil -m cp -r
 * gs://models/{id}/* {dest}`. The command template is split on whitespace; `{id}` and `{dest}` are
 * replaced by the bundle identifier and the local destination directory.
 *
 * <p>We require that the command is available in the system path.
 */
public class CliBasedArtifactFetcher implements ArtifactBundleFetcher {
  private static final Logger logger = LoggerFactory.getLogger(CliBasedArtifactFetcher.class);

  static final String IDENTIFIER_PLACEHOLDER = "{id}";
  static final String DESTINATION_PLACEHOLDER = "{dest}";

  private final String commandTemplate;
  private final Path cacheDirectory;

  public CliBasedArtifactFetcher(String commandTemplate, Path cacheDirectory) {
    this.commandTemplate = commandTemplate;
    this.cacheDirectory = cacheDirectory;
  }

  @Override
  public Path fetchArtifactBundle(String identifier) {
    Path destination = ArtifactBundleFetcher.destinationFor(cacheDirectory, identifier);
    try {
      Files.createDirectories(destination);
    } catch (IOException e) {
      throw new ArtifactFetchException(
          String.format("Failed to create the download directory %s", destination), e);
    }
    List<String> command = buildCommand(identifier, destination);
    String tag = String.format("fetch model bundle `%s`", identifier);
    String output = forkFetchProcess(command, tag);
    logger.debug(String.format("Output of `%s`: %s", String.join(" ", command), output));
    ArtifactBundleFetcher.requireNonEmpty(destination, identifier);
    logger.info(String.format("Fetched model bundle `%s` into %s", identifier, destination));
    return destination;
  }

  List<String> buildCommand(String identifier, Path destination) {
    List<String> command = new ArrayList<>();
    for (String token : commandTemplate.trim().split("\\s+")) {
      command.add(
          token
              .replace(IDENTIFIER_PLACEHOLDER, identifier)
              .replace(DESTINATION_PLACEHOLDER, destination.toString()));
    }
    return command;
  }

  /**
   * Forks the given command and awaits its successful completion
   *
   * @param command The command and its arguments
   * @param tag User-facing tag which will be used to identify what we were trying to do in the
   *     case of a failure.
   * @return The combined stdout and stderr of the process, decoded as a utf-8 string
   * @throws ArtifactFetchException if the process exits with a non-zero exit code, or anything
   *     else goes wrong.
   */
  private String forkFetchProcess(List<String> command, String tag) {
    String output;
    try {
      ProcessBuilder processBuilder = new ProcessBuilder(command);
      processBuilder.redirectErrorStream(true);
      Process process = processBuilder.start();
      output = IOUtils.toString(process.getInputStream(), StandardCharsets.UTF_8);
      int exitValue = process.waitFor();
      if (exitValue != 0) {
        throw new ArtifactFetchException(
            String.format("Failed to %s. Exit code %d. Output: %s", tag, exitValue, output));
      }
    } catch (IOException e) {
      throw new ArtifactFetchException(
          String.format("Failed to fork `%s` to %s", String.join(" ", command), tag), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ArtifactFetchException(String.format("Interrupted while trying to %s", tag), e);
    }
    return output;
  }
}
