package org.aiforge.artifacts;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class CliBasedArtifactFetcherTest {
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Test
  public void testPlaceholdersAreSubstitutedInEveryToken() {
    CliBasedArtifactFetcher fetcher =
        new CliBasedArtifactFetcher(
            "  gsutil -m cp -r gs://models/{id}/*   {dest} ",
            temporaryFolder.getRoot().toPath());
    Path destination = temporaryFolder.getRoot().toPath().resolve("acme/iris");
    Assert.assertEquals(
        Arrays.asList(
            "gsutil", "-m", "cp", "-r", "gs://models/acme/iris/*", destination.toString()),
        fetcher.buildCommand("acme/iris", destination));
  }

  @Test
  public void testCopyCommandPopulatesTheDestination() throws Exception {
    Path remote = temporaryFolder.newFolder("remote").toPath();
    Files.createDirectories(remote.resolve("acme/iris"));
    Files.write(remote.resolve("acme/iris/model.pkl"), new byte[] {1});
    Path cache = temporaryFolder.getRoot().toPath().resolve("cache");
    CliBasedArtifactFetcher fetcher =
        new CliBasedArtifactFetcher(String.format("cp -r %s/{id}/. {dest}", remote), cache);

    Path fetched = fetcher.fetchArtifactBundle("acme/iris");

    Assert.assertEquals(cache.resolve("acme/iris"), fetched);
    Assert.assertTrue(Files.isRegularFile(fetched.resolve("model.pkl")));
  }

  @Test
  public void testFailingCommandIsReportedWithItsExitCode() {
    CliBasedArtifactFetcher fetcher =
        new CliBasedArtifactFetcher("false {id}", temporaryFolder.getRoot().toPath());
    try {
      fetcher.fetchArtifactBundle("acme/iris");
      Assert.fail("Expected a failing command to fail the fetch");
    } catch (ArtifactFetchException e) {
      Assert.assertTrue(e.getMessage().contains("Exit code 1"));
    }
  }

  @Test
  public void testCommandLeavingNoFilesIsReported() {
    CliBasedArtifactFetcher fetcher =
        new CliBasedArtifactFetcher("true", temporaryFolder.getRoot().toPath());
    try {
      fetcher.fetchArtifactBundle("acme/iris");
      Assert.fail("Expected an empty download to fail the fetch");
    } catch (ArtifactFetchException e) {
      Assert.assertTrue(e.getMessage().contains("empty"));
    }
  }

  @Test
  public void testMissingExecutableIsReported() {
    CliBasedArtifactFetcher fetcher =
        new CliBasedArtifactFetcher(
            "no-such-fetch-command-aiforge {id} {dest}", temporaryFolder.getRoot().toPath());
    try {
      fetcher.fetchArtifactBundle("acme/iris");
      Assert.fail("Expected a missing executable to fail the fetch");
    } catch (ArtifactFetchException e) {
      Assert.assertTrue(e.getCause() instanceof java.io.IOException);
    }
  }
}
