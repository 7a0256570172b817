package org.aiforge.serving;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.aiforge.ModelLoadingException;
import org.aiforge.models.ManifestInvalidArgException;
import org.aiforge.models.ModelConfigValidator;
import org.aiforge.utils.SerializationUtils;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class DiagnosticsReporterTest {
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private final DiagnosticsReporter reporter = new DiagnosticsReporter();

  private static ManifestInvalidArgException invalidArgFailure() {
    try {
      new ModelConfigValidator()
          .validate(
              "{\"entry_point\": \"inference.groovy\", \"load\": {\"name\": \"load\"},"
                  + " \"predict\": {\"name\": \"predict\", \"args\": [\"features\"]},"
                  + " \"model_file\": \"model.pkl\"}");
    } catch (ManifestInvalidArgException e) {
      return e;
    }
    throw new AssertionError("Expected the manifest to be rejected");
  }

  @Test
  public void testManifestFailureReportNamesTheFieldAndTheValidValues() throws Exception {
    Path directory = temporaryFolder.newFolder("bundle").toPath();
    Files.write(directory.resolve("model_config.json"), new byte[12]);
    Files.createDirectories(directory.resolve("assets"));
    Files.write(directory.resolve("assets/vocab.txt"), new byte[5]);
    ResolutionTrace trace = new ResolutionTrace();
    trace.failed(LoadStrategy.MANIFEST, "validate", "invalid argument");
    trace.freeze();

    LoadFailureReport report = reporter.report(invalidArgFailure(), trace, Optional.of(directory));

    Assert.assertEquals("ManifestInvalidArgException", report.getErrorType());
    Assert.assertEquals("predict.args", report.getManifestField().get());
    Assert.assertEquals("features", report.getInvalidValue().get());
    Assert.assertEquals(
        Arrays.asList("model_path", "model_dir", "input_data", "model"),
        report.getAllowedValues());
    Assert.assertEquals(1, report.getTrace().size());

    List<LoadFailureReport.FileEntry> contents = report.getDirectoryContents();
    Assert.assertEquals(2, contents.size());
    Assert.assertEquals(directory.relativize(directory.resolve("assets/vocab.txt")).toString(),
        contents.get(0).getPath());
    Assert.assertEquals(5, contents.get(0).getSize());
    Assert.assertEquals(12, contents.get(1).getSize());

    String rendered = report.render();
    Assert.assertTrue(rendered.contains("Manifest field: predict.args"));
    Assert.assertTrue(rendered.contains("Invalid value: features"));
    Assert.assertTrue(rendered.contains("model_config.json (12 bytes)"));
  }

  @Test
  public void testReportSerializesWithoutAbsentFields() throws Exception {
    ResolutionTrace trace = new ResolutionTrace();
    trace.skipped(LoadStrategy.MANIFEST, "model_config.json", "no manifest");
    LoadFailureReport report =
        reporter.report(
            new ModelLoadingException("No model path or model directory was provided"),
            trace,
            Optional.<Path>empty());

    String json = SerializationUtils.toJson(report);
    Assert.assertTrue(json.contains("\"error_type\":\"ModelLoadingException\""));
    Assert.assertTrue(json.contains("\"resolution_trace\""));
    Assert.assertFalse(json.contains("manifest_field"));
    Assert.assertFalse(json.contains("model_directory\""));
    Assert.assertFalse(report.getModelDirectory().isPresent());
    Assert.assertTrue(report.getDirectoryContents().isEmpty());
    Assert.assertTrue(report.render().contains("(no model directory)"));
  }

  @Test
  public void testMissingDirectoryHasNoContents() throws Exception {
    Path missing = temporaryFolder.getRoot().toPath().resolve("missing");
    Assert.assertTrue(reporter.listDirectory(missing).isEmpty());
    LoadFailureReport report =
        reporter.report(
            new ModelLoadingException("failed"), new ResolutionTrace(), Optional.of(missing));
    Assert.assertEquals(missing.toString(), report.getModelDirectory().get());
    Assert.assertFalse(report.getDirectoryListingError().isPresent());
  }
}
