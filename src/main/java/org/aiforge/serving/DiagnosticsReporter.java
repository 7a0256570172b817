package org.aiforge.serving;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.aiforge.ModelLoadingException;
import org.aiforge.models.ManifestInvalidArgException;
import org.aiforge.models.ManifestInvalidFieldException;
import org.aiforge.models.ManifestValidationException;
import org.aiforge.utils.FileUtils;

/** Builds {@link LoadFailureReport LoadFailureReports} for fatal load failures */
public class DiagnosticsReporter {

  public LoadFailureReport report(
      ModelLoadingException failure, ResolutionTrace trace, Optional<Path> modelDirectory) {
    List<LoadFailureReport.FileEntry> contents = new ArrayList<>();
    String listingError = null;
    if (modelDirectory.isPresent()) {
      try {
        contents = listDirectory(modelDirectory.get());
      } catch (IOException e) {
        listingError = e.getMessage();
      }
    }

    String manifestField = null;
    String invalidValue = null;
    List<String> allowedValues = null;
    if (failure instanceof ManifestValidationException) {
      ManifestValidationException manifestFailure = (ManifestValidationException) failure;
      manifestField = manifestFailure.getField().orElse(null);
      allowedValues = manifestFailure.getAllowedValues();
      if (failure instanceof ManifestInvalidArgException) {
        invalidValue = ((ManifestInvalidArgException) failure).getToken();
      } else if (failure instanceof ManifestInvalidFieldException) {
        invalidValue = ((ManifestInvalidFieldException) failure).getValue();
      }
    }

    return new LoadFailureReport(
        failure.getClass().getSimpleName(),
        failure.getMessage(),
        trace.getEntries(),
        modelDirectory.map(Path::toString).orElse(null),
        contents,
        listingError,
        manifestField,
        invalidValue,
        allowedValues);
  }

  /**
   * Lists every file below a directory with its size, relative to the directory. A missing
   * directory has no contents
   */
  public List<LoadFailureReport.FileEntry> listDirectory(Path directory) throws IOException {
    List<LoadFailureReport.FileEntry> entries = new ArrayList<>();
    for (Path file : FileUtils.listFilesRecursively(directory)) {
      entries.add(
          new LoadFailureReport.FileEntry(
              directory.relativize(file).toString(), Files.size(file)));
    }
    return entries;
  }
}
