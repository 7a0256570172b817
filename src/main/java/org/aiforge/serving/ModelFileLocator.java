package org.aiforge.serving;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.aiforge.FrameworkAdapters;
import org.aiforge.utils.FileUtils;

/** Finds the main model file of a model directory when no manifest names it */
public class ModelFileLocator {
  /** Model file extensions, in search order */
  public static final List<String> MODEL_FILE_EXTENSIONS =
      Collections.unmodifiableList(
          Arrays.asList(".pkl", ".pt", ".pth", ".h5", ".onnx", ".joblib", ".keras"));

  /** Files whose names contain any of these are preprocessing artifacts, not models */
  static final List<String> AUXILIARY_NAME_MARKERS =
      Collections.unmodifiableList(
          Arrays.asList("label_encoder", "vectorizer", "scaler", "tokenizer", "encoder"));

  /**
   * A regular file is returned as is. For a directory: the directory itself if it is a SavedModel,
   * else `model.<ext>` directly inside it, else the first file found recursively, by extension
   * order, whose name does not mark it as an auxiliary artifact
   *
   * @throws IOException If the directory cannot be listed
   */
  public Optional<Path> locate(Path path) throws IOException {
    if (Files.isRegularFile(path)) {
      return Optional.of(path);
    }
    if (!Files.isDirectory(path)) {
      return Optional.empty();
    }
    if (Files.isRegularFile(path.resolve(FrameworkAdapters.SAVED_MODEL_MARKER))) {
      return Optional.of(path);
    }
    for (String extension : MODEL_FILE_EXTENSIONS) {
      Path conventional = path.resolve("model" + extension);
      if (Files.isRegularFile(conventional)) {
        return Optional.of(conventional);
      }
    }
    List<Path> files = FileUtils.listFilesRecursively(path);
    for (String extension : MODEL_FILE_EXTENSIONS) {
      for (Path file : files) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(extension) && !isAuxiliary(name)) {
          return Optional.of(file);
        }
      }
    }
    return Optional.empty();
  }

  static boolean isAuxiliary(String fileName) {
    for (String marker : AUXILIARY_NAME_MARKERS) {
      if (fileName.contains(marker)) {
        return true;
      }
    }
    return false;
  }
}
