package org.aiforge;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.aiforge.djl.PyTorchAdapter;
import org.aiforge.djl.TensorFlowAdapter;
import org.aiforge.onnx.OnnxAdapter;
import org.aiforge.sklearn.SklearnAdapter;
import org.aiforge.utils.FileUtils;

/**
 * The registry of built-in {@link FrameworkAdapter FrameworkAdapters}, together with the suffix and
 * directory-marker table used to detect the framework of a model path
 */
public class FrameworkAdapters {
  /** A directory holding this file is a TensorFlow SavedModel */
  public static final String SAVED_MODEL_MARKER = "saved_model.pb";

  private static final Map<Framework, List<String>> SUFFIXES;

  static {
    Map<Framework, List<String>> suffixes = new LinkedHashMap<>();
    suffixes.put(Framework.PYTORCH, Arrays.asList(".pt", ".pth"));
    suffixes.put(Framework.TENSORFLOW, Arrays.asList(".h5", ".keras"));
    suffixes.put(Framework.ONNX, Collections.singletonList(".onnx"));
    suffixes.put(Framework.SKLEARN, Arrays.asList(".pkl", ".joblib"));
    SUFFIXES = Collections.unmodifiableMap(suffixes);
  }

  private final Map<Framework, FrameworkAdapter<?>> adapters;

  public FrameworkAdapters(List<FrameworkAdapter<?>> adapters) {
    this.adapters = new EnumMap<>(Framework.class);
    for (FrameworkAdapter<?> adapter : adapters) {
      this.adapters.put(adapter.getFramework(), adapter);
    }
  }

  /** @return A registry holding the sklearn, ONNX, PyTorch and TensorFlow adapters */
  public static FrameworkAdapters defaults() {
    return new FrameworkAdapters(
        Arrays.<FrameworkAdapter<?>>asList(
            new SklearnAdapter(),
            new OnnxAdapter(),
            new PyTorchAdapter(),
            new TensorFlowAdapter()));
  }

  /**
   * Detects the framework of a model file from its (case-insensitive) suffix, or of a model
   * directory from its marker file
   *
   * @throws FrameworkUndetectedException If no built-in framework recognizes the path
   */
  public static Framework detectFramework(Path modelPath) {
    if (Files.isDirectory(modelPath)) {
      if (Files.isRegularFile(modelPath.resolve(SAVED_MODEL_MARKER))) {
        return Framework.TENSORFLOW;
      }
      throw new FrameworkUndetectedException(
          modelPath,
          String.format(
              "the directory does not contain `%s` and directories are not otherwise loadable",
              SAVED_MODEL_MARKER));
    }
    String suffix = FileUtils.getSuffix(modelPath);
    for (Map.Entry<Framework, List<String>> entry : SUFFIXES.entrySet()) {
      if (entry.getValue().contains(suffix)) {
        return entry.getKey();
      }
    }
    throw new FrameworkUndetectedException(
        modelPath,
        String.format(
            "the suffix `%s` is not one of the recognized suffixes %s", suffix, allSuffixes()));
  }

  /** @return `true` if the path would be detected as the specified framework */
  static boolean matches(Framework framework, Path modelPath) {
    try {
      return detectFramework(modelPath) == framework;
    } catch (FrameworkUndetectedException e) {
      return false;
    }
  }

  /** @return The recognized model file suffixes, in detection order */
  public static List<String> allSuffixes() {
    List<String> all = new ArrayList<>();
    for (List<String> suffixes : SUFFIXES.values()) {
      all.addAll(suffixes);
    }
    return all;
  }

  /** @return The adapter registered for the framework, if any */
  public Optional<FrameworkAdapter<?>> forFramework(Framework framework) {
    return Optional.ofNullable(adapters.get(framework));
  }
}
