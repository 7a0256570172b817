package org.aiforge.serving;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.aiforge.models.ArgumentToken;
import org.aiforge.models.ModelConfig;
import org.aiforge.scripting.ExecutableUnit;

/** Predicts exclusively through the manifest's declared predict function and argument tokens */
public class ManifestBinding extends ModelBinding {
  private final ModelConfig manifest;
  private final ExecutableUnit entryPoint;
  private final Object handle;
  private final Path modelDirectory;

  public ManifestBinding(
      ModelConfig manifest, ExecutableUnit entryPoint, Object handle, Path modelDirectory) {
    this.manifest = manifest;
    this.entryPoint = entryPoint;
    this.handle = handle;
    this.modelDirectory = modelDirectory;
  }

  /**
   * Maps argument tokens to values, in order: `input_data` is the raw input, `model` is the handle,
   * `model_path` and `model_dir` are the manifest's model file and directory. Load functions are
   * called with neither an input nor a handle, so those tokens map to null there
   */
  static Object[] buildArguments(
      List<ArgumentToken> tokens,
      ModelConfig manifest,
      Path modelDirectory,
      Object handle,
      Object input) {
    Object[] arguments = new Object[tokens.size()];
    for (int i = 0; i < tokens.size(); ++i) {
      switch (tokens.get(i)) {
        case MODEL_PATH:
          arguments[i] = manifest.resolveModelFile(modelDirectory).toString();
          break;
        case MODEL_DIR:
          arguments[i] = modelDirectory.toString();
          break;
        case INPUT_DATA:
          arguments[i] = input;
          break;
        case MODEL:
          arguments[i] = handle;
          break;
        default:
          throw new IllegalStateException(String.format("Unhandled token: %s", tokens.get(i)));
      }
    }
    return arguments;
  }

  @Override
  protected Object doPredict(Object input) throws PredictorEvaluationException {
    String function = manifest.getPredict().getName();
    Object[] arguments =
        buildArguments(manifest.getPredict().getArgs(), manifest, modelDirectory, handle, input);
    try {
      return entryPoint.invoke(function, arguments);
    } catch (Exception e) {
      throw new PredictInvocationException(function, e);
    }
  }

  @Override
  public Object getHandle() {
    return handle;
  }

  @Override
  public Optional<ExecutableUnit> getEntryPoint() {
    return Optional.of(entryPoint);
  }

  @Override
  public boolean isThreadSafe() {
    return false;
  }
}
