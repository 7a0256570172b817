package org.aiforge.serving;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.aiforge.Framework;
import org.aiforge.models.ModelConfig;
import org.aiforge.scripting.ExecutableUnit;

/** An immutable snapshot of a successfully loaded model, as installed in a {@link ModelSession} */
public class LoadedModel {
  private final Framework framework;
  private final ModelBinding binding;
  private final ModelConfig manifest;
  private final LoadStrategy strategy;
  private final ResolutionTrace trace;
  private final Path modelPath;
  private final String modelIdentifier;

  LoadedModel(
      Framework framework,
      ModelBinding binding,
      ModelConfig manifest,
      LoadStrategy strategy,
      ResolutionTrace trace,
      Path modelPath,
      String modelIdentifier) {
    if (framework == null || binding == null || binding.getHandle() == null) {
      throw new IllegalArgumentException("A loaded model requires a framework and a handle");
    }
    this.framework = framework;
    this.binding = binding;
    this.manifest = manifest;
    this.strategy = strategy;
    this.trace = trace;
    this.modelPath = modelPath;
    this.modelIdentifier = modelIdentifier;
  }

  public Framework getFramework() {
    return framework;
  }

  public ModelBinding getBinding() {
    return binding;
  }

  public Object getModelHandle() {
    return binding.getHandle();
  }

  public Optional<ExecutableUnit> getEntryPoint() {
    return binding.getEntryPoint();
  }

  /** @return The manifest, for models loaded by the manifest tier */
  public Optional<ModelConfig> getManifest() {
    return Optional.ofNullable(manifest);
  }

  public LoadStrategy getStrategy() {
    return strategy;
  }

  public List<ResolutionTrace.Entry> getResolutionTrace() {
    return trace.getEntries();
  }

  /** @return The model file or directory the model was loaded from */
  public Path getModelPath() {
    return modelPath;
  }

  public String getModelIdentifier() {
    return modelIdentifier;
  }
}
