package org.aiforge.serving;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.aiforge.FrameworkAdapters;
import org.aiforge.ModelLoadingException;
import org.aiforge.artifacts.ArtifactBundleFetcher;
import org.aiforge.artifacts.ArtifactFetchException;
import org.aiforge.scripting.GroovyEntryPointBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The entry point of the serving core. A gateway owns one {@link ModelSession}, loads models into
 * it and serves predictions from it. Neither loading nor predicting ever lets a failure escape
 * unreported: load failures are kept for {@link #debugInfo()}, and {@link #status()} is always
 * answerable
 */
public class ModelGateway {
  private static final Logger logger = LoggerFactory.getLogger(ModelGateway.class);

  private final ModelSession session;
  private final ModelResolver resolver;
  private final DiagnosticsReporter diagnosticsReporter;
  private final GatewayConfig config;
  private final ArtifactBundleFetcher artifactFetcher;
  private volatile Path observedModelDirectory;

  /**
   * @param artifactFetcher The fetcher used to download the configured bundle at startup, or null
   *     if bundles are never downloaded
   */
  public ModelGateway(
      ModelSession session,
      ModelResolver resolver,
      DiagnosticsReporter diagnosticsReporter,
      GatewayConfig config,
      ArtifactBundleFetcher artifactFetcher) {
    this.session = session;
    this.resolver = resolver;
    this.diagnosticsReporter = diagnosticsReporter;
    this.config = config;
    this.artifactFetcher = artifactFetcher;
    this.observedModelDirectory = config.getModelDirectory();
  }

  /** Creates a gateway with a fresh session, the Groovy binder and the built-in adapters */
  public static ModelGateway create(GatewayConfig config) {
    ModelResolver resolver =
        new ModelResolver(
            new GroovyEntryPointBinder(), FrameworkAdapters.defaults(), new ModelFileLocator());
    return new ModelGateway(
        new ModelSession(),
        resolver,
        new DiagnosticsReporter(),
        config,
        config.createArtifactFetcher().orElse(null));
  }

  public ModelSession getSession() {
    return session;
  }

  /**
   * Loads the model at the specified path, or at the configured model path. When neither is usable
   * and no manifest is named, the configured bundle is fetched, falling back to the configured
   * model directory. Never throws: failures are reported in the returned outcome
   *
   * @param path A model file or directory
   * @param manifestHint A manifest file to use instead of the model directory's own
   */
  public synchronized LoadOutcome loadOnStartup(Optional<Path> path, Optional<Path> manifestHint) {
    Optional<Path> modelPath = path.isPresent() ? path : config.getModelPath();
    if ((!modelPath.isPresent() || !Files.exists(modelPath.get()))
        && !manifestHint.isPresent()) {
      logger.info(
          String.format(
              "Model path not set or not found (%s), searching for a model directory",
              modelPath.map(Path::toString).orElse("unset")));
      modelPath = searchForModelDirectory();
    }

    LoadRequest.Builder request =
        LoadRequest.builder().setModelIdentifier(config.getModelId().orElse(null));
    modelPath.ifPresent(request::setModelPath);
    manifestHint.ifPresent(request::setManifestPath);
    config.getCustomInferencePath().ifPresent(request::setCustomScript);
    config.getFrameworkHint().ifPresent(request::setFrameworkHint);
    return load(request.build());
  }

  private Optional<Path> searchForModelDirectory() {
    Optional<String> modelId = config.getModelId();
    if (config.isDownloadModelOnStartup() && modelId.isPresent() && artifactFetcher != null) {
      try {
        return Optional.of(artifactFetcher.fetchArtifactBundle(modelId.get()));
      } catch (ArtifactFetchException e) {
        logger.warn(
            String.format(
                "Failed to fetch model bundle `%s`, continuing with the local model directory",
                modelId.get()),
            e);
      }
    }
    Path modelDirectory = config.getModelDirectory();
    if (!Files.isDirectory(modelDirectory)) {
      logger.warn(String.format("Model directory %s does not exist", modelDirectory));
      return Optional.empty();
    }
    try {
      List<LoadFailureReport.FileEntry> files = diagnosticsReporter.listDirectory(modelDirectory);
      logger.info(String.format("Found %d files in %s", files.size(), modelDirectory));
      for (LoadFailureReport.FileEntry file : files) {
        logger.info(String.format("  %s (%d bytes)", file.getPath(), file.getSize()));
      }
    } catch (IOException e) {
      logger.error(String.format("Error listing %s", modelDirectory), e);
    }
    return Optional.of(modelDirectory);
  }

  /**
   * Resolves and installs a model. On failure, the previously installed model (if any) remains
   * authoritative and the failure report is retained by the session
   */
  public synchronized LoadOutcome load(LoadRequest request) {
    ResolutionTrace trace = new ResolutionTrace();
    Optional<Path> modelDirectory = request.resolveModelDirectory();
    modelDirectory.ifPresent(directory -> observedModelDirectory = directory);
    try {
      LoadedModel model = resolver.resolve(request, trace);
      trace.freeze();
      session.install(model);
      logger.info(
          String.format(
              "Model `%s` loaded successfully. Framework: %s, strategy: %s, handle type: %s",
              model.getModelIdentifier(),
              model.getFramework(),
              model.getStrategy(),
              model.getModelHandle().getClass().getName()));
      return LoadOutcome.loaded(model);
    } catch (ModelLoadingException e) {
      return recordFailure(e, trace, modelDirectory);
    } catch (VirtualMachineError e) {
      throw e;
    } catch (RuntimeException | Error e) {
      return recordFailure(
          new ModelLoadingException(
              String.format("An unexpected error occurred while loading the model: %s", e), e),
          trace,
          modelDirectory);
    }
  }

  private LoadOutcome recordFailure(
      ModelLoadingException failure, ResolutionTrace trace, Optional<Path> modelDirectory) {
    trace.freeze();
    LoadFailureReport report = diagnosticsReporter.report(failure, trace, modelDirectory);
    session.recordFailure(report);
    logger.error(report.render(), failure);
    if (session.isLoaded()) {
      logger.warn("Keeping the previously loaded model");
    } else {
      logger.warn("The gateway will serve without a loaded model");
    }
    return LoadOutcome.failed(report);
  }

  /**
   * Runs a prediction against the loaded model and normalizes its output
   *
   * @throws ModelNotReadyException If no model is loaded
   * @throws PredictorEvaluationException If the prediction fails
   */
  public PredictionResult predict(Object input) throws PredictorEvaluationException {
    Optional<LoadedModel> loaded = session.getLoadedModel();
    if (!loaded.isPresent()) {
      throw new ModelNotReadyException(
          "Model not loaded yet. Please wait for initialization or check /debug.");
    }
    LoadedModel model = loaded.get();
    long startTime = System.nanoTime();
    Object rawPrediction = model.getBinding().predict(input);
    Object prediction = OutputNormalizer.normalize(rawPrediction);
    double inferenceTimeMillis = Math.round((System.nanoTime() - startTime) / 10_000.0) / 100.0;
    return new PredictionResult(
        prediction, model.getModelIdentifier(), model.getFramework(), inferenceTimeMillis);
  }

  public ModelStatus status() {
    Optional<LoadedModel> loaded = session.getLoadedModel();
    if (!loaded.isPresent()) {
      return new ModelStatus(false, null, null);
    }
    return new ModelStatus(
        true, loaded.get().getFramework(), loaded.get().getModelIdentifier());
  }

  /**
   * @return The session state, the last load failure and the files in the observed model
   *     directory, as a JSON-compatible map
   */
  public Map<String, Object> debugInfo() {
    Map<String, Object> info = new LinkedHashMap<>();
    Optional<LoadedModel> loaded = session.getLoadedModel();
    info.put("model_loaded", loaded.isPresent());
    info.put("model_id", loaded.map(LoadedModel::getModelIdentifier).orElse(null));
    info.put("framework", loaded.map(model -> model.getFramework().getValue()).orElse(null));
    info.put("load_strategy", loaded.map(model -> model.getStrategy().getValue()).orElse(null));
    info.put("model_path", loaded.map(model -> model.getModelPath().toString()).orElse(null));
    info.put(
        "resolution_trace",
        loaded.isPresent() ? loaded.get().getResolutionTrace() : null);
    info.put("last_failure", session.getLastFailure().orElse(null));

    Path directory = observedModelDirectory;
    info.put("model_directory", directory.toString());
    info.put("model_directory_exists", Files.isDirectory(directory));
    try {
      List<LoadFailureReport.FileEntry> files = diagnosticsReporter.listDirectory(directory);
      info.put("files", files);
    } catch (IOException e) {
      info.put("file_listing_error", e.getMessage());
    }
    return info;
  }
}
