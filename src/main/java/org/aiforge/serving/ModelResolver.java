package org.aiforge.serving;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.aiforge.Framework;
import org.aiforge.FrameworkAdapter;
import org.aiforge.FrameworkAdapters;
import org.aiforge.FrameworkUndetectedException;
import org.aiforge.ModelLoadingException;
import org.aiforge.models.EntryPointType;
import org.aiforge.models.FunctionConfig;
import org.aiforge.models.ModelConfig;
import org.aiforge.models.ModelConfigValidator;
import org.aiforge.scripting.EntryPointBindException;
import org.aiforge.scripting.EntryPointBinder;
import org.aiforge.scripting.ExecutableUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a {@link LoadRequest} to a {@link LoadedModel} by trying the load tiers in strict
 * priority order: the manifest, an explicit custom script, an auto-detected script, and finally
 * the built-in framework adapters. The first tier that succeeds wins
 *
 * <p>A manifest's presence is a declaration of full ownership of loading, so every manifest
 * failure is fatal. Script tier failures are recorded and fall through. A failure of the built-in
 * adapters ends the resolution with a {@link NoLoadStrategySucceededException}
 */
public class ModelResolver {
  private static final Logger logger = LoggerFactory.getLogger(ModelResolver.class);

  /** Load function names tried on scripts without a manifest, in preference order */
  public static final List<String> LOAD_CANDIDATES =
      Collections.unmodifiableList(
          Arrays.asList("load_model", "load", "initialize", "init", "setup"));

  /** Script names looked for in the model directory, in preference order */
  public static final List<String> CONVENTIONAL_SCRIPTS =
      Collections.unmodifiableList(
          Arrays.asList(
              "inference.groovy",
              "predict.groovy",
              "model.groovy",
              "handler.groovy",
              "main.groovy"));

  private final EntryPointBinder binder;
  private final FrameworkAdapters adapters;
  private final ModelFileLocator modelFileLocator;
  private final ModelConfigValidator validator = new ModelConfigValidator();

  public ModelResolver(
      EntryPointBinder binder, FrameworkAdapters adapters, ModelFileLocator modelFileLocator) {
    this.binder = binder;
    this.adapters = adapters;
    this.modelFileLocator = modelFileLocator;
  }

  /**
   * Resolves and loads a model, recording every step in the trace
   *
   * @throws ModelLoadingException For a manifest failure, or a {@link
   *     NoLoadStrategySucceededException} when no tier succeeds
   */
  public LoadedModel resolve(LoadRequest request, ResolutionTrace trace) {
    Optional<Path> modelDirectory = request.resolveModelDirectory();
    logger.info(
        String.format("Resolving model for %s in directory %s", request, modelDirectory));

    Optional<Path> manifestPath = findManifest(request, modelDirectory);
    if (manifestPath.isPresent()) {
      return loadFromManifest(manifestPath.get(), modelDirectory, request, trace);
    }
    trace.skipped(
        LoadStrategy.MANIFEST,
        ModelConfig.MANIFEST_FILE_NAME,
        String.format("no manifest found in %s", describe(modelDirectory)));

    Optional<Path> customScript = request.getCustomScript();
    if (customScript.isPresent()) {
      Optional<LoadedModel> loaded =
          loadWithConventions(
              LoadStrategy.CUSTOM_SCRIPT, customScript.get(), modelDirectory, request, trace);
      if (loaded.isPresent()) {
        return loaded.get();
      }
    } else {
      trace.skipped(LoadStrategy.CUSTOM_SCRIPT, "-", "no custom inference script was specified");
    }

    Optional<LoadedModel> detected = autoDetect(modelDirectory, request, trace);
    if (detected.isPresent()) {
      return detected.get();
    }

    try {
      return loadWithAdapter(modelDirectory, request, trace);
    } catch (ModelLoadingException e) {
      logger.error(String.format("Built-in framework loading failed: %s", e.getMessage()));
      throw new NoLoadStrategySucceededException(trace.getEntries(), e);
    }
  }

  private static Optional<Path> findManifest(LoadRequest request, Optional<Path> modelDirectory) {
    if (request.getManifestPath().isPresent()) {
      return request.getManifestPath();
    }
    if (modelDirectory.isPresent()) {
      Path candidate = modelDirectory.get().resolve(ModelConfig.MANIFEST_FILE_NAME);
      if (Files.isRegularFile(candidate)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  private LoadedModel loadFromManifest(
      Path manifestPath, Optional<Path> modelDirectory, LoadRequest request,
      ResolutionTrace trace) {
    Path directory = modelDirectory.orElse(manifestPath.toAbsolutePath().getParent());
    String step = "validate";
    try {
      ModelConfig manifest = validator.validate(manifestPath);
      trace.succeeded(LoadStrategy.MANIFEST, step, manifestPath.toString());

      step = "bind";
      Path entryPointPath = manifest.resolveEntryPoint(directory);
      ExecutableUnit entryPoint =
          manifest.getEntryPointType() == EntryPointType.CLASS
              ? binder.bindClass(entryPointPath, manifest.getClassName().get())
              : binder.bind(entryPointPath);
      trace.succeeded(
          LoadStrategy.MANIFEST,
          step,
          String.format("%s defines %s", entryPointPath, entryPoint.getCallableNames()));

      FunctionConfig load = manifest.getLoad();
      step = load.getName();
      requireCallable(entryPoint, load.getName());
      requireCallable(entryPoint, manifest.getPredict().getName());
      Object[] arguments =
          ManifestBinding.buildArguments(load.getArgs(), manifest, directory, null, null);
      Object handle;
      try {
        handle = entryPoint.invoke(load.getName(), arguments);
      } catch (Exception e) {
        throw new ModelLoadingException(
            String.format(
                "The manifest load function `%s` raised %s: %s",
                load.getName(), e.getClass().getSimpleName(), e.getMessage()),
            e);
      }
      if (handle == null) {
        throw new ModelLoadingException(
            String.format("The manifest load function `%s` returned null", load.getName()));
      }
      trace.succeeded(
          LoadStrategy.MANIFEST, step, String.format("called with arguments %s", load));
      logger.info(
          String.format(
              "Loaded %s model from manifest %s", manifest.getFramework(), manifestPath));
      return new LoadedModel(
          manifest.getFramework(),
          new ManifestBinding(manifest, entryPoint, handle, directory),
          manifest,
          LoadStrategy.MANIFEST,
          trace,
          manifest.resolveModelFile(directory),
          request.getModelIdentifier().orElse(directory.getFileName().toString()));
    } catch (ModelLoadingException e) {
      trace.failed(LoadStrategy.MANIFEST, step, e.getMessage());
      logger.error(String.format("Manifest-driven loading failed at `%s`: %s", step,
          e.getMessage()));
      throw e;
    }
  }

  private static void requireCallable(ExecutableUnit entryPoint, String function) {
    if (!entryPoint.hasCallable(function)) {
      throw new EntryPointFunctionNotFoundException(function, entryPoint.getCallableNames());
    }
  }

  private Optional<LoadedModel> autoDetect(
      Optional<Path> modelDirectory, LoadRequest request, ResolutionTrace trace) {
    if (!modelDirectory.isPresent()) {
      trace.skipped(LoadStrategy.AUTO_DETECT, "-", "no model directory to search");
      return Optional.empty();
    }
    Path directory = modelDirectory.get();
    Path manifestPath = directory.resolve(ModelConfig.MANIFEST_FILE_NAME);
    if (Files.isRegularFile(manifestPath)) {
      trace.succeeded(
          LoadStrategy.AUTO_DETECT,
          ModelConfig.MANIFEST_FILE_NAME,
          "a manifest appeared in the model directory, deferring to it");
      return Optional.of(loadFromManifest(manifestPath, modelDirectory, request, trace));
    }
    for (String scriptName : CONVENTIONAL_SCRIPTS) {
      Path script = directory.resolve(scriptName);
      if (Files.isRegularFile(script)) {
        return loadWithConventions(
            LoadStrategy.AUTO_DETECT, script, modelDirectory, request, trace);
      }
    }
    trace.skipped(
        LoadStrategy.AUTO_DETECT,
        "-",
        String.format("none of %s exists in %s", CONVENTIONAL_SCRIPTS, directory));
    return Optional.empty();
  }

  /**
   * Binds a script and tries the conventional load function names. Every failure is recorded in
   * the trace and results in an empty return
   */
  private Optional<LoadedModel> loadWithConventions(
      LoadStrategy strategy,
      Path script,
      Optional<Path> modelDirectory,
      LoadRequest request,
      ResolutionTrace trace) {
    String scriptName = String.valueOf(script.getFileName());
    ExecutableUnit entryPoint;
    try {
      entryPoint = binder.bind(script);
    } catch (EntryPointBindException e) {
      trace.failed(strategy, scriptName, e.getMessage());
      logger.warn(String.format("Skipping %s: %s", script, e.getMessage()));
      return Optional.empty();
    }
    trace.succeeded(
        strategy, scriptName, String.format("bound with callables %s",
            entryPoint.getCallableNames()));

    Optional<Path> modelPath =
        request.getModelPath().isPresent() ? request.getModelPath() : modelDirectory;
    String modelPathArgument = modelPath.map(Path::toString).orElse(null);
    String modelDirectoryArgument = modelDirectory.map(Path::toString).orElse(null);
    for (String candidate : LOAD_CANDIDATES) {
      if (!entryPoint.hasCallable(candidate)) {
        trace.skipped(strategy, candidate, "not defined");
        continue;
      }
      try {
        CallingConvention convention = CallingConvention.forLoad(entryPoint.arity(candidate));
        Object handle =
            entryPoint.invoke(
                candidate, convention.loadArguments(modelPathArgument, modelDirectoryArgument));
        if (handle == null) {
          trace.failed(strategy, candidate, "returned null");
          continue;
        }
        trace.succeeded(strategy, candidate, String.format("called as %s", convention));
        logger.info(String.format("Loaded custom model through `%s` of %s", candidate, script));
        return Optional.of(
            new LoadedModel(
                Framework.CUSTOM,
                new ConventionBinding(entryPoint, handle),
                null,
                strategy,
                trace,
                modelPath.orElse(script),
                request.getModelIdentifier().orElse(identifierFor(modelPath.orElse(script)))));
      } catch (Exception | LinkageError e) {
        trace.failed(
            strategy, candidate, String.format("%s: %s", e.getClass().getSimpleName(),
                e.getMessage()));
        logger.warn(
            String.format("Load candidate `%s` of %s failed: %s", candidate, script,
                e.getMessage()));
      }
    }
    logger.warn(String.format("No load candidate of %s produced a model", script));
    return Optional.empty();
  }

  private LoadedModel loadWithAdapter(
      Optional<Path> modelDirectory, LoadRequest request, ResolutionTrace trace) {
    Optional<Path> searchRoot =
        request.getModelPath().isPresent() ? request.getModelPath() : modelDirectory;
    if (!searchRoot.isPresent()) {
      trace.failed(LoadStrategy.FRAMEWORK, "locate", "no model path or directory was given");
      throw new ModelLoadingException("No model path or model directory was provided");
    }
    Path modelFile;
    try {
      Optional<Path> located = modelFileLocator.locate(searchRoot.get());
      if (!located.isPresent() && !request.getFrameworkHint().isPresent()) {
        throw new FrameworkUndetectedException(
            searchRoot.get(),
            String.format(
                "no model file with one of the extensions %s was found",
                ModelFileLocator.MODEL_FILE_EXTENSIONS));
      }
      modelFile = located.orElse(searchRoot.get());
      trace.succeeded(LoadStrategy.FRAMEWORK, "locate", modelFile.toString());
    } catch (IOException e) {
      trace.failed(LoadStrategy.FRAMEWORK, "locate", e.getMessage());
      throw new ModelLoadingException(
          String.format("Failed to search %s for a model file", searchRoot.get()), e);
    } catch (FrameworkUndetectedException e) {
      trace.failed(LoadStrategy.FRAMEWORK, "locate", e.getMessage());
      throw e;
    }

    Framework framework;
    try {
      framework =
          request.getFrameworkHint().isPresent()
              ? request.getFrameworkHint().get()
              : FrameworkAdapters.detectFramework(modelFile);
      trace.succeeded(
          LoadStrategy.FRAMEWORK, "detect", String.format("%s for %s", framework, modelFile));
    } catch (FrameworkUndetectedException e) {
      trace.failed(LoadStrategy.FRAMEWORK, "detect", e.getMessage());
      throw e;
    }

    Optional<FrameworkAdapter<?>> adapter = adapters.forFramework(framework);
    if (!adapter.isPresent()) {
      String reason = String.format("no built-in adapter serves the `%s` framework", framework);
      trace.failed(LoadStrategy.FRAMEWORK, "load", reason);
      throw new ModelLoadingException(reason);
    }
    ModelBinding binding;
    try {
      binding = AdapterBinding.load(adapter.get(), modelFile);
    } catch (ModelLoadingException e) {
      trace.failed(LoadStrategy.FRAMEWORK, "load", e.getMessage());
      throw e;
    }
    trace.succeeded(LoadStrategy.FRAMEWORK, "load", String.format("%s adapter", framework));
    logger.info(String.format("Loaded %s model from %s", framework, modelFile));
    return new LoadedModel(
        framework,
        binding,
        null,
        LoadStrategy.FRAMEWORK,
        trace,
        modelFile,
        request.getModelIdentifier().orElse(identifierFor(modelFile)));
  }

  private static String identifierFor(Path path) {
    Path fileName = path.getFileName();
    return fileName == null ? path.toString() : fileName.toString();
  }

  private static String describe(Optional<Path> directory) {
    return directory.map(Path::toString).orElse("(no model directory)");
  }
}
