package org.aiforge.serving;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import org.aiforge.Framework;
import org.aiforge.artifacts.ArtifactBundleFetcher;
import org.aiforge.artifacts.CliBasedArtifactFetcher;
import org.aiforge.artifacts.LocalArtifactFetcher;
import org.aiforge.utils.Environment;
import org.aiforge.utils.SerializationUtils;

/**
 * Configuration of a gateway process. Values are read from an optional YAML file named by
 * `AIFORGE_CONFIG_FILE`, then overridden by environment variables
 */
public class GatewayConfig {
  static final String ENV_VAR_CONFIG_FILE = "AIFORGE_CONFIG_FILE";
  static final String ENV_VAR_MODEL_PATH = "AIFORGE_MODEL_PATH";
  static final String ENV_VAR_MODEL_DIR = "AIFORGE_MODEL_DIR";
  static final String ENV_VAR_CUSTOM_INFERENCE_PATH = "AIFORGE_CUSTOM_INFERENCE_PATH";
  static final String ENV_VAR_MODEL_ID = "AIFORGE_MODEL_ID";
  static final String ENV_VAR_FRAMEWORK = "AIFORGE_FRAMEWORK";
  static final String ENV_VAR_DOWNLOAD_MODEL_ON_STARTUP = "AIFORGE_DOWNLOAD_MODEL_ON_STARTUP";
  static final String ENV_VAR_ARTIFACT_MIRROR_DIR = "AIFORGE_ARTIFACT_MIRROR_DIR";
  static final String ENV_VAR_ARTIFACT_FETCH_COMMAND = "AIFORGE_ARTIFACT_FETCH_COMMAND";
  static final String ENV_VAR_ARTIFACT_CACHE_DIR = "AIFORGE_ARTIFACT_CACHE_DIR";
  static final String ENV_VAR_API_KEY = "AIFORGE_API_KEY";
  static final String ENV_VAR_PORT = "AIFORGE_PORT";
  static final String ENV_VAR_MINIMUM_SERVER_THREADS = "AIFORGE_SERVER_MIN_THREADS";
  static final String ENV_VAR_MAXIMUM_SERVER_THREADS = "AIFORGE_SERVER_MAX_THREADS";

  static final String DEFAULT_MODEL_DIR = "/app/user_model";
  static final String DEFAULT_ARTIFACT_CACHE_DIR = "/tmp/models";
  static final int DEFAULT_PORT = 8080;
  static final int DEFAULT_MINIMUM_SERVER_THREADS = 1;
  // Assuming an 8 core machine with hyperthreading
  static final int DEFAULT_MAXIMUM_SERVER_THREADS = 16;

  @JsonProperty("model_path")
  private String modelPath;

  @JsonProperty("model_dir")
  private String modelDir = DEFAULT_MODEL_DIR;

  @JsonProperty("custom_inference_path")
  private String customInferencePath;

  @JsonProperty("model_id")
  private String modelId;

  @JsonProperty("framework")
  private String framework;

  @JsonProperty("download_model_on_startup")
  private boolean downloadModelOnStartup = false;

  @JsonProperty("artifact_mirror_dir")
  private String artifactMirrorDir;

  @JsonProperty("artifact_fetch_command")
  private String artifactFetchCommand;

  @JsonProperty("artifact_cache_dir")
  private String artifactCacheDir = DEFAULT_ARTIFACT_CACHE_DIR;

  @JsonProperty("api_key")
  private String apiKey;

  @JsonProperty("port")
  private int port = DEFAULT_PORT;

  @JsonProperty("server_min_threads")
  private int serverMinThreads = DEFAULT_MINIMUM_SERVER_THREADS;

  @JsonProperty("server_max_threads")
  private int serverMaxThreads = DEFAULT_MAXIMUM_SERVER_THREADS;

  private GatewayConfig() {}

  /** @return A configuration holding only default values */
  public static GatewayConfig defaults() {
    return new GatewayConfig();
  }

  /**
   * Reads the configuration file named by `AIFORGE_CONFIG_FILE`, if any, and applies the
   * environment variable overrides
   *
   * @throws IllegalArgumentException If the configuration file cannot be parsed or a variable has
   *     an invalid value
   */
  public static GatewayConfig fromEnvironment(Environment environment) {
    Optional<String> configFile = environment.getValue(ENV_VAR_CONFIG_FILE);
    GatewayConfig config =
        configFile.isPresent() ? fromYamlFile(configFile.get()) : new GatewayConfig();
    config.applyOverrides(environment);
    return config;
  }

  /** Parses a YAML configuration file, without environment overrides */
  public static GatewayConfig fromYamlFile(String configPath) {
    try {
      return SerializationUtils.parseYamlFromFile(configPath, GatewayConfig.class);
    } catch (IOException e) {
      throw new IllegalArgumentException(
          String.format("Failed to parse the gateway configuration at `%s`", configPath), e);
    }
  }

  private void applyOverrides(Environment environment) {
    modelPath = environment.getValue(ENV_VAR_MODEL_PATH).orElse(modelPath);
    modelDir = environment.getValue(ENV_VAR_MODEL_DIR).orElse(modelDir);
    customInferencePath =
        environment.getValue(ENV_VAR_CUSTOM_INFERENCE_PATH).orElse(customInferencePath);
    modelId = environment.getValue(ENV_VAR_MODEL_ID).orElse(modelId);
    framework = environment.getValue(ENV_VAR_FRAMEWORK).orElse(framework);
    downloadModelOnStartup =
        environment.getBooleanValue(ENV_VAR_DOWNLOAD_MODEL_ON_STARTUP, downloadModelOnStartup);
    artifactMirrorDir = environment.getValue(ENV_VAR_ARTIFACT_MIRROR_DIR).orElse(artifactMirrorDir);
    artifactFetchCommand =
        environment.getValue(ENV_VAR_ARTIFACT_FETCH_COMMAND).orElse(artifactFetchCommand);
    artifactCacheDir = environment.getValue(ENV_VAR_ARTIFACT_CACHE_DIR).orElse(artifactCacheDir);
    apiKey = environment.getValue(ENV_VAR_API_KEY).orElse(apiKey);
    port = environment.getIntegerValue(ENV_VAR_PORT, port);
    serverMinThreads = environment.getIntegerValue(ENV_VAR_MINIMUM_SERVER_THREADS, serverMinThreads);
    serverMaxThreads = environment.getIntegerValue(ENV_VAR_MAXIMUM_SERVER_THREADS, serverMaxThreads);
    // Validate eagerly so that a bad value fails at startup
    getFrameworkHint();
  }

  /** @return The model file or directory to load, if configured */
  public Optional<Path> getModelPath() {
    return Optional.ofNullable(modelPath).map(Paths::get);
  }

  /** @return The directory searched when no usable model path is configured */
  public Path getModelDirectory() {
    return Paths.get(modelDir);
  }

  public Optional<Path> getCustomInferencePath() {
    return Optional.ofNullable(customInferencePath).map(Paths::get);
  }

  /** @return The identifier of the model bundle, of the form `owner/model` */
  public Optional<String> getModelId() {
    return Optional.ofNullable(modelId);
  }

  /**
   * @return The framework to use instead of suffix detection
   * @throws IllegalArgumentException If the configured name is not a known framework
   */
  public Optional<Framework> getFrameworkHint() {
    return Optional.ofNullable(framework).map(Framework::fromValue);
  }

  public boolean isDownloadModelOnStartup() {
    return downloadModelOnStartup;
  }

  public Path getArtifactCacheDirectory() {
    return Paths.get(artifactCacheDir);
  }

  /** @return The key every authenticated request must present, if authentication is enabled */
  public Optional<String> getApiKey() {
    return Optional.ofNullable(apiKey);
  }

  public int getPort() {
    return port;
  }

  public int getServerMinThreads() {
    return serverMinThreads;
  }

  public int getServerMaxThreads() {
    return serverMaxThreads;
  }

  /**
   * @return A fetcher copying from the configured mirror directory, else one running the
   *     configured fetch command, else nothing
   */
  public Optional<ArtifactBundleFetcher> createArtifactFetcher() {
    if (artifactMirrorDir != null) {
      return Optional.of(
          new LocalArtifactFetcher(Paths.get(artifactMirrorDir), getArtifactCacheDirectory()));
    }
    if (artifactFetchCommand != null) {
      return Optional.of(
          new CliBasedArtifactFetcher(artifactFetchCommand, getArtifactCacheDirectory()));
    }
    return Optional.empty();
  }
}
