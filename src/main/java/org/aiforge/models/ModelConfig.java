package org.aiforge.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.aiforge.Framework;

/**
 * Represents a validated `model_config.json` manifest: the declaration of exactly how a model
 * bundle is loaded and invoked. Instances are immutable and are only created through {@link
 * ModelConfigValidator}
 */
public class ModelConfig {
  /** The fixed file name of the manifest in the root of a model directory */
  public static final String MANIFEST_FILE_NAME = "model_config.json";

  private final String entryPoint;
  private final EntryPointType entryPointType;
  private final String className;
  private final FunctionConfig load;
  private final FunctionConfig predict;
  private final String modelFile;
  private final Framework framework;
  private final List<String> auxiliaryFiles;
  private final String name;
  private final String version;
  private final String description;
  private final String author;
  private final List<String> tags;

  ModelConfig(
      String entryPoint,
      EntryPointType entryPointType,
      String className,
      FunctionConfig load,
      FunctionConfig predict,
      String modelFile,
      Framework framework,
      List<String> auxiliaryFiles,
      String name,
      String version,
      String description,
      String author,
      List<String> tags) {
    this.entryPoint = entryPoint;
    this.entryPointType = entryPointType;
    this.className = className;
    this.load = load;
    this.predict = predict;
    this.modelFile = modelFile;
    this.framework = framework;
    this.auxiliaryFiles = copyOrNull(auxiliaryFiles);
    this.name = name;
    this.version = version;
    this.description = description;
    this.author = author;
    this.tags = copyOrNull(tags);
  }

  private static List<String> copyOrNull(List<String> values) {
    return values == null ? null : Collections.unmodifiableList(new ArrayList<>(values));
  }

  /**
   * Loads and validates the manifest in the root of a model directory
   *
   * @param modelRootPath The path to the model directory
   * @throws ManifestValidationException If the manifest is malformed or invalid
   */
  public static ModelConfig fromRootPath(Path modelRootPath) {
    return fromConfigPath(modelRootPath.resolve(MANIFEST_FILE_NAME));
  }

  /**
   * Loads and validates a manifest file
   *
   * @param configPath The path to the `model_config.json` file
   */
  public static ModelConfig fromConfigPath(Path configPath) {
    return new ModelConfigValidator().validate(configPath);
  }

  /** @return The entry-point script path, relative to the model directory */
  public String getEntryPoint() {
    return entryPoint;
  }

  public EntryPointType getEntryPointType() {
    return entryPointType;
  }

  /** @return The class to instantiate, present iff the entry point type is `class` */
  public Optional<String> getClassName() {
    return Optional.ofNullable(className);
  }

  public FunctionConfig getLoad() {
    return load;
  }

  public FunctionConfig getPredict() {
    return predict;
  }

  /** @return The main model file name, relative to the model directory */
  public String getModelFile() {
    return modelFile;
  }

  public Framework getFramework() {
    return framework;
  }

  public List<String> getAuxiliaryFiles() {
    return auxiliaryFiles == null ? Collections.<String>emptyList() : auxiliaryFiles;
  }

  public Optional<String> getName() {
    return Optional.ofNullable(name);
  }

  public Optional<String> getVersion() {
    return Optional.ofNullable(version);
  }

  public Optional<String> getDescription() {
    return Optional.ofNullable(description);
  }

  public Optional<String> getAuthor() {
    return Optional.ofNullable(author);
  }

  public List<String> getTags() {
    return tags == null ? Collections.<String>emptyList() : tags;
  }

  /** @return The absolute location of the entry-point script within the model directory */
  public Path resolveEntryPoint(Path modelDirectory) {
    return modelDirectory.resolve(entryPoint);
  }

  /** @return The absolute location of the main model file within the model directory */
  public Path resolveModelFile(Path modelDirectory) {
    return modelDirectory.resolve(modelFile);
  }

  /**
   * Produces the manifest document for this configuration, with every default made explicit.
   * Validating the produced document yields an equal {@link ModelConfig}
   */
  public JsonNode toJsonNode() {
    JsonNodeFactory nodes = JsonNodeFactory.instance;
    ObjectNode root = nodes.objectNode();
    putIfPresent(root, "name", name);
    putIfPresent(root, "version", version);
    root.put("framework", framework.getValue());
    root.put("entry_point", entryPoint);
    root.put("entry_point_type", entryPointType.getValue());
    putIfPresent(root, "class_name", className);
    root.set("load", functionNode(load));
    root.set("predict", functionNode(predict));
    root.put("model_file", modelFile);
    if (auxiliaryFiles != null) {
      root.set("auxiliary_files", stringArray(auxiliaryFiles));
    }
    putIfPresent(root, "description", description);
    putIfPresent(root, "author", author);
    if (tags != null) {
      root.set("tags", stringArray(tags));
    }
    return root;
  }

  private static void putIfPresent(ObjectNode node, String field, String value) {
    if (value != null) {
      node.put(field, value);
    }
  }

  private static ObjectNode functionNode(FunctionConfig function) {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put("name", function.getName());
    node.set("args", stringArray(ArgumentToken.toValues(function.getArgs())));
    return node;
  }

  private static ArrayNode stringArray(List<String> values) {
    ArrayNode array = JsonNodeFactory.instance.arrayNode();
    for (String value : values) {
      array.add(value);
    }
    return array;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof ModelConfig)) {
      return false;
    }
    ModelConfig config = (ModelConfig) other;
    return entryPoint.equals(config.entryPoint)
        && entryPointType == config.entryPointType
        && Objects.equals(className, config.className)
        && load.equals(config.load)
        && predict.equals(config.predict)
        && modelFile.equals(config.modelFile)
        && framework == config.framework
        && Objects.equals(auxiliaryFiles, config.auxiliaryFiles)
        && Objects.equals(name, config.name)
        && Objects.equals(version, config.version)
        && Objects.equals(description, config.description)
        && Objects.equals(author, config.author)
        && Objects.equals(tags, config.tags);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        entryPoint,
        entryPointType,
        className,
        load,
        predict,
        modelFile,
        framework,
        auxiliaryFiles,
        name,
        version,
        description,
        author,
        tags);
  }

  @Override
  public String toString() {
    return toJsonNode().toString();
  }
}
