package org.aiforge.models;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.aiforge.Framework;
import org.aiforge.ModelLoadingException;
import org.aiforge.utils.SerializationUtils;

/**
 * Parses and validates `model_config.json` manifests. Validation is total: every document either
 * yields a {@link ModelConfig} or a {@link ManifestValidationException} naming the offending field
 */
public class ModelConfigValidator {
  /** Entry points must be Groovy scripts */
  public static final String ENTRY_POINT_SUFFIX = ".groovy";

  private static final List<String> STRING_TYPE = Collections.singletonList("a string");
  private static final List<String> STRING_LIST_TYPE =
      Collections.singletonList("a list of strings");

  /**
   * Reads and validates a manifest file
   *
   * @throws ModelLoadingException If the file cannot be read
   * @throws ManifestValidationException If its content is malformed or invalid
   */
  public ModelConfig validate(Path configPath) {
    String content;
    try {
      content = new String(Files.readAllBytes(configPath), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ModelLoadingException(
          String.format("Failed to read the manifest at path `%s`", configPath), e);
    }
    return validate(content);
  }

  /** Parses and validates a manifest document */
  public ModelConfig validate(String json) {
    JsonNode root;
    try {
      root = SerializationUtils.readTree(json);
    } catch (JsonProcessingException e) {
      JsonLocation location = e.getLocation();
      int line = location == null ? -1 : location.getLineNr();
      int column = location == null ? -1 : location.getColumnNr();
      throw new ManifestSyntaxException(e.getOriginalMessage(), line, column, e);
    }
    if (root == null || root.isMissingNode()) {
      throw new ManifestSyntaxException("the document is empty", 1, 1, null);
    }
    return validate(root);
  }

  /** Validates an already-parsed manifest document */
  public ModelConfig validate(JsonNode root) {
    if (!root.isObject()) {
      throw new ManifestInvalidFieldException(
          "(document)", root.toString(), Collections.singletonList("a JSON object"));
    }
    String entryPoint = requireText(root, "entry_point", "entry_point");
    if (!entryPoint.endsWith(ENTRY_POINT_SUFFIX)) {
      throw new ManifestInvalidFieldException(
          "entry_point",
          entryPoint,
          Collections.singletonList(String.format("a relative path ending in `%s`",
              ENTRY_POINT_SUFFIX)));
    }
    EntryPointType entryPointType = parseEntryPointType(root);
    Optional<String> className = optionalText(root, "class_name");
    if (entryPointType == EntryPointType.CLASS && !className.isPresent()) {
      throw new ManifestMissingFieldException("class_name");
    }
    FunctionConfig load = parseFunction(root, "load", ArgumentToken.allTokens());
    FunctionConfig predict = parseFunction(root, "predict", ArgumentToken.allTokens());
    String modelFile = requireText(root, "model_file", "model_file");
    Framework framework = parseFramework(root);

    return new ModelConfig(
        entryPoint,
        entryPointType,
        className.orElse(null),
        load,
        predict,
        modelFile,
        framework,
        optionalStringList(root, "auxiliary_files").orElse(null),
        optionalText(root, "name").orElse(null),
        optionalText(root, "version").orElse(null),
        optionalText(root, "description").orElse(null),
        optionalText(root, "author").orElse(null),
        optionalStringList(root, "tags").orElse(null));
  }

  private static EntryPointType parseEntryPointType(JsonNode root) {
    Optional<String> rawType = optionalText(root, "entry_point_type");
    if (!rawType.isPresent()) {
      return EntryPointType.MODULE;
    }
    for (EntryPointType type : EntryPointType.values()) {
      if (type.getValue().equals(rawType.get())) {
        return type;
      }
    }
    throw new ManifestInvalidFieldException(
        "entry_point_type",
        rawType.get(),
        Arrays.asList(EntryPointType.MODULE.getValue(), EntryPointType.CLASS.getValue()));
  }

  private static Framework parseFramework(JsonNode root) {
    Optional<String> rawFramework = optionalText(root, "framework");
    if (!rawFramework.isPresent()) {
      return Framework.CUSTOM;
    }
    try {
      return Framework.fromValue(rawFramework.get());
    } catch (IllegalArgumentException e) {
      throw new ManifestInvalidFieldException(
          "framework", rawFramework.get(), Framework.allValues());
    }
  }

  private static FunctionConfig parseFunction(
      JsonNode root, String field, List<ArgumentToken> allowedTokens) {
    JsonNode function = root.get(field);
    if (isAbsent(function)) {
      throw new ManifestMissingFieldException(field);
    }
    if (!function.isObject()) {
      throw new ManifestInvalidFieldException(
          field, function.toString(), Collections.singletonList("an object with `name` and `args`"));
    }
    String name = requireText(function, "name", field + ".name");
    List<ArgumentToken> tokens = new ArrayList<>();
    JsonNode args = function.get("args");
    if (isAbsent(args)) {
      return new FunctionConfig(name, tokens);
    }
    if (!args.isArray()) {
      throw new ManifestInvalidFieldException(field + ".args", args.toString(), STRING_LIST_TYPE);
    }
    List<String> allowedValues = ArgumentToken.toValues(allowedTokens);
    for (JsonNode arg : args) {
      String rawToken = arg.isTextual() ? arg.asText() : arg.toString();
      Optional<ArgumentToken> token = ArgumentToken.fromValue(rawToken);
      if (!arg.isTextual() || !token.isPresent() || !allowedTokens.contains(token.get())) {
        throw new ManifestInvalidArgException(field + ".args", rawToken, allowedValues);
      }
      tokens.add(token.get());
    }
    return new FunctionConfig(name, tokens);
  }

  private static String requireText(JsonNode node, String key, String fieldName) {
    JsonNode value = node.get(key);
    if (isAbsent(value)) {
      throw new ManifestMissingFieldException(fieldName);
    }
    if (!value.isTextual()) {
      throw new ManifestInvalidFieldException(fieldName, value.toString(), STRING_TYPE);
    }
    return value.asText();
  }

  private static Optional<String> optionalText(JsonNode node, String key) {
    JsonNode value = node.get(key);
    if (isAbsent(value)) {
      return Optional.empty();
    }
    if (!value.isTextual()) {
      throw new ManifestInvalidFieldException(key, value.toString(), STRING_TYPE);
    }
    return Optional.of(value.asText());
  }

  private static Optional<List<String>> optionalStringList(JsonNode node, String key) {
    JsonNode value = node.get(key);
    if (isAbsent(value)) {
      return Optional.empty();
    }
    if (!value.isArray()) {
      throw new ManifestInvalidFieldException(key, value.toString(), STRING_LIST_TYPE);
    }
    List<String> items = new ArrayList<>();
    for (JsonNode item : value) {
      if (!item.isTextual()) {
        throw new ManifestInvalidFieldException(key, value.toString(), STRING_LIST_TYPE);
      }
      items.add(item.asText());
    }
    return Optional.of(items);
  }

  private static boolean isAbsent(JsonNode value) {
    return value == null || value.isNull() || value.isMissingNode();
  }
}
