package org.aiforge.utils;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.File;
import java.io.IOException;

/**
 * Utilities for serializing and deserializing objects to and from various persistence formats, such
 * as JSON and YAML
 */
public class SerializationUtils {
  private static final ObjectMapper jsonMapper = new ObjectMapper(new JsonFactory());
  private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

  /**
   * Produces a JSON string representation of a Java object
   *
   * @return A string in valid JSON format
   */
  public static String toJson(Object object) throws JsonProcessingException {
    return jsonMapper.writeValueAsString(object);
  }

  /**
   * Parses a JSON-formatted string as a tree. Parse errors are reported as {@link
   * JsonProcessingException JsonProcessingExceptions} carrying the location of the failure
   */
  public static JsonNode readTree(String json) throws JsonProcessingException {
    return jsonMapper.readTree(json);
  }

  /** Converts a parsed JSON tree into plain Java maps, lists and scalars */
  public static Object treeToValue(JsonNode node) throws JsonProcessingException {
    return jsonMapper.treeToValue(node, Object.class);
  }

  /**
   * Produces a Java object representation of a YAML-formatted file
   *
   * @param filePath The path to the YAML-formatted file
   * @param objectClass The class of the Java object that should be produced
   */
  public static <T> T parseYamlFromFile(String filePath, Class<T> objectClass) throws IOException {
    return yamlMapper.readValue(new File(filePath), objectClass);
  }
}
