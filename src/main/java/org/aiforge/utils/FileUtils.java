package org.aiforge.utils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.commons.io.IOUtils;

/** Utilities for manipulating files and file paths */
public class FileUtils {
  /** Reads the full contents of a stream, decoded as UTF-8 */
  public static String readInputStreamAsUtf8(InputStream inputStream) throws IOException {
    return IOUtils.toString(inputStream, StandardCharsets.UTF_8);
  }

  /**
   * @return The lower-cased suffix of the file name, including the leading dot, or an empty string
   *     if the name has no suffix
   */
  public static String getSuffix(Path path) {
    Path fileName = path.getFileName();
    if (fileName == null) {
      return "";
    }
    String name = fileName.toString();
    int dotIndex = name.lastIndexOf('.');
    if (dotIndex <= 0) {
      return "";
    }
    return name.substring(dotIndex).toLowerCase(Locale.ROOT);
  }

  /**
   * Lists every regular file below the specified directory, in a stable (sorted) order
   *
   * @throws IOException If the directory cannot be walked
   */
  public static List<Path> listFilesRecursively(Path directory) throws IOException {
    if (!Files.isDirectory(directory)) {
      return new ArrayList<>();
    }
    try (Stream<Path> paths = Files.walk(directory)) {
      return paths.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
    }
  }
}
