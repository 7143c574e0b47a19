/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.avtags.labeling.rules;

import io.avtags.api.AvtagsConfigException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Loads the plain-text rule files used by the default labeling collaborators.
///
/// Blank lines and lines starting with {@code #} are ignored. A path of {@code /dev/null} means
/// "no rules". A null path selects the rule set bundled on the classpath.
public final class RuleFiles {

  private static final Logger logger = LogManager.getLogger(RuleFiles.class);

  /// The path that selects an empty rule set
  public static final String NO_RULES = "/dev/null";

  private static final String BUNDLED_PREFIX = "/io/avtags/labeling/";

  private RuleFiles() {
  }

  /// Read the meaningful lines of a rule file.
  /// @param kind what the file holds, for log and error messages
  /// @param path the file, {@code /dev/null}, or null for the bundled default
  /// @param bundledName the classpath resource name of the bundled default
  /// @return the non-blank, non-comment lines with surrounding whitespace removed
  /// @throws AvtagsConfigException if the file cannot be read
  public static List<String> readLines(String kind, Path path, String bundledName) {
    if (path == null) {
      logger.info("Using default {} ({})", kind, bundledName);
      return readBundled(kind, bundledName);
    }
    return readFile(kind, path);
  }

  /// Read the meaningful lines of a file that has no bundled default.
  /// @param kind what the file holds, for log and error messages
  /// @param path the file
  /// @return the non-blank, non-comment lines
  /// @throws AvtagsConfigException if the file cannot be read
  public static List<String> readLines(String kind, Path path) {
    if (path == null) {
      throw new AvtagsConfigException("No file given for " + kind);
    }
    return readFile(kind, path);
  }

  private static List<String> readFile(String kind, Path path) {
    if (NO_RULES.equals(path.toString())) {
      logger.info("Using no {}", kind);
      return List.of();
    }
    logger.info("Using {} in {}", kind, path);
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return meaningful(reader);
    } catch (IOException e) {
      throw new AvtagsConfigException("Unable to read " + kind + " from " + path + ": " + e, e);
    }
  }

  private static List<String> readBundled(String kind, String bundledName) {
    InputStream stream = RuleFiles.class.getResourceAsStream(BUNDLED_PREFIX + bundledName);
    if (stream == null) {
      throw new AvtagsConfigException("Bundled " + kind + " '" + bundledName + "' is missing");
    }
    try (BufferedReader reader =
             new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      return meaningful(reader);
    } catch (IOException e) {
      throw new AvtagsConfigException("Unable to read bundled " + kind + ": " + e, e);
    }
  }

  private static List<String> meaningful(BufferedReader reader) throws IOException {
    List<String> lines = new ArrayList<>();
    String line;
    while ((line = reader.readLine()) != null) {
      String trimmed = line.strip();
      if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
        lines.add(trimmed);
      }
    }
    return lines;
  }

  /// Split a rule line on tabs, falling back to runs of whitespace.
  /// @param line a rule line
  /// @return the columns, never empty
  static String[] columns(String line) {
    return line.indexOf('\t') >= 0 ? line.split("\t+") : line.split("\\s+");
  }
}
