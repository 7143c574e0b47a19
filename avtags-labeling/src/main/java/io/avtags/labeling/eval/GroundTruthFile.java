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

package io.avtags.labeling.eval;

import io.avtags.api.AvtagsConfigException;
import io.avtags.api.model.HashKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// A ground truth read from {@code hash<TAB>family} lines, loaded once before the stream starts.
public final class GroundTruthFile {

  private static final Logger logger = LogManager.getLogger(GroundTruthFile.class);

  private final Map<String, String> families;

  private GroundTruthFile(Map<String, String> families) {
    this.families = Collections.unmodifiableMap(families);
  }

  /// @param path the ground truth file
  /// @return the loaded ground truth
  /// @throws AvtagsConfigException if the file cannot be read or a line has no tab
  public static GroundTruthFile load(Path path) {
    Map<String, String> families = new LinkedHashMap<>();
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
          continue;
        }
        int tab = trimmed.indexOf('\t');
        if (tab <= 0) {
          throw new AvtagsConfigException(
              "Ground truth " + path + " line " + lineNumber + " is not 'hash<TAB>family'");
        }
        families.put(trimmed.substring(0, tab).strip(), trimmed.substring(tab + 1).strip());
      }
    } catch (IOException e) {
      throw new AvtagsConfigException("Unable to read ground truth " + path + ": " + e, e);
    }
    logger.info("Loaded {} ground truth entries from {}", families.size(), path);
    return new GroundTruthFile(families);
  }

  public static GroundTruthFile of(Map<String, String> families) {
    return new GroundTruthFile(new LinkedHashMap<>(families));
  }

  public Map<String, String> families() {
    return families;
  }

  /// Guess the hash kind from the first hash in the file.
  /// @return the kind, empty when the file is empty or the first hash has an unexpected length
  public Optional<HashKind> guessHashKind() {
    return families.keySet().stream().findFirst().flatMap(HashKind::guess);
  }

  public int size() {
    return families.size();
  }
}
