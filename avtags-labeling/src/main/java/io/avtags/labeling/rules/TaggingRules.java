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

import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Maps raw label tokens to canonical tags.
///
/// Each rule line is either {@code token<TAB>tag}, renaming the token, or a single {@code token},
/// marking it as noise that never becomes a tag.
public class TaggingRules {

  /// The bundled rule file name
  public static final String BUNDLED = "default.tagging";

  private final Map<String, String> canonical;
  private final Set<String> ignored;

  public TaggingRules(Map<String, String> canonical, Set<String> ignored) {
    this.canonical = Map.copyOf(canonical);
    this.ignored = Set.copyOf(ignored);
  }

  /// @return rules that map nothing and ignore nothing
  public static TaggingRules none() {
    return new TaggingRules(Map.of(), Set.of());
  }

  /// Load tagging rules.
  /// @param path the rule file, {@code /dev/null}, or null for the bundled default
  /// @return the rules
  public static TaggingRules load(Path path) {
    return parse(RuleFiles.readLines("tagging rules", path, BUNDLED));
  }

  /// Parse rule lines.
  /// @param lines meaningful rule lines
  /// @return the rules
  /// @throws AvtagsConfigException on a line with more than two columns
  public static TaggingRules parse(List<String> lines) {
    Map<String, String> canonical = new HashMap<>();
    Set<String> ignored = new HashSet<>();
    for (String line : lines) {
      String[] cols = RuleFiles.columns(line);
      String token = cols[0].toLowerCase(Locale.ROOT);
      if (cols.length == 1) {
        ignored.add(token);
      } else if (cols.length == 2) {
        canonical.put(token, cols[1].toLowerCase(Locale.ROOT));
      } else {
        throw new AvtagsConfigException("Invalid tagging rule '" + line + "'");
      }
    }
    return new TaggingRules(canonical, ignored);
  }

  /// @param token a lower-case label token
  /// @return the canonical tag when a rule renames the token
  public Optional<String> canonicalOf(String token) {
    return Optional.ofNullable(canonical.get(token));
  }

  public boolean isIgnored(String token) {
    return ignored.contains(token);
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(canonical);
  }

  public int size() {
    return canonical.size() + ignored.size();
  }
}
