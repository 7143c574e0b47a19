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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Tags that imply other tags, e.g. {@code zeus<TAB>banker} adds {@code banker} wherever
/// {@code zeus} is found. Implications are followed transitively; cycles are tolerated.
public class ExpansionRules {

  /// The bundled rule file name
  public static final String BUNDLED = "default.expansion";

  private final Map<String, List<String>> implied;

  public ExpansionRules(Map<String, List<String>> implied) {
    this.implied = Map.copyOf(implied);
  }

  public static ExpansionRules none() {
    return new ExpansionRules(Map.of());
  }

  public static ExpansionRules load(Path path) {
    return parse(RuleFiles.readLines("expansion rules", path, BUNDLED));
  }

  /// @param lines meaningful rule lines, each {@code tag<TAB>implied[<TAB>implied...]}
  /// @return the rules
  /// @throws AvtagsConfigException on a line without any implied tag
  public static ExpansionRules parse(List<String> lines) {
    Map<String, List<String>> implied = new HashMap<>();
    for (String line : lines) {
      String[] cols = RuleFiles.columns(line);
      if (cols.length < 2) {
        throw new AvtagsConfigException("Expansion rule without implied tags: '" + line + "'");
      }
      List<String> targets = implied.computeIfAbsent(
          cols[0].toLowerCase(Locale.ROOT), t -> new ArrayList<>());
      Arrays.stream(cols, 1, cols.length).map(c -> c.toLowerCase(Locale.ROOT)).forEach(targets::add);
    }
    return new ExpansionRules(implied);
  }

  /// @param tag a canonical tag
  /// @return the tag followed by every tag it implies, without repeats
  public Set<String> expand(String tag) {
    Set<String> out = new LinkedHashSet<>();
    Deque<String> pending = new ArrayDeque<>();
    pending.add(tag);
    while (!pending.isEmpty()) {
      String next = pending.removeFirst();
      if (out.add(next)) {
        pending.addAll(implied.getOrDefault(next, List.of()));
      }
    }
    return out;
  }

  public int size() {
    return implied.size();
  }
}
