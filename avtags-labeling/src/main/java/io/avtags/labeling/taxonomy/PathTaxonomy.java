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

package io.avtags.labeling.taxonomy;

import io.avtags.api.AvtagsConfigException;
import io.avtags.api.model.Category;
import io.avtags.api.spi.Taxonomy;
import io.avtags.labeling.rules.RuleFiles;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// A taxonomy read from one path per line, e.g. {@code CLASS:grayware:adware}.
///
/// The first path component is the category code ({@code FAM}, {@code CLASS}, {@code BEH} or
/// {@code FILE}); the last component is the tag. Tags the file does not list are
/// {@link Category#UNKNOWN} with path {@code UNK:<tag>}.
public class PathTaxonomy implements Taxonomy {

  /// The bundled taxonomy file name
  public static final String BUNDLED = "default.taxonomy";

  private static final String SEPARATOR = ":";

  private final Map<String, String> paths;
  private final Map<String, Category> categories;

  private PathTaxonomy(Map<String, String> paths, Map<String, Category> categories) {
    this.paths = Map.copyOf(paths);
    this.categories = Map.copyOf(categories);
  }

  public static PathTaxonomy empty() {
    return new PathTaxonomy(Map.of(), Map.of());
  }

  public static PathTaxonomy load(Path path) {
    return parse(RuleFiles.readLines("taxonomy", path, BUNDLED));
  }

  /// @param lines taxonomy paths
  /// @return the taxonomy
  /// @throws AvtagsConfigException on a path with an unknown category or a tag listed twice
  ///     under different paths
  public static PathTaxonomy parse(List<String> lines) {
    Map<String, String> paths = new HashMap<>();
    Map<String, Category> categories = new HashMap<>();
    for (String line : lines) {
      String[] parts = line.split(SEPARATOR);
      if (parts.length < 2) {
        throw new AvtagsConfigException("Taxonomy path needs a category and a tag: '" + line + "'");
      }
      Category category;
      try {
        category = Category.fromCode(parts[0]);
      } catch (IllegalArgumentException e) {
        throw new AvtagsConfigException("Taxonomy path '" + line + "': " + e.getMessage(), e);
      }
      if (category == Category.UNKNOWN) {
        throw new AvtagsConfigException("Taxonomy path may not use UNK: '" + line + "'");
      }
      String tag = parts[parts.length - 1].toLowerCase(Locale.ROOT);
      String normalized = category.code() + line.substring(parts[0].length()).toLowerCase(Locale.ROOT);
      String previous = paths.putIfAbsent(tag, normalized);
      if (previous != null && !previous.equals(normalized)) {
        throw new AvtagsConfigException(
            "Tag '" + tag + "' is listed under both " + previous + " and " + normalized);
      }
      categories.put(tag, category);
    }
    return new PathTaxonomy(paths, categories);
  }

  @Override
  public Category categoryOf(String tag) {
    return categories.getOrDefault(tag, Category.UNKNOWN);
  }

  @Override
  public String pathOf(String tag) {
    String path = paths.get(tag);
    return path != null ? path : Category.UNKNOWN.code() + SEPARATOR + tag;
  }

  public boolean contains(String tag) {
    return paths.containsKey(tag);
  }

  public int size() {
    return paths.size();
  }
}
