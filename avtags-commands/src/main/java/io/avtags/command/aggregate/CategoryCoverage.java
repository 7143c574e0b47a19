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

package io.avtags.command.aggregate;

import io.avtags.api.model.Category;
import io.avtags.api.model.RankedTag;
import io.avtags.api.spi.Taxonomy;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Counts how many sufficiently detected samples touch each taxonomy category.
 * <p>
 * A sample is "maltagged" when it has at least one ranked tag and more engines labeled it than
 * the configured threshold. Only maltagged samples are recorded here, and each category is
 * counted at most once per sample.
 */
public class CategoryCoverage {

  /// Engines that must agree, exclusive, before a sample counts toward category statistics
  public static final int DEFAULT_MIN_ENGINES = 3;

  private final Map<Category, Long> counts = new EnumMap<>(Category.class);
  private long maltagged;

  public CategoryCoverage() {
    for (Category category : Category.values()) {
      counts.put(category, 0L);
    }
  }

  /// @param rankedTags a sample's ranked tags
  /// @param taxonomy the taxonomy to classify them with
  /// @return the categories the sample touches, empty for a sample without tags
  public static Set<Category> categoriesOf(List<RankedTag> rankedTags, Taxonomy taxonomy) {
    Set<Category> touched = EnumSet.noneOf(Category.class);
    for (RankedTag rankedTag : rankedTags) {
      touched.add(taxonomy.categoryOf(rankedTag.tag()));
    }
    return touched;
  }

  /// Record one maltagged sample.
  /// @param touched the categories it touches
  public void record(Set<Category> touched) {
    maltagged++;
    for (Category category : touched) {
      counts.merge(category, 1L, Long::sum);
    }
  }

  public long maltagged() {
    return maltagged;
  }

  public long count(Category category) {
    return counts.get(category);
  }
}
