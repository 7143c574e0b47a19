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

import io.avtags.api.model.RankedTag;
import io.avtags.api.spi.Taxonomy;

import java.util.List;

/// Picks one representative family label per sample: the highest-ranked tag that is a family or
/// is unknown to the taxonomy, else a singleton label unique to the sample.
public class FamilySelector {

  public static final String SINGLETON_PREFIX = "SINGLETON:";

  private final Taxonomy taxonomy;

  public FamilySelector(Taxonomy taxonomy) {
    this.taxonomy = taxonomy;
  }

  /// @param rankedTags the sample's ranked tags
  /// @param identity the sample's hash
  /// @return the representative label, never empty
  public String select(List<RankedTag> rankedTags, String identity) {
    for (RankedTag rankedTag : rankedTags) {
      if (taxonomy.categoryOf(rankedTag.tag()).isFamilyCandidate()) {
        return rankedTag.tag();
      }
    }
    return singleton(identity);
  }

  public static String singleton(String identity) {
    return SINGLETON_PREFIX + identity;
  }
}
