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

package io.avtags.labeling;

import io.avtags.labeling.rules.ExpansionRules;
import io.avtags.labeling.rules.RuleTagRanker;
import io.avtags.labeling.rules.TaggingRules;
import io.avtags.labeling.taxonomy.PathTaxonomy;

import java.nio.file.Path;

/// The three rule sets the default collaborators are built from.
///
/// @param tagging token to tag rules
/// @param expansion tag implication rules
/// @param taxonomy tag categories and paths
public record LabelingRules(TaggingRules tagging, ExpansionRules expansion, PathTaxonomy taxonomy) {

  /// Load all rule sets. A null path selects the bundled default, {@code /dev/null} an empty set.
  /// @param tagPath tagging rules file
  /// @param expPath expansion rules file
  /// @param taxPath taxonomy file
  /// @return the loaded rules
  public static LabelingRules load(Path tagPath, Path expPath, Path taxPath) {
    return new LabelingRules(
        TaggingRules.load(tagPath),
        ExpansionRules.load(expPath),
        PathTaxonomy.load(taxPath)
    );
  }

  /// @param minSupport the minimum number of engines for a tag to be ranked
  /// @return a ranker over these rules
  public RuleTagRanker ranker(int minSupport) {
    return new RuleTagRanker(tagging, expansion, taxonomy, minSupport);
  }
}
