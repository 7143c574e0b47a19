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

package io.avtags.command.pipeline;

import io.avtags.api.model.Category;
import io.avtags.api.model.RankedTag;
import io.avtags.api.model.SampleDescriptor;
import io.avtags.api.model.TagVendors;
import io.avtags.api.spi.PupClassifier;
import io.avtags.api.spi.TagRanker;
import io.avtags.api.spi.Taxonomy;
import io.avtags.command.aggregate.CategoryCoverage;
import io.avtags.command.aggregate.FamilySelector;
import io.avtags.command.format.SampleLineFormatter;

import java.util.List;
import java.util.Map;
import java.util.Set;

/// Computes a {@link SampleOutcome} for one labeled sample. Holds no run state; anything it
/// throws leaves the accumulators untouched.
public class SampleProcessor {

  private final PipelineOptions options;
  private final TagRanker ranker;
  private final Taxonomy taxonomy;
  private final PupClassifier pupClassifier;
  private final FamilySelector familySelector;
  private final SampleLineFormatter formatter;

  /// @param options run settings
  /// @param ranker tag ranker
  /// @param taxonomy taxonomy for categories, paths and family selection
  /// @param pupClassifier PUP classifier, consulted only when the PUP column is on
  /// @param groundTruth ground truth for the output column, null when none is loaded
  public SampleProcessor(PipelineOptions options, TagRanker ranker, Taxonomy taxonomy,
                         PupClassifier pupClassifier, Map<String, String> groundTruth) {
    this.options = options;
    this.ranker = ranker;
    this.taxonomy = taxonomy;
    this.pupClassifier = pupClassifier;
    this.familySelector = new FamilySelector(taxonomy);
    this.formatter = new SampleLineFormatter(
        options.outputMode(),
        options.fullPaths() ? taxonomy : null,
        groundTruth,
        options.pupColumn(),
        options.vendorTagsColumn());
  }

  /// @param identity the sample's hash
  /// @return the line for a sample whose report has no labels at all
  public String noLabelsLine(String identity) {
    return formatter.noLabels(identity);
  }

  /// @param identity the sample's hash
  /// @param sample a sample with at least one label
  /// @return what the sample contributes to the run
  public SampleOutcome process(String identity, SampleDescriptor sample) {
    TagVendors tagVendors = ranker.tagVendors(sample);
    List<RankedTag> rankedTags = List.copyOf(ranker.rank(tagVendors));

    boolean maltagged = !rankedTags.isEmpty() && sample.labelCount() > options.minEngines();
    Set<Category> categories = maltagged && options.categoryStats()
        ? CategoryCoverage.categoriesOf(rankedTags, taxonomy)
        : Set.of();

    boolean pup = options.pupColumn() && pupClassifier.isPup(rankedTags);
    String family = options.needsFamily() ? familySelector.select(rankedTags, identity) : null;
    String line = formatter.line(identity, sample, rankedTags, family, pup);

    return new SampleOutcome(identity, line, rankedTags,
        options.vendorTagStats() ? tagVendors : null, maltagged, categories, family);
  }
}
