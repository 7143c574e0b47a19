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

import io.avtags.api.model.RankedTag;
import io.avtags.api.model.SampleDescriptor;
import io.avtags.api.model.TagVendors;
import io.avtags.api.model.VendorLabel;
import io.avtags.api.spi.TagRanker;
import io.avtags.labeling.taxonomy.PathTaxonomy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The default {@link TagRanker}, driven by tagging rules, expansion rules and a taxonomy.
 * <p>
 * A token becomes a tag when a tagging rule renames it, when the taxonomy lists it, or, failing
 * both, when it looks like a family name: at least {@value #MIN_CANDIDATE_LENGTH} characters and
 * at least one letter. Each tag is then expanded through the expansion rules. Ranking keeps the
 * tags supported by at least {@code minSupport} engines, by descending support; ties keep
 * first-seen order.
 */
public class RuleTagRanker implements TagRanker {

  /// Tags seen by a single engine are not trusted by default
  public static final int DEFAULT_MIN_SUPPORT = 2;

  static final int MIN_CANDIDATE_LENGTH = 4;

  private final TaggingRules tagging;
  private final ExpansionRules expansion;
  private final PathTaxonomy taxonomy;
  private final LabelTokenizer tokenizer = new LabelTokenizer();
  private final int minSupport;

  public RuleTagRanker(TaggingRules tagging, ExpansionRules expansion, PathTaxonomy taxonomy,
                       int minSupport) {
    if (minSupport < 1) {
      throw new IllegalArgumentException("minSupport must be at least 1, was " + minSupport);
    }
    this.tagging = tagging;
    this.expansion = expansion;
    this.taxonomy = taxonomy;
    this.minSupport = minSupport;
  }

  public RuleTagRanker(TaggingRules tagging, ExpansionRules expansion, PathTaxonomy taxonomy) {
    this(tagging, expansion, taxonomy, DEFAULT_MIN_SUPPORT);
  }

  @Override
  public TagVendors tagVendors(SampleDescriptor sample) {
    TagVendors tagVendors = new TagVendors();
    for (VendorLabel label : sample.labels()) {
      for (String token : tokenizer.tokens(label.label())) {
        Optional<String> tag = tagOf(token);
        if (tag.isPresent()) {
          for (String expanded : expansion.expand(tag.get())) {
            tagVendors.add(expanded, label.vendor());
          }
        }
      }
    }
    return tagVendors;
  }

  @Override
  public List<RankedTag> rank(TagVendors tagVendors) {
    List<RankedTag> ranked = new ArrayList<>();
    for (String tag : tagVendors.tags()) {
      int support = tagVendors.support(tag);
      if (support >= minSupport) {
        ranked.add(new RankedTag(tag, support));
      }
    }
    // List.sort is stable, so equal support keeps first-seen order
    ranked.sort(Comparator.comparingInt(RankedTag::support).reversed());
    return ranked;
  }

  Optional<String> tagOf(String token) {
    if (tagging.isIgnored(token)) {
      return Optional.empty();
    }
    Optional<String> renamed = tagging.canonicalOf(token);
    if (renamed.isPresent()) {
      return renamed;
    }
    if (taxonomy.contains(token) || isFamilyCandidate(token)) {
      return Optional.of(token);
    }
    return Optional.empty();
  }

  static boolean isFamilyCandidate(String token) {
    if (token.length() < MIN_CANDIDATE_LENGTH) {
      return false;
    }
    for (int i = 0; i < token.length(); i++) {
      if (Character.isLetter(token.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
