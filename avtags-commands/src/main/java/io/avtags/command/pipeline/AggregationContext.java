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

import io.avtags.command.aggregate.AliasCounter;
import io.avtags.command.aggregate.CategoryCoverage;
import io.avtags.command.aggregate.VendorTagCounter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * All state accumulated over one pass: run counters, alias counts, category coverage, vendor-tag
 * counts and the representative family of each sample.
 * <p>
 * Created empty before the pass, changed only through {@link #commit(SampleOutcome)} and the
 * counter hooks, and read by the reporters once the pass is over. Not thread safe; a context
 * belongs to exactly one run.
 */
public class AggregationContext {

  private final PipelineOptions options;
  private final RunCounters counters = new RunCounters();
  private final AliasCounter aliases = new AliasCounter();
  private final CategoryCoverage coverage = new CategoryCoverage();
  private final VendorTagCounter vendorTags = new VendorTagCounter();
  private final Map<String, String> firstTokens = new LinkedHashMap<>();

  public AggregationContext(PipelineOptions options) {
    this.options = options;
  }

  /// Apply one sample's contribution to every accumulator.
  /// @param outcome the fully computed outcome of the sample
  public void commit(SampleOutcome outcome) {
    counters.countProcessed(outcome.hasTags());
    if (outcome.tagVendors() != null) {
      vendorTags.add(outcome.tagVendors());
    }
    if (options.aliasDetect()) {
      aliases.add(outcome.rankedTags());
    }
    if (options.categoryStats() && outcome.maltagged()) {
      coverage.record(outcome.categories());
    }
    if (outcome.family() != null) {
      firstTokens.put(outcome.identity(), outcome.family());
    }
  }

  public PipelineOptions options() {
    return options;
  }

  public RunCounters counters() {
    return counters;
  }

  public AliasCounter aliases() {
    return aliases;
  }

  public CategoryCoverage coverage() {
    return coverage;
  }

  public VendorTagCounter vendorTags() {
    return vendorTags;
  }

  /// @return sample hash to representative family, in processing order
  public Map<String, String> firstTokens() {
    return Collections.unmodifiableMap(firstTokens);
  }
}
