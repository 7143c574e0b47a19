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

import io.avtags.api.model.HashKind;
import io.avtags.command.aggregate.CategoryCoverage;
import io.avtags.command.format.OutputMode;

import java.util.Objects;

/**
 * Immutable settings of one aggregation run, assembled once from the command line.
 *
 * @param hashKind          hash used to name samples
 * @param outputMode        per-sample line format
 * @param fullPaths         render tags as taxonomy paths
 * @param pupColumn         classify samples as PUP and print the flag
 * @param vendorTagsColumn  print the report's own descriptive tags
 * @param aliasDetect       accumulate tag co-occurrence for the alias report
 * @param categoryStats     accumulate category coverage for the stats report
 * @param vendorTagStats    accumulate per-vendor tag counts for the vendor-tag report
 * @param evaluate          a ground truth is loaded; select families for evaluation
 * @param minEngines        labeled engines a sample needs, exclusive, to count as maltagged
 * @param progressInterval  records between progress updates, 0 to disable
 */
public record PipelineOptions(
    HashKind hashKind,
    OutputMode outputMode,
    boolean fullPaths,
    boolean pupColumn,
    boolean vendorTagsColumn,
    boolean aliasDetect,
    boolean categoryStats,
    boolean vendorTagStats,
    boolean evaluate,
    int minEngines,
    int progressInterval
) {

  /// Records between progress updates unless configured otherwise
  public static final int DEFAULT_PROGRESS_INTERVAL = 100;

  public PipelineOptions {
    Objects.requireNonNull(hashKind, "hashKind");
    Objects.requireNonNull(outputMode, "outputMode");
    if (minEngines < 0) {
      throw new IllegalArgumentException("minEngines must be non-negative, was " + minEngines);
    }
    if (progressInterval < 0) {
      throw new IllegalArgumentException(
          "progressInterval must be non-negative, was " + progressInterval);
    }
  }

  /// @return true when a representative family must be selected for each sample
  public boolean needsFamily() {
    return outputMode == OutputMode.compat || evaluate;
  }

  public static Builder builder() {
    return new Builder();
  }

  /// Builder with the defaults of a plain run: md5 names, ranked output, no optional features.
  public static final class Builder {
    private HashKind hashKind = HashKind.MD5;
    private OutputMode outputMode = OutputMode.ranked;
    private boolean fullPaths;
    private boolean pupColumn;
    private boolean vendorTagsColumn;
    private boolean aliasDetect;
    private boolean categoryStats;
    private boolean vendorTagStats;
    private boolean evaluate;
    private int minEngines = CategoryCoverage.DEFAULT_MIN_ENGINES;
    private int progressInterval = DEFAULT_PROGRESS_INTERVAL;

    private Builder() {
    }

    public Builder hashKind(HashKind hashKind) {
      this.hashKind = hashKind;
      return this;
    }

    public Builder outputMode(OutputMode outputMode) {
      this.outputMode = outputMode;
      return this;
    }

    public Builder fullPaths(boolean fullPaths) {
      this.fullPaths = fullPaths;
      return this;
    }

    public Builder pupColumn(boolean pupColumn) {
      this.pupColumn = pupColumn;
      return this;
    }

    public Builder vendorTagsColumn(boolean vendorTagsColumn) {
      this.vendorTagsColumn = vendorTagsColumn;
      return this;
    }

    public Builder aliasDetect(boolean aliasDetect) {
      this.aliasDetect = aliasDetect;
      return this;
    }

    public Builder categoryStats(boolean categoryStats) {
      this.categoryStats = categoryStats;
      return this;
    }

    public Builder vendorTagStats(boolean vendorTagStats) {
      this.vendorTagStats = vendorTagStats;
      return this;
    }

    public Builder evaluate(boolean evaluate) {
      this.evaluate = evaluate;
      return this;
    }

    public Builder minEngines(int minEngines) {
      this.minEngines = minEngines;
      return this;
    }

    public Builder progressInterval(int progressInterval) {
      this.progressInterval = progressInterval;
      return this;
    }

    public PipelineOptions build() {
      return new PipelineOptions(hashKind, outputMode, fullPaths, pupColumn, vendorTagsColumn,
          aliasDetect, categoryStats, vendorTagStats, evaluate, minEngines, progressInterval);
    }
  }
}
