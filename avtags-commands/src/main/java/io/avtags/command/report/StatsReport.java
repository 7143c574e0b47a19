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

package io.avtags.command.report;

import io.avtags.api.model.Category;
import io.avtags.command.aggregate.CategoryCoverage;
import io.avtags.command.pipeline.RunCounters;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Locale;

/// Sample totals and category coverage.
///
/// ```
/// Samples: 10
/// Tagged (all): 8 (80.0%)
/// Tagged (VT>3): 6 (60.0%)
/// FILE: 2 (33.3%)
/// CLASS: 6 (100.0%)
/// ...
/// ```
/// Category percentages are relative to the maltagged samples; a zero denominator prints 0.0%.
public class StatsReport implements Report {

  public static final String SUFFIX = ".stats";

  private static final List<Category> ORDER = List.of(
      Category.FILE, Category.CLASS, Category.BEHAVIOR, Category.FAMILY, Category.UNKNOWN);

  private final RunCounters counters;
  private final CategoryCoverage coverage;
  private final int minEngines;

  public StatsReport(RunCounters counters, CategoryCoverage coverage, int minEngines) {
    this.counters = counters;
    this.coverage = coverage;
    this.minEngines = minEngines;
  }

  @Override
  public String suffix() {
    return SUFFIX;
  }

  @Override
  public void writeTo(Writer writer) throws IOException {
    long samples = counters.reads();
    long maltagged = coverage.maltagged();
    writer.write(String.format(Locale.ROOT, "Samples: %d\n", samples));
    writer.write(line("Tagged (all)", counters.tagged(), samples));
    writer.write(line("Tagged (VT>" + minEngines + ")", maltagged, samples));
    for (Category category : ORDER) {
      writer.write(line(category.code(), coverage.count(category), maltagged));
    }
  }

  private static String line(String name, long count, long denominator) {
    return String.format(Locale.ROOT, "%s: %d (%.1f%%)\n", name, count, percent(count, denominator));
  }

  static double percent(long count, long denominator) {
    return denominator == 0 ? 0.0d : 100.0d * count / denominator;
  }
}
