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

package io.avtags.api.model;

import java.util.Locale;

/// Clustering accuracy of predicted families against a ground truth, as fractions in [0, 1].
/// @param precision the precision
/// @param recall the recall
/// @param f1 the harmonic mean of precision and recall
/// @param compared the number of samples present in both maps
public record EvaluationResult(double precision, double recall, double f1, int compared) {

  /// @return the result reported when no sample could be compared
  public static EvaluationResult empty() {
    return new EvaluationResult(0.0d, 0.0d, 0.0d, 0);
  }

  /// @return the line printed at the end of a run
  public String summary() {
    return String.format(Locale.ROOT, "Precision: %.2f\tRecall: %.2f\tF1-Measure: %.2f", precision, recall, f1);
  }
}
