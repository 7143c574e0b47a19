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

package io.avtags.labeling.eval;

import io.avtags.api.model.EvaluationResult;
import io.avtags.api.spi.GroundTruthEvaluator;

import java.util.HashMap;
import java.util.Map;

/**
 * Precision, recall and F1 of a predicted clustering against ground-truth families.
 * <p>
 * Only samples present in both maps are compared; call that count N.
 * <ul>
 *   <li>precision: for each predicted cluster, the size of its largest overlap with a single
 *   ground-truth family, summed and divided by N</li>
 *   <li>recall: for each ground-truth family, the size of its largest overlap with a single
 *   predicted cluster, summed and divided by N</li>
 * </ul>
 * All three values are zero when N is zero.
 */
public class ClusteringEvaluator implements GroundTruthEvaluator {

  @Override
  public EvaluationResult evaluate(Map<String, String> groundTruth, Map<String, String> predicted) {
    // predicted cluster -> (true family -> overlap), and the transpose
    Map<String, Map<String, Integer>> byPredicted = new HashMap<>();
    Map<String, Map<String, Integer>> byTruth = new HashMap<>();
    int compared = 0;
    for (Map.Entry<String, String> entry : predicted.entrySet()) {
      String truth = groundTruth.get(entry.getKey());
      if (truth == null) {
        continue;
      }
      compared++;
      byPredicted.computeIfAbsent(entry.getValue(), k -> new HashMap<>()).merge(truth, 1, Integer::sum);
      byTruth.computeIfAbsent(truth, k -> new HashMap<>()).merge(entry.getValue(), 1, Integer::sum);
    }
    if (compared == 0) {
      return EvaluationResult.empty();
    }
    double precision = (double) sumOfLargestOverlaps(byPredicted) / compared;
    double recall = (double) sumOfLargestOverlaps(byTruth) / compared;
    double f1 = precision + recall == 0.0d ? 0.0d : 2.0d * precision * recall / (precision + recall);
    return new EvaluationResult(precision, recall, f1, compared);
  }

  private static long sumOfLargestOverlaps(Map<String, Map<String, Integer>> overlaps) {
    long sum = 0;
    for (Map<String, Integer> counts : overlaps.values()) {
      sum += counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }
    return sum;
  }
}
