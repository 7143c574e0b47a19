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
package io.avtags.api.spi;

import io.avtags.api.model.EvaluationResult;

import java.util.Map;

/// Compares predicted sample families against a ground truth.
@FunctionalInterface
public interface GroundTruthEvaluator {

  /// @param groundTruth sample hash to true family
  /// @param predicted sample hash to predicted family
  /// @return precision, recall and F1 of the predicted clustering
  EvaluationResult evaluate(Map<String, String> groundTruth, Map<String, String> predicted);
}
