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

import io.avtags.api.AvtagsConfigException;
import io.avtags.api.model.EvaluationResult;
import io.avtags.api.model.HashKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Ground truth evaluation")
class ClusteringEvaluatorTest {

    private final ClusteringEvaluator evaluator = new ClusteringEvaluator();

    @Nested
    @DisplayName("ClusteringEvaluator")
    class Evaluate {

        @Test
        @DisplayName("should score a perfect clustering as 1.0")
        void shouldScorePerfectClustering() {
            EvaluationResult result = evaluator.evaluate(
                Map.of("h1", "zeus", "h2", "zeus", "h3", "emotet"),
                Map.of("h1", "zeus", "h2", "zeus", "h3", "emotet", "h4", "other"));

            assertThat(result.precision()).isEqualTo(1.0d);
            assertThat(result.recall()).isEqualTo(1.0d);
            assertThat(result.f1()).isEqualTo(1.0d);
            assertThat(result.compared()).isEqualTo(3);
        }

        @Test
        @DisplayName("should not depend on cluster names")
        void shouldIgnoreClusterNames() {
            EvaluationResult result = evaluator.evaluate(
                Map.of("h1", "zeus", "h2", "zeus"),
                Map.of("h1", "SINGLETON:x", "h2", "SINGLETON:x"));

            assertThat(result.f1()).isEqualTo(1.0d);
        }

        @Test
        @DisplayName("should penalize merged families in precision")
        void shouldPenalizeMerging() {
            EvaluationResult result = evaluator.evaluate(
                Map.of("h1", "zeus", "h2", "zeus", "h3", "emotet"),
                Map.of("h1", "a", "h2", "a", "h3", "a"));

            assertThat(result.precision()).isCloseTo(2.0d / 3.0d, within(1e-9));
            assertThat(result.recall()).isEqualTo(1.0d);
            assertThat(result.f1()).isCloseTo(0.8d, within(1e-9));
        }

        @Test
        @DisplayName("should return zeros when nothing overlaps")
        void shouldHandleNoOverlap() {
            EvaluationResult result = evaluator.evaluate(Map.of("h1", "zeus"), Map.of("h2", "zeus"));

            assertThat(result).isEqualTo(EvaluationResult.empty());
        }
    }

    @Nested
    @DisplayName("GroundTruthFile")
    class GroundTruth {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("should load hash/family lines and guess the hash kind")
        void shouldLoad() throws IOException {
            Path file = Files.writeString(tempDir.resolve("gt.tsv"),
                "d41d8cd98f00b204e9800998ecf8427e\tzeus\n\n0cc175b9c0f1b6a831c399e269772661\temotet\n");

            GroundTruthFile gt = GroundTruthFile.load(file);

            assertThat(gt.size()).isEqualTo(2);
            assertThat(gt.families()).containsEntry("d41d8cd98f00b204e9800998ecf8427e", "zeus");
            assertThat(gt.guessHashKind()).contains(HashKind.MD5);
        }

        @Test
        @DisplayName("should reject a line without a tab")
        void shouldRejectMalformedLine() throws IOException {
            Path file = Files.writeString(tempDir.resolve("gt.tsv"), "abc zeus\n");

            assertThatThrownBy(() -> GroundTruthFile.load(file))
                .isInstanceOf(AvtagsConfigException.class)
                .hasMessageContaining("line 1");
        }

        @Test
        @DisplayName("should not guess a hash kind for an empty ground truth")
        void shouldNotGuessWhenEmpty() {
            assertThat(GroundTruthFile.of(Map.of()).guessHashKind()).isEmpty();
        }
    }
}
