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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Category and result types")
class CategoryTest {

    @Test
    @DisplayName("should resolve taxonomy codes")
    void shouldResolveCodes() {
        assertThat(Category.fromCode("FAM")).isEqualTo(Category.FAMILY);
        assertThat(Category.fromCode("beh")).isEqualTo(Category.BEHAVIOR);
        assertThat(Category.fromCode(" CLASS ")).isEqualTo(Category.CLASS);
        assertThatThrownBy(() -> Category.fromCode("FOO"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should only allow family and unknown tags as family candidates")
    void shouldSelectFamilyCandidates() {
        assertThat(Category.FAMILY.isFamilyCandidate()).isTrue();
        assertThat(Category.UNKNOWN.isFamilyCandidate()).isTrue();
        assertThat(Category.CLASS.isFamilyCandidate()).isFalse();
        assertThat(Category.FILE.isFamilyCandidate()).isFalse();
        assertThat(Category.BEHAVIOR.isFamilyCandidate()).isFalse();
    }

    @Test
    @DisplayName("should render ranked tags as tag|support")
    void shouldRenderRankedTag() {
        assertThat(new RankedTag("zeus", 3)).hasToString("zeus|3");
        assertThatThrownBy(() -> new RankedTag("zeus", -1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should refuse the sample of a skipped extraction")
    void shouldRefuseSkippedSample() {
        ExtractionResult skipped = ExtractionResult.skipped("no scans", "abc");

        assertThat(skipped.isExtracted()).isFalse();
        assertThat(skipped.skipReason()).contains("no scans");
        assertThat(skipped.hint()).contains("abc");
        assertThatThrownBy(skipped::sample).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should expose the sample of a successful extraction")
    void shouldExposeExtractedSample() {
        SampleDescriptor sample = new SampleDescriptor("m", null, null,
            List.of(new VendorLabel("A", "Trojan.Zbot")), List.of());
        ExtractionResult extracted = ExtractionResult.extracted(sample);

        assertThat(extracted.isExtracted()).isTrue();
        assertThat(extracted.sample().labelCount()).isEqualTo(1);
        assertThat(extracted.skipReason()).isEmpty();
    }

    @Test
    @DisplayName("should format evaluation summaries with two decimals")
    void shouldFormatEvaluation() {
        EvaluationResult result = new EvaluationResult(1.0d, 0.5d, 2.0d / 3.0d, 4);

        assertThat(result.summary()).isEqualTo("Precision: 1.00\tRecall: 0.50\tF1-Measure: 0.67");
        assertThat(EvaluationResult.empty().compared()).isZero();
    }
}
