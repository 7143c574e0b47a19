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

package io.avtags.command.format;

import io.avtags.api.model.RankedTag;
import io.avtags.api.model.SampleDescriptor;
import io.avtags.api.model.VendorLabel;
import io.avtags.labeling.taxonomy.PathTaxonomy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SampleLineFormatter")
class SampleLineFormatterTest {

    private static final SampleDescriptor SAMPLE = new SampleDescriptor("h1", null, null,
        List.of(new VendorLabel("A", "Trojan.Zbot"), new VendorLabel("B", "Zbot"), new VendorLabel("C", "Zbot")),
        List.of("peexe", "overlay"));

    private static final List<RankedTag> TAGS = List.of(new RankedTag("zeus", 3), new RankedTag("trojan", 2));

    @Nested
    @DisplayName("ranked mode")
    class Ranked {

        @Test
        @DisplayName("should print id, label count and ranked tags")
        void shouldPrintRankedTags() {
            SampleLineFormatter formatter = new SampleLineFormatter(OutputMode.ranked, null, null, false, false);

            assertThat(formatter.line("h1", SAMPLE, TAGS, null, false)).isEqualTo("h1\t3\tzeus|3,trojan|2");
        }

        @Test
        @DisplayName("should print an empty tag field for a sample without tags")
        void shouldPrintEmptyTags() {
            SampleLineFormatter formatter = new SampleLineFormatter(OutputMode.ranked, null, null, false, false);

            assertThat(formatter.line("h1", SAMPLE, List.of(), null, false)).isEqualTo("h1\t3\t");
        }

        @Test
        @DisplayName("should render full taxonomy paths")
        void shouldRenderPaths() {
            PathTaxonomy taxonomy = PathTaxonomy.parse(List.of("FAM:zeus", "CLASS:malware:trojan"));
            SampleLineFormatter formatter = new SampleLineFormatter(OutputMode.ranked, taxonomy, null, false, false);

            assertThat(formatter.line("h1", SAMPLE, TAGS, null, false))
                .isEqualTo("h1\t3\tFAM:zeus|3,CLASS:malware:trojan|2");
        }

        @Test
        @DisplayName("should append optional columns in a fixed order")
        void shouldAppendOptionalColumns() {
            SampleLineFormatter formatter = new SampleLineFormatter(
                OutputMode.ranked, null, Map.of("h1", "zeus"), true, true);

            assertThat(formatter.line("h1", SAMPLE, TAGS, null, true))
                .isEqualTo("h1\t3\tzeus|3,trojan|2\tzeus\t1\tpeexe, overlay");
            assertThat(formatter.line("h2", SAMPLE, TAGS, null, false))
                .isEqualTo("h2\t3\tzeus|3,trojan|2\t\t0\tpeexe, overlay");
        }
    }

    @Nested
    @DisplayName("compat mode")
    class Compat {

        @Test
        @DisplayName("should print id and family")
        void shouldPrintFamily() {
            SampleLineFormatter formatter = new SampleLineFormatter(
                OutputMode.compat, null, Map.of("h1", "zeus"), false, true);

            assertThat(formatter.line("h1", SAMPLE, TAGS, "zeus", false)).isEqualTo("h1\tzeus\tzeus");
        }

        @Test
        @DisplayName("should keep an empty ground truth column when no ground truth is loaded")
        void shouldKeepEmptyGroundTruthColumn() {
            SampleLineFormatter formatter = new SampleLineFormatter(OutputMode.compat, null, null, true, false);

            assertThat(formatter.line("h1", SAMPLE, TAGS, "zeus", true)).isEqualTo("h1\tzeus\t\t1");
            assertThat(new SampleLineFormatter(OutputMode.compat, null, null, false, false)
                .line("h1", SAMPLE, TAGS, "zeus", false)).isEqualTo("h1\tzeus\t");
        }

        @Test
        @DisplayName("should require a family")
        void shouldRequireFamily() {
            SampleLineFormatter formatter = new SampleLineFormatter(OutputMode.compat, null, null, false, false);

            assertThatThrownBy(() -> formatter.line("h1", SAMPLE, TAGS, null, false))
                .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    @DisplayName("should print the placeholder line for a sample without labels")
    void shouldPrintNoLabels() {
        assertThat(new SampleLineFormatter(OutputMode.compat, null, null, true, true).noLabels("h1"))
            .isEqualTo("h1\t-\t[]");
    }
}
