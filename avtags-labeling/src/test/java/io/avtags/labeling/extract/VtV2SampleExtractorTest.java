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

package io.avtags.labeling.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.avtags.api.model.ExtractionResult;
import io.avtags.api.model.SampleDescriptor;
import io.avtags.api.model.VendorLabel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("VtV2SampleExtractor")
class VtV2SampleExtractorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Test
    @DisplayName("should keep only detected, non-empty results")
    void shouldKeepDetectedResults() throws Exception {
        JsonNode record = json("""
            {"md5":"aa","sha1":"bb","sha256":"cc","tags":["peexe","overlay"],
             "scans":{
               "Kaspersky":{"detected":true,"result":"Trojan-Spy.Win32.Zbot.abc"},
               "ESET":{"detected":false,"result":null},
               "Avira":{"detected":true,"result":"  "},
               "Sophos":{"detected":true,"result":"Troj/Zbot-AB"}}}
            """);

        ExtractionResult result = new VtV2SampleExtractor().extract(record);

        assertThat(result.isExtracted()).isTrue();
        SampleDescriptor sample = result.sample();
        assertThat(sample.md5()).isEqualTo("aa");
        assertThat(sample.sha1()).isEqualTo("bb");
        assertThat(sample.sha256()).isEqualTo("cc");
        assertThat(sample.labels()).containsExactly(
            new VendorLabel("Kaspersky", "Trojan-Spy.Win32.Zbot.abc"),
            new VendorLabel("Sophos", "Troj/Zbot-AB"));
        assertThat(sample.vendorTags()).containsExactly("peexe", "overlay");
    }

    @Test
    @DisplayName("should extract a sample without labels when the scans object is empty")
    void shouldAllowEmptyScans() throws Exception {
        ExtractionResult result = new VtV2SampleExtractor().extract(json("{\"md5\":\"aa\",\"scans\":{}}"));

        assertThat(result.isExtracted()).isTrue();
        assertThat(result.sample().hasLabels()).isFalse();
    }

    @Test
    @DisplayName("should skip records without scans and keep the md5 as hint")
    void shouldSkipMissingScans() throws Exception {
        ExtractionResult result = new VtV2SampleExtractor().extract(json("{\"md5\":\"aa\"}"));

        assertThat(result.isExtracted()).isFalse();
        assertThat(result.hint()).contains("aa");
        assertThat(result.skipReason()).contains("no scans");
    }

    @Test
    @DisplayName("should skip records that are not objects")
    void shouldSkipNonObjects() throws Exception {
        assertThat(new VtV2SampleExtractor().extract(json("[1,2]")).isExtracted()).isFalse();
    }

    @Test
    @DisplayName("should honor the engine allow-list case-insensitively")
    void shouldFilterVendors() throws Exception {
        JsonNode record = json("""
            {"md5":"aa","scans":{
               "Kaspersky":{"detected":true,"result":"Trojan.Zbot"},
               "Sophos":{"detected":true,"result":"Troj/Zbot"}}}
            """);

        SampleDescriptor sample = new VtV2SampleExtractor(Set.of("kaspersky")).extract(record).sample();

        assertThat(sample.labels()).extracting(VendorLabel::vendor).containsExactly("Kaspersky");
    }

    @Test
    @DisplayName("should drop non-printable characters from labels")
    void shouldCleanLabels() {
        assertThat(AbstractReportExtractor.cleanLabel(" Trojan\u00e9.Zbot\u0001 ")).isEqualTo("Trojan.Zbot");
        assertThat(AbstractReportExtractor.cleanLabel(null)).isEmpty();
    }
}
