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
import io.avtags.api.model.ExtractionResult;
import io.avtags.api.model.SampleDescriptor;
import io.avtags.api.model.VendorLabel;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Reads VirusTotal v3 file objects.
///
/// Everything of interest lives under {@code data.attributes}; engine results are in
/// {@code last_analysis_results}, and only results in the {@code malicious} category contribute a
/// label.
public class VtV3SampleExtractor extends AbstractReportExtractor {

  private static final String MALICIOUS = "malicious";

  public VtV3SampleExtractor(Set<String> allowedVendors) {
    super(allowedVendors);
  }

  public VtV3SampleExtractor() {
    this(null);
  }

  @Override
  protected ExtractionResult extractObject(JsonNode record) {
    JsonNode attributes = record.path("data").path("attributes");
    JsonNode results = attributes.get("last_analysis_results");
    if (results == null || !results.isObject()) {
      String hint = attributes.isObject() ? text(attributes, "md5") : null;
      return ExtractionResult.skipped("no last_analysis_results", hint);
    }
    List<VendorLabel> labels = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> fields = results.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> entry = fields.next();
      JsonNode result = entry.getValue();
      if (!MALICIOUS.equals(text(result, "category")) || !isAllowed(entry.getKey())) {
        continue;
      }
      String label = cleanLabel(text(result, "result"));
      if (!label.isEmpty()) {
        labels.add(new VendorLabel(entry.getKey(), label));
      }
    }
    return ExtractionResult.extracted(new SampleDescriptor(
        text(attributes, "md5"),
        text(attributes, "sha1"),
        text(attributes, "sha256"),
        labels,
        textList(attributes, "tags")
    ));
  }
}
