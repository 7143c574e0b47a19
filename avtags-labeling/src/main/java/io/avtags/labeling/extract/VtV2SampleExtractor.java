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

/// Reads VirusTotal v2 file reports.
///
/// Hashes and {@code tags} sit at the top level. Each entry of the {@code scans} object is an
/// engine result; only entries with {@code detected: true} and a non-empty {@code result}
/// contribute a label.
///
/// ```json
/// {"md5":"...","sha1":"...","sha256":"...","tags":["peexe"],
///  "scans":{"Kaspersky":{"detected":true,"result":"Trojan.Win32.Zbot.abc"}}}
/// ```
public class VtV2SampleExtractor extends AbstractReportExtractor {

  public VtV2SampleExtractor(Set<String> allowedVendors) {
    super(allowedVendors);
  }

  public VtV2SampleExtractor() {
    this(null);
  }

  @Override
  protected ExtractionResult extractObject(JsonNode record) {
    JsonNode scans = record.get("scans");
    if (scans == null || !scans.isObject()) {
      return ExtractionResult.skipped("no scans", text(record, "md5"));
    }
    List<VendorLabel> labels = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> fields = scans.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> entry = fields.next();
      JsonNode result = entry.getValue();
      if (!result.path("detected").asBoolean(false) || !isAllowed(entry.getKey())) {
        continue;
      }
      String label = cleanLabel(text(result, "result"));
      if (!label.isEmpty()) {
        labels.add(new VendorLabel(entry.getKey(), label));
      }
    }
    return ExtractionResult.extracted(new SampleDescriptor(
        text(record, "md5"),
        text(record, "sha1"),
        text(record, "sha256"),
        labels,
        textList(record, "tags")
    ));
  }
}
