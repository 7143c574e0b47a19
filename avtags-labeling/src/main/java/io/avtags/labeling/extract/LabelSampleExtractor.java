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
import java.util.List;
import java.util.Set;

/// Reads the simplified label schema:
/// {@code {"md5":..,"sha1":..,"sha256":..,"scan_date":..,"av_labels":[["vendor","label"],..]}}.
///
/// Pairs that are not two-element arrays are ignored. Descriptive tags are read from an optional
/// {@code vt_tags} array.
public class LabelSampleExtractor extends AbstractReportExtractor {

  public LabelSampleExtractor(Set<String> allowedVendors) {
    super(allowedVendors);
  }

  public LabelSampleExtractor() {
    this(null);
  }

  @Override
  protected ExtractionResult extractObject(JsonNode record) {
    JsonNode pairs = record.get("av_labels");
    if (pairs == null || !pairs.isArray()) {
      return ExtractionResult.skipped("no av_labels", text(record, "md5"));
    }
    List<VendorLabel> labels = new ArrayList<>();
    for (JsonNode pair : pairs) {
      if (!pair.isArray() || pair.size() != 2 || !pair.get(0).isTextual()) {
        continue;
      }
      String vendor = pair.get(0).asText().strip();
      if (vendor.isEmpty() || !isAllowed(vendor)) {
        continue;
      }
      String label = cleanLabel(pair.get(1).isNull() ? null : pair.get(1).asText());
      if (!label.isEmpty()) {
        labels.add(new VendorLabel(vendor, label));
      }
    }
    return ExtractionResult.extracted(new SampleDescriptor(
        text(record, "md5"),
        text(record, "sha1"),
        text(record, "sha256"),
        labels,
        textList(record, "vt_tags")
    ));
  }
}
