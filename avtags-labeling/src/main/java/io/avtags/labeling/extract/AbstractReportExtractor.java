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
import io.avtags.api.spi.SampleExtractor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Shared plumbing for the report layouts: the optional engine allow-list, label cleanup and
 * null-safe field access.
 */
public abstract class AbstractReportExtractor implements SampleExtractor {

  private final Set<String> allowedVendors;

  /**
   * @param allowedVendors engines whose labels are kept, compared case-insensitively; null or
   *                       empty keeps every engine
   */
  protected AbstractReportExtractor(Set<String> allowedVendors) {
    this.allowedVendors = allowedVendors == null ? Set.of()
        : allowedVendors.stream().map(v -> v.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
  }

  @Override
  public final ExtractionResult extract(JsonNode record) {
    if (record == null || !record.isObject()) {
      return ExtractionResult.skipped("record is not a JSON object", null);
    }
    return extractObject(record);
  }

  /// @param record a JSON object
  /// @return the extraction result for the layout
  protected abstract ExtractionResult extractObject(JsonNode record);

  protected boolean isAllowed(String vendor) {
    return allowedVendors.isEmpty() || allowedVendors.contains(vendor.toLowerCase(Locale.ROOT));
  }

  /// Strip characters outside printable ASCII and surrounding whitespace.
  /// @param label a raw label
  /// @return the cleaned label, empty if nothing printable remains
  public static String cleanLabel(String label) {
    if (label == null) {
      return "";
    }
    StringBuilder sb = new StringBuilder(label.length());
    for (int i = 0; i < label.length(); i++) {
      char c = label.charAt(i);
      if ((c >= 0x20 && c < 0x7f) || c == '\t') {
        sb.append(c);
      }
    }
    return sb.toString().strip();
  }

  /// @return the field's text, or null when absent, null or not a scalar
  protected static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.isContainerNode()) {
      return null;
    }
    String text = value.asText().strip();
    return text.isEmpty() ? null : text;
  }

  /// @return the textual elements of an array field, empty when the field is absent
  protected static List<String> textList(JsonNode node, String field) {
    JsonNode value = node.get(field);
    List<String> out = new ArrayList<>();
    if (value != null && value.isArray()) {
      for (JsonNode element : value) {
        if (element.isValueNode() && !element.isNull()) {
          out.add(element.asText());
        }
      }
    }
    return out;
  }
}
