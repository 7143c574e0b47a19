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

package io.avtags.command.common;

import io.avtags.api.spi.SampleExtractor;
import io.avtags.labeling.extract.LabelSampleExtractor;
import io.avtags.labeling.extract.VtV2SampleExtractor;
import io.avtags.labeling.extract.VtV3SampleExtractor;

import java.util.Set;

/// The layout of the input records. All inputs of one run share a layout.
public enum ReportLayout {
  /// VirusTotal v2 file reports
  vt2,
  /// VirusTotal v3 file objects
  vt3,
  /// the simplified {@code av_labels} schema
  label;

  /// @param allowedVendors engines to keep labels from, empty for all
  /// @return an extractor for this layout
  public SampleExtractor extractor(Set<String> allowedVendors) {
    return switch (this) {
      case vt2 -> new VtV2SampleExtractor(allowedVendors);
      case vt3 -> new VtV3SampleExtractor(allowedVendors);
      case label -> new LabelSampleExtractor(allowedVendors);
    };
  }
}
