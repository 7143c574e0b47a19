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

import java.util.Objects;

/// One raw detection label as reported by a single anti-malware engine.
///
/// @param vendor the engine name, as it appears in the report
/// @param label  the raw detection string
public record VendorLabel(String vendor, String label) {
  public VendorLabel {
    Objects.requireNonNull(vendor, "vendor");
    Objects.requireNonNull(label, "label");
  }

  @Override
  public String toString() {
    return vendor + ":" + label;
  }
}
