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
package io.avtags.api.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.avtags.api.model.ExtractionResult;

/// Converts one decoded report record into a {@link io.avtags.api.model.SampleDescriptor}.
///
/// Implementations fail softly: a record that parses but has no usable scan data yields
/// {@link ExtractionResult#skipped(String, String)}, never an exception.
@FunctionalInterface
public interface SampleExtractor {

  /// @param record one decoded JSON record
  /// @return the extracted sample, or the reason the record was skipped
  ExtractionResult extract(JsonNode record);
}
