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

import java.util.List;

/**
 * Normalized view of one scan report.
 * <p>
 * Any of the three hashes may be {@code null} when the report did not carry it. The label list
 * keeps the order in which the engines appeared in the report and holds only non-empty labels.
 *
 * @param md5      MD5 hex digest, or null
 * @param sha1     SHA-1 hex digest, or null
 * @param sha256   SHA-256 hex digest, or null
 * @param labels   per-engine detection labels
 * @param vendorTags descriptive tags supplied by the report itself (e.g. {@code peexe})
 */
public record SampleDescriptor(
    String md5,
    String sha1,
    String sha256,
    List<VendorLabel> labels,
    List<String> vendorTags
) {

  /**
   * Compact constructor making the collections immutable.
   */
  public SampleDescriptor {
    labels = labels == null ? List.of() : List.copyOf(labels);
    vendorTags = vendorTags == null ? List.of() : List.copyOf(vendorTags);
  }

  /**
   * Selects the hash used to name this sample.
   *
   * @param kind the configured hash kind
   * @return the digest, or {@code null} when the report did not include it
   */
  public String identity(HashKind kind) {
    return switch (kind) {
      case MD5 -> md5;
      case SHA1 -> sha1;
      case SHA256 -> sha256;
    };
  }

  /**
   * @return true when at least one engine produced a label
   */
  public boolean hasLabels() {
    return !labels.isEmpty();
  }

  /**
   * @return the number of engines that produced a label
   */
  public int labelCount() {
    return labels.size();
  }
}
