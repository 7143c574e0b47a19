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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/// The tags found in one sample's labels, each with the set of engines that produced it.
///
/// Tags and vendors keep their first-seen order, so ranking ties resolve the same way on every
/// run over the same input.
public class TagVendors {

  private final Map<String, Set<String>> vendorsByTag = new LinkedHashMap<>();

  /// create an empty tag/vendor map
  public TagVendors() {
  }

  /// Record that a vendor's label produced a tag. Repeats for the same vendor count once.
  /// @param tag the canonical tag
  /// @param vendor the engine whose label produced it
  /// @return this, for chaining
  public TagVendors add(String tag, String vendor) {
    vendorsByTag.computeIfAbsent(tag, t -> new LinkedHashSet<>()).add(vendor);
    return this;
  }

  /// @return the tags, in first-seen order
  public Set<String> tags() {
    return Collections.unmodifiableSet(vendorsByTag.keySet());
  }

  /// @param tag a tag
  /// @return the vendors supporting the tag, empty if the tag is absent
  public Set<String> vendorsOf(String tag) {
    Set<String> vendors = vendorsByTag.get(tag);
    return vendors == null ? Set.of() : Collections.unmodifiableSet(vendors);
  }

  /// @param tag a tag
  /// @return the number of vendors supporting the tag
  public int support(String tag) {
    Set<String> vendors = vendorsByTag.get(tag);
    return vendors == null ? 0 : vendors.size();
  }

  public boolean isEmpty() {
    return vendorsByTag.isEmpty();
  }

  public int size() {
    return vendorsByTag.size();
  }

  @Override
  public String toString() {
    return vendorsByTag.toString();
  }
}
