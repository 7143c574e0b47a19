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

package io.avtags.command.aggregate;

import io.avtags.api.model.TagVendors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/// For each tag, how many samples each vendor produced it in.
public class VendorTagCounter {

  private final SortedMap<String, Map<String, Long>> counts = new TreeMap<>();

  /// @param tagVendors one sample's tags with their vendors
  public void add(TagVendors tagVendors) {
    for (String tag : tagVendors.tags()) {
      Map<String, Long> byVendor = counts.computeIfAbsent(tag, t -> new HashMap<>());
      for (String vendor : tagVendors.vendorsOf(tag)) {
        byVendor.merge(vendor, 1L, Long::sum);
      }
    }
  }

  /// @return the tags in lexicographic order
  public List<String> tags() {
    return new ArrayList<>(counts.keySet());
  }

  /// @param tag a tag
  /// @return vendor frequencies, highest first, ties by vendor name
  public List<Map.Entry<String, Long>> vendorsOf(String tag) {
    List<Map.Entry<String, Long>> entries =
        new ArrayList<>(counts.getOrDefault(tag, Collections.emptyMap()).entrySet());
    entries.sort(Map.Entry.<String, Long>comparingByValue().reversed()
        .thenComparing(Map.Entry.<String, Long>comparingByKey()));
    return entries;
  }

  public long count(String tag, String vendor) {
    return counts.getOrDefault(tag, Collections.emptyMap()).getOrDefault(vendor, 0L);
  }

  public boolean isEmpty() {
    return counts.isEmpty();
  }
}
