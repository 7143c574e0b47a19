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

import io.avtags.api.model.RankedTag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Corpus-wide tag frequencies and pairwise co-occurrence counts, used to spot tags that are
 * aliases of one another.
 * <p>
 * Each sample adds one to the count of every distinct tag it carries and one to every unordered
 * pair of its distinct tags, so {@code pairCount(x, y) <= min(tokenCount(x), tokenCount(y))}
 * holds after every {@link #add(List)}.
 */
public class AliasCounter {

  private final Map<String, Long> tokenCounts = new HashMap<>();
  private final Map<TagPair, Long> pairCounts = new HashMap<>();

  /// Count the tags of one sample. Repeated tags in the list count once.
  /// @param rankedTags the sample's ranked tags
  public void add(List<RankedTag> rankedTags) {
    Set<String> distinct = new LinkedHashSet<>();
    for (RankedTag rankedTag : rankedTags) {
      distinct.add(rankedTag.tag());
    }
    List<String> seen = new ArrayList<>(distinct.size());
    for (String tag : distinct) {
      tokenCounts.merge(tag, 1L, Long::sum);
      for (String previous : seen) {
        pairCounts.merge(TagPair.of(previous, tag), 1L, Long::sum);
      }
      seen.add(tag);
    }
  }

  public long tokenCount(String tag) {
    return tokenCounts.getOrDefault(tag, 0L);
  }

  public long pairCount(String a, String b) {
    if (a.equals(b)) {
      return 0L;
    }
    return pairCounts.getOrDefault(TagPair.of(a, b), 0L);
  }

  public Map<String, Long> tokenCounts() {
    return Collections.unmodifiableMap(tokenCounts);
  }

  public Map<TagPair, Long> pairCounts() {
    return Collections.unmodifiableMap(pairCounts);
  }

  /**
   * Compute the containment statistics. Called once, after the stream ends.
   *
   * @return one row per counted pair, ascending by co-occurrence count, ties in pair order
   */
  public List<AliasRow> rows() {
    List<Map.Entry<TagPair, Long>> entries = new ArrayList<>(pairCounts.entrySet());
    entries.sort(Map.Entry.<TagPair, Long>comparingByValue()
        .thenComparing(Map.Entry.<TagPair, Long>comparingByKey()));
    List<AliasRow> rows = new ArrayList<>(entries.size());
    for (Map.Entry<TagPair, Long> entry : entries) {
      TagPair pair = entry.getKey();
      long c = entry.getValue();
      long n1 = tokenCount(pair.first());
      long n2 = tokenCount(pair.second());
      if (n1 < n2) {
        rows.add(new AliasRow(pair.first(), pair.second(), n1, n2, c, (double) c / n1, (double) c / n2));
      } else {
        rows.add(new AliasRow(pair.second(), pair.first(), n2, n1, c, (double) c / n2, (double) c / n1));
      }
    }
    return rows;
  }
}
