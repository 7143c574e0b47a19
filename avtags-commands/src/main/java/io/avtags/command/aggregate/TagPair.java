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

import java.util.Comparator;
import java.util.Objects;

/// An unordered pair of distinct tags, stored with the lexicographically smaller tag first so that
/// {@code of(a, b)} and {@code of(b, a)} are equal.
/// @param first the smaller tag
/// @param second the larger tag
public record TagPair(String first, String second) implements Comparable<TagPair> {

  private static final Comparator<TagPair> ORDER =
      Comparator.comparing(TagPair::first).thenComparing(TagPair::second);

  public TagPair {
    Objects.requireNonNull(first, "first");
    Objects.requireNonNull(second, "second");
    if (first.compareTo(second) >= 0) {
      throw new IllegalArgumentException(
          "TagPair must hold two distinct tags in order, got (" + first + ", " + second + ")");
    }
  }

  /// @param a a tag
  /// @param b a different tag
  /// @return the canonical pair
  public static TagPair of(String a, String b) {
    return a.compareTo(b) < 0 ? new TagPair(a, b) : new TagPair(b, a);
  }

  @Override
  public int compareTo(TagPair other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return "(" + first + "," + second + ")";
  }
}
