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

/// A canonical tag with the number of engines that contributed it to one sample.
/// @param tag the canonical tag
/// @param support the number of distinct engines supporting the tag
public record RankedTag(String tag, int support) {
  public RankedTag {
    Objects.requireNonNull(tag, "tag");
    if (support < 0) {
      throw new IllegalArgumentException("support must be non-negative, was " + support);
    }
  }

  @Override
  public String toString() {
    return tag + "|" + support;
  }
}
