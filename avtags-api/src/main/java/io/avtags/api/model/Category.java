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

import java.util.Locale;

/// Taxonomy categories a tag can belong to. The short code is the prefix used in taxonomy paths
/// and in the stats report.
public enum Category {
  FAMILY("FAM"),
  CLASS("CLASS"),
  BEHAVIOR("BEH"),
  FILE("FILE"),
  UNKNOWN("UNK");

  private final String code;

  Category(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /// @return true for the categories a representative family label may be chosen from
  public boolean isFamilyCandidate() {
    return this == FAMILY || this == UNKNOWN;
  }

  /// Resolve a short code such as {@code FAM} or {@code BEH}.
  /// @param code the short code, case-insensitive
  /// @return the category
  /// @throws IllegalArgumentException if the code is not recognized
  public static Category fromCode(String code) {
    String normalized = code.trim().toUpperCase(Locale.ROOT);
    for (Category category : values()) {
      if (category.code.equals(normalized)) {
        return category;
      }
    }
    throw new IllegalArgumentException("Unknown taxonomy category '" + code + "'");
  }
}
