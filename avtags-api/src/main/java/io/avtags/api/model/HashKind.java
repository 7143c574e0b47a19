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
import java.util.Optional;

/// The hash used to name samples in every output line and to join against a ground truth.
///
/// The kind is selected once at startup and threaded into the pipeline; it is never re-derived
/// per record.
public enum HashKind {
  MD5(32),
  SHA1(40),
  SHA256(64);

  private final int hexLength;

  HashKind(int hexLength) {
    this.hexLength = hexLength;
  }

  /// @return the number of hex characters in a hash of this kind
  public int hexLength() {
    return hexLength;
  }

  /// Guess the hash kind from the length of a hex digest.
  /// @param hash a hex digest
  /// @return the matching kind, or empty if the length matches none
  public static Optional<HashKind> guess(String hash) {
    if (hash == null) {
      return Optional.empty();
    }
    int len = hash.trim().length();
    for (HashKind kind : values()) {
      if (kind.hexLength == len) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }

  /// Parse a user-supplied name such as {@code md5} or {@code SHA256}.
  /// @param name the name
  /// @return the kind
  /// @throws IllegalArgumentException if the name is unknown
  public static HashKind fromName(String name) {
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (RuntimeException e) {
      throw new IllegalArgumentException(
          "Unknown hash '" + name + "', expected one of md5, sha1, sha256");
    }
  }

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
