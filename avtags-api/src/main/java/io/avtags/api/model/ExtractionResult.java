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
import java.util.Optional;

/**
 * Outcome of extracting a sample from one raw record: either a descriptor, or the reason the
 * record carried no usable scan data.
 * <p>
 * {@code hint} holds whatever identity could still be recovered from a skipped record (usually
 * its md5) so the skip can be logged; it is null when nothing was recoverable.
 */
public final class ExtractionResult {

  private final SampleDescriptor sample;
  private final String skipReason;
  private final String hint;

  private ExtractionResult(SampleDescriptor sample, String skipReason, String hint) {
    this.sample = sample;
    this.skipReason = skipReason;
    this.hint = hint;
  }

  public static ExtractionResult extracted(SampleDescriptor sample) {
    return new ExtractionResult(Objects.requireNonNull(sample, "sample"), null, null);
  }

  public static ExtractionResult skipped(String reason, String hint) {
    return new ExtractionResult(null, Objects.requireNonNull(reason, "reason"), hint);
  }

  public boolean isExtracted() {
    return sample != null;
  }

  /**
   * @return the descriptor
   * @throws IllegalStateException if the record was skipped
   */
  public SampleDescriptor sample() {
    if (sample == null) {
      throw new IllegalStateException("record was skipped: " + skipReason);
    }
    return sample;
  }

  public Optional<String> skipReason() {
    return Optional.ofNullable(skipReason);
  }

  public Optional<String> hint() {
    return Optional.ofNullable(hint);
  }

  @Override
  public String toString() {
    return isExtracted() ? "extracted(" + sample.md5() + ")" : "skipped(" + skipReason + ")";
  }
}
