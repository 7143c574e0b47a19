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

package io.avtags.command.pipeline;

import java.util.Locale;

/// Record-level counters of one run.
///
/// Every record read lands in exactly one of {@code tagged}, {@code untagged}, {@code nolabels},
/// {@code noscans} and {@code failed}, so the counters always reconcile with {@code reads}.
/// {@code unparseable} is the part of {@code noscans} that was not valid JSON.
public class RunCounters {

  private long reads;
  private long noscans;
  private long unparseable;
  private long nolabels;
  private long untagged;
  private long tagged;
  private long failed;

  void countRead() {
    reads++;
  }

  void countUnparseable() {
    unparseable++;
    noscans++;
  }

  void countNoscan() {
    noscans++;
  }

  void countNolabels() {
    nolabels++;
  }

  void countProcessed(boolean hasTags) {
    if (hasTags) {
      tagged++;
    } else {
      untagged++;
    }
  }

  void countFailed() {
    failed++;
  }

  public long reads() {
    return reads;
  }

  public long noscans() {
    return noscans;
  }

  public long unparseable() {
    return unparseable;
  }

  public long nolabels() {
    return nolabels;
  }

  public long untagged() {
    return untagged;
  }

  public long tagged() {
    return tagged;
  }

  public long failed() {
    return failed;
  }

  /// @return records that were read but produced no tags, for whatever reason
  public long notags() {
    return reads - tagged;
  }

  public boolean reconciles() {
    return reads == tagged + untagged + nolabels + noscans + failed;
  }

  /// @param groundTruthSize number of ground truth entries, shown for reference
  /// @return the end-of-run summary line
  public String summary(int groundTruthSize) {
    return String.format(Locale.ROOT,
        "[-] Samples: %d NoScans: %d NoTags: %d GroundTruth: %d Failed: %d",
        reads, noscans, notags(), groundTruthSize, failed);
  }

  @Override
  public String toString() {
    return "RunCounters{reads=" + reads + ", tagged=" + tagged + ", untagged=" + untagged
        + ", nolabels=" + nolabels + ", noscans=" + noscans + " (unparseable=" + unparseable
        + "), failed=" + failed + "}";
  }
}
