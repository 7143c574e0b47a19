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

import io.avtags.api.model.Category;
import io.avtags.api.model.RankedTag;
import io.avtags.api.model.TagVendors;

import java.util.List;
import java.util.Set;

/**
 * Everything one successfully processed sample contributes to the run, computed before any
 * accumulator is touched so a failure part way through leaves no trace.
 *
 * @param identity   the sample's hash
 * @param line       its output line
 * @param rankedTags its ranked tags
 * @param tagVendors its tags with supporting vendors, null unless vendor-tag stats are on
 * @param maltagged  whether it counts toward category statistics
 * @param categories categories it touches; meaningful only when maltagged
 * @param family     its representative family, null unless one was needed
 */
public record SampleOutcome(
    String identity,
    String line,
    List<RankedTag> rankedTags,
    TagVendors tagVendors,
    boolean maltagged,
    Set<Category> categories,
    String family
) {

  public boolean hasTags() {
    return !rankedTags.isEmpty();
  }
}
