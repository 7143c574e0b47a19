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

package io.avtags.command.format;

import io.avtags.api.model.RankedTag;
import io.avtags.api.spi.Taxonomy;

import java.util.List;

/// Renders ranked tags as {@code tag|support,tag|support,...}, optionally replacing each tag by
/// its taxonomy path.
public class TagListFormatter {

  private final Taxonomy taxonomy;

  /// @param taxonomy the taxonomy used to resolve paths, or null to print tags as they are
  public TagListFormatter(Taxonomy taxonomy) {
    this.taxonomy = taxonomy;
  }

  public String format(List<RankedTag> rankedTags) {
    StringBuilder sb = new StringBuilder();
    for (RankedTag rankedTag : rankedTags) {
      if (sb.length() > 0) {
        sb.append(',');
      }
      sb.append(taxonomy != null ? taxonomy.pathOf(rankedTag.tag()) : rankedTag.tag())
          .append('|')
          .append(rankedTag.support());
    }
    return sb.toString();
  }
}
