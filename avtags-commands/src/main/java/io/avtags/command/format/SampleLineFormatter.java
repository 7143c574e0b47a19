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
import io.avtags.api.model.SampleDescriptor;
import io.avtags.api.spi.Taxonomy;

import java.util.List;
import java.util.Map;

/**
 * Renders the one tab-separated output line of a sample. Column order is stable:
 * <pre>
 * ranked:  id  label-count  tag|n,tag|n  [gt-family]  [pup]  [vendor-tags]
 * compat:  id  family                    gt-family    [pup]
 * </pre>
 * Optional columns appear only when their feature is enabled. Compat lines always carry the
 * ground truth column, left empty when no ground truth is loaded. A sample without labels is always
 * {@code id<TAB>-<TAB>[]}.
 */
public class SampleLineFormatter {

  private static final char TAB = '\t';

  private final OutputMode mode;
  private final TagListFormatter tagList;
  private final Map<String, String> groundTruth;
  private final boolean pupColumn;
  private final boolean vendorTagsColumn;

  /**
   * @param mode             the line format
   * @param pathTaxonomy     taxonomy for full-path tag rendering, null for plain tags
   * @param groundTruth      families to print in the ground truth column, null for no column
   *                         (an empty one in compat mode)
   * @param pupColumn        whether to print the PUP flag
   * @param vendorTagsColumn whether to print the report's own descriptive tags (ranked mode only)
   */
  public SampleLineFormatter(OutputMode mode, Taxonomy pathTaxonomy, Map<String, String> groundTruth,
                             boolean pupColumn, boolean vendorTagsColumn) {
    this.mode = mode;
    this.tagList = new TagListFormatter(pathTaxonomy);
    this.groundTruth = groundTruth;
    this.pupColumn = pupColumn;
    this.vendorTagsColumn = vendorTagsColumn;
  }

  public String noLabels(String identity) {
    return identity + TAB + "-" + TAB + "[]";
  }

  /**
   * @param identity   the sample's hash
   * @param sample     the sample
   * @param rankedTags its ranked tags
   * @param family     its representative family; required in compat mode
   * @param pup        its PUP flag; ignored unless the PUP column is enabled
   * @return the output line, without a line terminator
   */
  public String line(String identity, SampleDescriptor sample, List<RankedTag> rankedTags,
                     String family, boolean pup) {
    StringBuilder sb = new StringBuilder(identity).append(TAB);
    if (mode == OutputMode.compat) {
      if (family == null) {
        throw new IllegalStateException("compat output requires a family for " + identity);
      }
      sb.append(family);
    } else {
      sb.append(sample.labelCount()).append(TAB).append(tagList.format(rankedTags));
    }
    if (groundTruth != null || mode == OutputMode.compat) {
      String expected = groundTruth == null ? "" : groundTruth.getOrDefault(identity, "");
      sb.append(TAB).append(expected);
    }
    if (pupColumn) {
      sb.append(TAB).append(pup ? '1' : '0');
    }
    if (vendorTagsColumn && mode == OutputMode.ranked) {
      sb.append(TAB).append(String.join(", ", sample.vendorTags()));
    }
    return sb.toString();
  }
}
