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

package io.avtags.labeling;

import io.avtags.api.model.RankedTag;
import io.avtags.api.spi.PupClassifier;

import java.util.List;

/// Flags a sample as PUP when the {@code grayware} tag is supported by at least half as many
/// engines as the sample's top-ranked tag.
public class GraywarePupClassifier implements PupClassifier {

  public static final String GRAYWARE = "grayware";

  private static final double THRESHOLD = 0.5d;

  @Override
  public boolean isPup(List<RankedTag> rankedTags) {
    if (rankedTags.isEmpty()) {
      return false;
    }
    int maxSupport = rankedTags.get(0).support();
    for (RankedTag tag : rankedTags) {
      if (GRAYWARE.equals(tag.tag())) {
        return tag.support() >= maxSupport * THRESHOLD;
      }
    }
    return false;
  }
}
