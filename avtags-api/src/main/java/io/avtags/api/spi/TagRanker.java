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
package io.avtags.api.spi;

import io.avtags.api.model.RankedTag;
import io.avtags.api.model.SampleDescriptor;
import io.avtags.api.model.TagVendors;

import java.util.List;

/**
 * Turns raw per-engine labels into canonical tags and ranks them by engine support.
 * <p>
 * Both steps must be deterministic for identical input. The ranked list is ordered by descending
 * support; callers never re-order it.
 */
public interface TagRanker {

  /**
   * Normalize every label of a sample into canonical tags.
   *
   * @param sample the sample
   * @return each tag found with the set of engines whose label produced it
   */
  TagVendors tagVendors(SampleDescriptor sample);

  /**
   * Rank the tags of one sample.
   *
   * @param tagVendors the result of {@link #tagVendors(SampleDescriptor)}
   * @return distinct tags by descending support, possibly empty
   */
  List<RankedTag> rank(TagVendors tagVendors);
}
