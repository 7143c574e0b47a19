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

import io.avtags.api.model.Category;

/// Classifies canonical tags.
public interface Taxonomy {

  /// @param tag a canonical tag
  /// @return the tag's category, {@link Category#UNKNOWN} for tags the taxonomy does not list
  Category categoryOf(String tag);

  /// @param tag a canonical tag
  /// @return the tag's full taxonomy path, e.g. {@code CLASS:grayware:adware}
  String pathOf(String tag);
}
