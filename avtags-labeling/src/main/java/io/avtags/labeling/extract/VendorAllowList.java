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

package io.avtags.labeling.extract;

import io.avtags.labeling.rules.RuleFiles;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/// The engines whose labels are used, one engine name per line.
public final class VendorAllowList {

  private VendorAllowList() {
  }

  /// @param path the engine list, or null to use every engine
  /// @return the engine names, empty when every engine is used
  public static Set<String> load(Path path) {
    if (path == null) {
      return Set.of();
    }
    Set<String> vendors = new LinkedHashSet<>();
    for (String line : RuleFiles.readLines("engine list", path)) {
      vendors.add(line.split("\\s+")[0]);
    }
    return vendors;
  }
}
