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

package io.avtags.command.report;

import io.avtags.command.aggregate.VendorTagCounter;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;

/// One line per tag, tags in lexicographic order: {@code tag<TAB>vendor|n,vendor|n,} with the
/// vendors that produced the tag most often first.
public class VendorTagReport implements Report {

  public static final String SUFFIX = ".avtags";

  private final VendorTagCounter counter;

  public VendorTagReport(VendorTagCounter counter) {
    this.counter = counter;
  }

  @Override
  public String suffix() {
    return SUFFIX;
  }

  @Override
  public void writeTo(Writer writer) throws IOException {
    for (String tag : counter.tags()) {
      StringBuilder sb = new StringBuilder(tag).append('\t');
      for (Map.Entry<String, Long> vendor : counter.vendorsOf(tag)) {
        sb.append(vendor.getKey()).append('|').append(vendor.getValue()).append(',');
      }
      writer.write(sb.append('\n').toString());
    }
  }
}
