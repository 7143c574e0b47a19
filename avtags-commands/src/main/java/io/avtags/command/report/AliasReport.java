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

import io.avtags.command.aggregate.AliasCounter;
import io.avtags.command.aggregate.AliasRow;

import java.io.IOException;
import java.io.Writer;
import java.util.Locale;

/// Tag pair co-occurrence, least frequent pairs first. Pairs whose rarer tag nearly always
/// appears with the other one ({@code f} close to 1) are alias candidates.
public class AliasReport implements Report {

  public static final String SUFFIX = ".alias";

  public static final String HEADER =
      "# t1\tt2\t|t1|\t|t2|\t|t1^t2|\t|t1^t2|/|t1|\t|t1^t2|/|t2|";

  private final AliasCounter counter;

  public AliasReport(AliasCounter counter) {
    this.counter = counter;
  }

  @Override
  public String suffix() {
    return SUFFIX;
  }

  @Override
  public void writeTo(Writer writer) throws IOException {
    writer.write(HEADER);
    writer.write('\n');
    for (AliasRow row : counter.rows()) {
      writer.write(format(row));
      writer.write('\n');
    }
  }

  static String format(AliasRow row) {
    return String.format(Locale.ROOT, "%s\t%s\t%d\t%d\t%d\t%.2f\t%.2f",
        row.rarer(), row.common(), row.rarerCount(), row.commonCount(), row.coCount(),
        row.f(), row.finv());
  }
}
