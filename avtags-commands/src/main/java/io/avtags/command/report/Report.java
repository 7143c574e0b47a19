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

import java.io.IOException;
import java.io.Writer;

/// An end-of-run report, written once from accumulated state.
public interface Report {

  /// @return the file name suffix, appended to the output prefix (e.g. {@code .stats})
  String suffix();

  /// @param writer destination; not closed by the report
  /// @throws IOException if writing fails
  void writeTo(Writer writer) throws IOException;
}
