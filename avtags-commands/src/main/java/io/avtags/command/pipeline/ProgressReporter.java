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

import java.io.PrintStream;

/// Keeps a single, self-overwriting progress line on the console while records are read.
public class ProgressReporter {

  private final PrintStream console;
  private final int interval;

  /// @param console where progress goes, normally standard error
  /// @param interval records between updates; 0 disables progress output
  public ProgressReporter(PrintStream console, int interval) {
    this.console = console;
    this.interval = interval;
  }

  public static ProgressReporter disabled() {
    return new ProgressReporter(System.err, 0);
  }

  public void update(long reads) {
    if (interval > 0 && reads % interval == 0) {
      console.print("\r[-] " + reads + " JSON read");
      console.flush();
    }
  }

  /// Print the final count of a file and end the progress line.
  /// @param reads records read so far
  public void finish(long reads) {
    if (interval > 0) {
      console.print("\r[-] " + reads + " JSON read");
      console.println();
      console.flush();
    }
  }
}
