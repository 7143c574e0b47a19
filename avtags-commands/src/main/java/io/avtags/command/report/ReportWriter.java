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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/// Writes reports next to each other as {@code <prefix><suffix>}, truncating existing files.
public class ReportWriter {

  private static final Logger logger = LogManager.getLogger(ReportWriter.class);

  private final String prefix;

  /// @param prefix output path prefix, e.g. {@code out/reports} for {@code out/reports.stats}
  public ReportWriter(String prefix) {
    this.prefix = prefix;
  }

  /// @param report the report to write
  /// @return the written file
  /// @throws UncheckedIOException if the file cannot be written
  public Path write(Report report) {
    Path path = Path.of(prefix + report.suffix());
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
        report.writeTo(writer);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write report " + path, e);
    }
    logger.info("Wrote {}", path);
    return path;
  }
}
