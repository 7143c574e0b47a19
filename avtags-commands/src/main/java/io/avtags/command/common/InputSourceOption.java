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

package io.avtags.command.common;

import io.avtags.api.AvtagsConfigException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Shared input options: report files and directories, and the report layout they use.
 * <p>
 * VirusTotal inputs ({@code --vt}, {@code --vtdir}) and simplified label inputs ({@code --lb},
 * {@code --lbdir}) cannot be combined in one run. Files given explicitly come first, in command
 * line order, followed by the files of the directory in name order. Duplicates are kept.
 */
public class InputSourceOption {

  private static final Logger logger = LogManager.getLogger(InputSourceOption.class);

  /**
   * The resolved inputs of a run.
   *
   * @param layout the report layout shared by all files
   * @param files  the input files, in processing order, never empty
   */
  public record InputSources(ReportLayout layout, List<Path> files) {

    public InputSources {
      if (layout == null) {
        throw new IllegalArgumentException("layout cannot be null");
      }
      if (files == null || files.isEmpty()) {
        throw new IllegalArgumentException("at least one input file is required");
      }
      files = List.copyOf(files);
    }

    /**
     * The prefix for report files when none is configured: the first input's file name without
     * its extension, in the working directory.
     *
     * @return the default report prefix
     */
    public String defaultPrefix() {
      String name = files.get(0).getFileName().toString();
      int dot = name.lastIndexOf('.');
      return dot > 0 ? name.substring(0, dot) : name;
    }
  }

  @CommandLine.Option(
      names = {"--vt", "-vt"},
      paramLabel = "FILE",
      description = "File with VirusTotal reports, one JSON object per line (repeatable)"
  )
  private List<Path> vtFiles = new ArrayList<>();

  @CommandLine.Option(
      names = {"--lb", "-lb"},
      paramLabel = "FILE",
      description = "File with simplified JSON reports {md5,sha1,sha256,scan_date,av_labels} (repeatable)"
  )
  private List<Path> lbFiles = new ArrayList<>();

  @CommandLine.Option(
      names = {"--vtdir", "-vtdir"},
      paramLabel = "DIR",
      description = "Directory whose files all hold VirusTotal reports"
  )
  private Path vtDir;

  @CommandLine.Option(
      names = {"--lbdir", "-lbdir"},
      paramLabel = "DIR",
      description = "Directory whose files all hold simplified JSON reports"
  )
  private Path lbDir;

  @CommandLine.Option(
      names = {"--vt3", "-vt3"},
      description = "VirusTotal inputs are v3 file objects rather than v2 reports"
  )
  private boolean vt3;

  /**
   * Validate the options and list the input files.
   *
   * @return the inputs
   * @throws AvtagsConfigException if no input is given, input kinds are mixed, or an input is
   *                               missing
   */
  public InputSources resolve() {
    boolean vt = !vtFiles.isEmpty() || vtDir != null;
    boolean lb = !lbFiles.isEmpty() || lbDir != null;
    if (!vt && !lb) {
      throw new AvtagsConfigException(
          "One of the following 4 arguments is required: --vt, --lb, --vtdir, --lbdir");
    }
    if (vt && lb) {
      throw new AvtagsConfigException(
          "Use either --vt/--vtdir or --lb/--lbdir. Both types of input files cannot be combined.");
    }
    if (lb && vt3) {
      logger.warn("--vt3 has no effect on simplified label inputs");
    }

    List<Path> files = new ArrayList<>();
    for (Path file : vt ? vtFiles : lbFiles) {
      if (!Files.isRegularFile(file)) {
        throw new AvtagsConfigException("Input file does not exist: " + file);
      }
      files.add(file);
    }
    Path dir = vt ? vtDir : lbDir;
    if (dir != null) {
      files.addAll(listDirectory(dir));
    }
    if (files.isEmpty()) {
      throw new AvtagsConfigException("Input directory " + dir + " holds no files");
    }

    ReportLayout layout = lb ? ReportLayout.label : (vt3 ? ReportLayout.vt3 : ReportLayout.vt2);
    return new InputSources(layout, files);
  }

  private static List<Path> listDirectory(Path dir) {
    if (!Files.isDirectory(dir)) {
      throw new AvtagsConfigException("Input directory does not exist: " + dir);
    }
    try (Stream<Path> entries = Files.list(dir)) {
      return entries.filter(Files::isRegularFile).sorted().toList();
    } catch (IOException e) {
      throw new AvtagsConfigException("Unable to list input directory " + dir + ": " + e, e);
    }
  }
}
