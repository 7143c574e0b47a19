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

package io.avtags.command;

import io.avtags.api.AvtagsConfigException;
import io.avtags.api.model.EvaluationResult;
import io.avtags.api.model.HashKind;
import io.avtags.api.spi.SampleExtractor;
import io.avtags.command.common.HashKindConverter;
import io.avtags.command.common.InputSourceOption;
import io.avtags.command.common.VerbosityOption;
import io.avtags.command.format.OutputMode;
import io.avtags.command.logging.StderrConfigurationFactory;
import io.avtags.command.pipeline.AggregationContext;
import io.avtags.command.pipeline.PipelineOptions;
import io.avtags.command.pipeline.ProgressReporter;
import io.avtags.command.pipeline.RunCounters;
import io.avtags.command.pipeline.SampleProcessor;
import io.avtags.command.pipeline.StreamDriver;
import io.avtags.command.report.AliasReport;
import io.avtags.command.report.ReportWriter;
import io.avtags.command.report.StatsReport;
import io.avtags.command.report.VendorTagReport;
import io.avtags.labeling.GraywarePupClassifier;
import io.avtags.labeling.LabelingRules;
import io.avtags.labeling.eval.ClusteringEvaluator;
import io.avtags.labeling.eval.GroundTruthFile;
import io.avtags.labeling.extract.VendorAllowList;
import io.avtags.labeling.rules.RuleTagRanker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.ConfigurationFactory;
import picocli.CommandLine;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/// Extract ranked family and behavior tags for every sample in a set of anti-malware reports.
///
/// Each input line is one JSON report. For each sample one tab-separated line goes to standard
/// output; progress, logging and the end-of-run summary go to standard error. Optional reports
/// are written as {@code <prefix>.stats}, {@code <prefix>.avtags} and {@code <prefix>.alias}.
///
/// ## Usage
///
/// ```bash
/// # rank tags for VirusTotal v2 reports
/// avtags --vt reports.jsonl
///
/// # compatibility output, evaluated against a ground truth, with alias detection
/// avtags --lb labels.jsonl -c --gt truth.tsv --aliasdetect --stats
/// ```
@CommandLine.Command(
    name = "avtags",
    mixinStandardHelpOptions = true,
    header = "Extract tags for a set of samples from their anti-malware reports",
    description = "Ranks normalized tags per sample and optionally computes alias, vendor and "
                  + "category statistics, and clustering accuracy against a ground truth.",
    exitCodeList = {
        "0: Success, even when individual records were skipped or failed",
        "1: A report file could not be written",
        "2: Invalid configuration or missing input"
    }
)
public class CMD_avtags implements Callable<Integer> {

  private static final Logger logger = LogManager.getLogger(CMD_avtags.class);

  public static final int EXIT_OK = 0;
  public static final int EXIT_IO = 1;
  public static final int EXIT_CONFIG = 2;

  @CommandLine.Mixin
  private InputSourceOption inputs = new InputSourceOption();

  @CommandLine.Mixin
  private VerbosityOption verbosity = new VerbosityOption();

  @CommandLine.Option(names = {"--gt", "-gt"}, paramLabel = "FILE",
      description = "Ground truth file (hash<TAB>family). Prints precision, recall and F1.")
  private Path groundTruthPath;

  @CommandLine.Option(names = {"--vt-tags", "-vtt"},
      description = "Include the reports' own descriptive tags in the output")
  private boolean vendorTagsColumn;

  @CommandLine.Option(names = {"--tag", "-tag"}, paramLabel = "FILE",
      description = "Tagging rules file; /dev/null for none (default: bundled rules)")
  private Path tagPath;

  @CommandLine.Option(names = {"--tax", "-tax"}, paramLabel = "FILE",
      description = "Taxonomy file; /dev/null for none (default: bundled taxonomy)")
  private Path taxPath;

  @CommandLine.Option(names = {"--exp", "-exp"}, paramLabel = "FILE",
      description = "Expansion rules file; /dev/null for none (default: bundled rules)")
  private Path expPath;

  @CommandLine.Option(names = {"--av", "-av"}, paramLabel = "FILE",
      description = "File listing the engines whose labels are used, one per line")
  private Path vendorListPath;

  @CommandLine.Option(names = {"--avtags", "-avtags"},
      description = "Write the tags produced by each engine to <prefix>.avtags")
  private boolean vendorTagStats;

  @CommandLine.Option(names = {"--pup", "-pup"},
      description = "Classify each sample as PUP (1) or not (0)")
  private boolean pup;

  @CommandLine.Option(names = {"-p", "--path"},
      description = "Print the full taxonomy path of each tag")
  private boolean fullPaths;

  @CommandLine.Option(names = {"--hash", "-hash"}, paramLabel = "KIND",
      converter = HashKindConverter.class,
      description = "Hash used to name samples: md5, sha1 or sha256. Should match the ground "
                    + "truth (default: guessed from the ground truth, else md5)")
  private HashKind hashKind;

  @CommandLine.Option(names = {"-c", "--compat"},
      description = "Compatibility mode: print one family per sample instead of ranked tags")
  private boolean compat;

  @CommandLine.Option(names = {"--aliasdetect", "-aliasdetect"},
      description = "Write tag co-occurrence statistics to <prefix>.alias")
  private boolean aliasDetect;

  @CommandLine.Option(names = {"--stats", "-stats"},
      description = "Write per-category statistics (FILE, CLASS, BEH, FAM, UNK) to <prefix>.stats")
  private boolean stats;

  @CommandLine.Option(names = {"--out-prefix"}, paramLabel = "PREFIX",
      description = "Prefix of report files (default: first input's name without extension)")
  private String outPrefix;

  @CommandLine.Option(names = {"--min-engines"}, paramLabel = "N",
      defaultValue = "3",
      description = "A sample counts toward category statistics only when more than N engines "
                    + "labeled it (default: ${DEFAULT-VALUE})")
  private int minEngines;

  @CommandLine.Option(names = {"--min-support"}, paramLabel = "N",
      defaultValue = "2",
      description = "Engines that must agree on a tag for it to be ranked (default: ${DEFAULT-VALUE})")
  private int minSupport;

  @CommandLine.Option(names = {"--progress-interval"}, paramLabel = "N",
      defaultValue = "100",
      description = "Records between progress updates, 0 to disable (default: ${DEFAULT-VALUE})")
  private int progressInterval;

  /// run the avtags command
  /// @param args command line args
  public static void main(String[] args) {
    System.setProperty(
        ConfigurationFactory.CONFIGURATION_FACTORY_PROPERTY,
        StderrConfigurationFactory.class.getCanonicalName()
    );
    CMD_avtags command = new CMD_avtags();
    CommandLine commandLine = new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true);
    int exitCode = commandLine.execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() {
    PrintStream out = System.out;
    PrintStream err = System.err;
    try {
      verbosity.validate();
      verbosity.applyLogLevel();
      return run(out, err);
    } catch (AvtagsConfigException | IllegalArgumentException e) {
      logger.error("Invalid configuration: {}", e.getMessage());
      err.println("Error: " + e.getMessage());
      return EXIT_CONFIG;
    } catch (UncheckedIOException e) {
      logger.error("I/O failure", e);
      err.println("Error: " + e.getMessage());
      return EXIT_IO;
    }
  }

  private int run(PrintStream out, PrintStream err) {
    InputSourceOption.InputSources sources = inputs.resolve();

    GroundTruthFile groundTruth = groundTruthPath != null ? GroundTruthFile.load(groundTruthPath) : null;
    HashKind selectedHash = selectHashKind(groundTruth);
    logger.info("Naming samples by {}", selectedHash);

    LabelingRules rules = LabelingRules.load(tagPath, expPath, taxPath);
    RuleTagRanker ranker = rules.ranker(minSupport);
    Set<String> vendors = VendorAllowList.load(vendorListPath);
    SampleExtractor extractor = sources.layout().extractor(vendors);

    PipelineOptions options = PipelineOptions.builder()
        .hashKind(selectedHash)
        .outputMode(compat ? OutputMode.compat : OutputMode.ranked)
        .fullPaths(fullPaths)
        .pupColumn(pup)
        .vendorTagsColumn(vendorTagsColumn)
        .aliasDetect(aliasDetect)
        .categoryStats(stats)
        .vendorTagStats(vendorTagStats)
        .evaluate(groundTruth != null)
        .minEngines(minEngines)
        .progressInterval(progressInterval)
        .build();

    Map<String, String> truth = groundTruth != null ? groundTruth.families() : null;
    AggregationContext context = new AggregationContext(options);
    SampleProcessor processor = new SampleProcessor(
        options, ranker, rules.taxonomy(), new GraywarePupClassifier(), truth);
    ProgressReporter progress =
        new ProgressReporter(err, verbosity.isQuiet() ? 0 : options.progressInterval());

    RunCounters counters = new StreamDriver(extractor, processor, context, progress)
        .run(sources.files(), out);

    err.println(counters.summary(groundTruth != null ? groundTruth.size() : 0));
    if (groundTruth != null) {
      EvaluationResult evaluation = new ClusteringEvaluator().evaluate(truth, context.firstTokens());
      err.println(evaluation.summary());
    }

    ReportWriter reports = new ReportWriter(outPrefix != null ? outPrefix : sources.defaultPrefix());
    if (stats) {
      reports.write(new StatsReport(counters, context.coverage(), minEngines));
    }
    if (vendorTagStats) {
      reports.write(new VendorTagReport(context.vendorTags()));
    }
    if (aliasDetect) {
      Path aliasFile = reports.write(new AliasReport(context.aliases()));
      err.println("[-] Alias data in " + aliasFile);
    }
    return EXIT_OK;
  }

  private HashKind selectHashKind(GroundTruthFile groundTruth) {
    Optional<HashKind> guessed = groundTruth != null ? groundTruth.guessHashKind() : Optional.empty();
    if (hashKind != null) {
      if (guessed.isPresent() && guessed.get() != hashKind) {
        logger.warn("--hash {} does not match the ground truth, which looks like {}",
            hashKind, guessed.get());
      }
      return hashKind;
    }
    return guessed.orElse(HashKind.MD5);
  }
}
