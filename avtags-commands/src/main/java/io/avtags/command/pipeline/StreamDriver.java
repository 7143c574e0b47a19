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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.avtags.api.model.ExtractionResult;
import io.avtags.api.model.HashKind;
import io.avtags.api.model.SampleDescriptor;
import io.avtags.api.spi.SampleExtractor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * The single forward pass over all input records.
 * <p>
 * Files are processed in the order given and records in file order; each output line is written
 * as soon as its record is processed. A record that is not valid JSON or holds no scan data is
 * counted and skipped. A record whose processing throws is counted as failed and contributes
 * nothing: no output line and no accumulator update. Neither stops the run.
 */
public class StreamDriver {

  private static final Logger logger = LogManager.getLogger(StreamDriver.class);

  private final SampleExtractor extractor;
  private final SampleProcessor processor;
  private final AggregationContext context;
  private final ProgressReporter progress;
  private final RecordDecoder decoder = new RecordDecoder();
  private final HashKind hashKind;

  public StreamDriver(SampleExtractor extractor, SampleProcessor processor,
                      AggregationContext context, ProgressReporter progress) {
    this.extractor = extractor;
    this.processor = processor;
    this.context = context;
    this.progress = progress;
    this.hashKind = context.options().hashKind();
  }

  /// Process every record of every input.
  /// @param inputs input files, in processing order
  /// @param out where per-sample lines are written
  /// @return the run counters
  public RunCounters run(List<Path> inputs, PrintStream out) {
    for (Path input : inputs) {
      runFile(input, out);
    }
    out.flush();
    RunCounters counters = context.counters();
    logger.debug("Finished pass: {}", counters);
    return counters;
  }

  private void runFile(Path input, PrintStream out) {
    logger.info("Processing input file {}", input);
    RunCounters counters = context.counters();
    try (RecordReader reader = RecordReader.open(input)) {
      for (RecordReader.Line line : reader) {
        counters.countRead();
        progress.update(counters.reads());
        handle(input, line, out);
      }
    }
    progress.finish(counters.reads());
  }

  void handle(Path input, RecordReader.Line line, PrintStream out) {
    RunCounters counters = context.counters();

    JsonNode record;
    try {
      record = decoder.decode(line.text());
    } catch (JsonProcessingException e) {
      counters.countUnparseable();
      logger.warn("Could not parse record at {}:{}: {}", input, line.number(), e.getOriginalMessage());
      return;
    }

    ExtractionResult extraction;
    try {
      extraction = extractor.extract(record);
    } catch (RuntimeException e) {
      counters.countNoscan();
      logger.error("Could not extract a sample from {}:{}", input, line.number(), e);
      return;
    }
    if (!extraction.isExtracted()) {
      counters.countNoscan();
      logger.warn("No scans for {} ({})",
          extraction.hint().orElse(input + ":" + line.number()),
          extraction.skipReason().orElse("unknown reason"));
      return;
    }

    SampleDescriptor sample = extraction.sample();
    String identity = sample.identity(hashKind);
    if (identity == null) {
      counters.countNoscan();
      logger.warn("Record at {}:{} has no {} hash", input, line.number(), hashKind);
      return;
    }

    if (!sample.hasLabels()) {
      counters.countNolabels();
      out.println(processor.noLabelsLine(identity));
      return;
    }

    SampleOutcome outcome;
    try {
      outcome = processor.process(identity, sample);
    } catch (RuntimeException e) {
      counters.countFailed();
      logger.error("Failed to process sample {} at {}:{}", identity, input, line.number(), e);
      return;
    }
    context.commit(outcome);
    out.println(outcome.line());
  }
}
