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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;

/// Reads the non-blank lines of one input file, one JSON record per line, holding no more than a
/// single line in memory. The file is released on {@link #close()}.
public class RecordReader implements AutoCloseable, Iterable<RecordReader.Line> {

  /// A non-blank input line with its 1-based line number
  public record Line(long number, String text) {
  }

  private final Path path;
  private final BufferedReader reader;
  private boolean iterated;

  private RecordReader(Path path, BufferedReader reader) {
    this.path = path;
    this.reader = reader;
  }

  /// @param path an input file
  /// Malformed UTF-8 is decoded to replacement characters, so a corrupt line surfaces as an
  /// unparseable record instead of a read error.
  /// @return a reader positioned at the start of the file
  /// @throws UncheckedIOException if the file cannot be opened
  public static RecordReader open(Path path) {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE);
    try {
      return new RecordReader(path,
          new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder)));
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to open input " + path, e);
    }
  }

  public Path path() {
    return path;
  }

  /// The lines can be iterated once.
  @Override
  public Iterator<Line> iterator() {
    if (iterated) {
      throw new IllegalStateException("records of " + path + " were already read");
    }
    iterated = true;
    return new LineIterator();
  }

  @Override
  public void close() {
    try {
      reader.close();
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to close input " + path, e);
    }
  }

  private class LineIterator implements Iterator<Line> {
    private long lineNumber;
    private Line next;

    @Override
    public boolean hasNext() {
      if (next != null) {
        return true;
      }
      try {
        String text;
        while ((text = reader.readLine()) != null) {
          lineNumber++;
          if (!text.isBlank()) {
            next = new Line(lineNumber, text);
            return true;
          }
        }
        return false;
      } catch (IOException e) {
        throw new UncheckedIOException("Unable to read input " + path + " after line " + lineNumber, e);
      }
    }

    @Override
    public Line next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Line line = next;
      next = null;
      return line;
    }
  }
}
