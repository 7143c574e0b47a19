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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RecordDecoderTest {

    private final RecordDecoder decoder = new RecordDecoder();

    @TempDir
    Path tempDir;

    @Test
    void testDecodesOneObjectPerLine() throws JsonProcessingException {
        assertThat(decoder.decode("{\"md5\":\"aa\"}").path("md5").asText()).isEqualTo("aa");
    }

    @Test
    void testRejectsMalformedAndTrailingContent() {
        assertThatThrownBy(() -> decoder.decode("{\"md5\":")).isInstanceOf(JsonProcessingException.class);
        assertThatThrownBy(() -> decoder.decode("{} {}")).isInstanceOf(JsonProcessingException.class);
        assertThatThrownBy(() -> decoder.decode("   ")).isInstanceOf(JsonProcessingException.class);
    }

    @Test
    void testReaderSkipsBlankLinesAndKeepsLineNumbers() throws IOException {
        Path file = Files.writeString(tempDir.resolve("in.jsonl"), "{}\n\n  \n[]\n");

        List<RecordReader.Line> lines = new ArrayList<>();
        try (RecordReader reader = RecordReader.open(file)) {
            reader.forEach(lines::add);
            assertThatThrownBy(reader::iterator).isInstanceOf(IllegalStateException.class);
        }

        assertThat(lines).containsExactly(new RecordReader.Line(1, "{}"), new RecordReader.Line(4, "[]"));
    }
}
