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
import io.avtags.api.model.HashKind;
import io.avtags.labeling.extract.LabelSampleExtractor;
import io.avtags.labeling.extract.VtV3SampleExtractor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("InputSourceOption")
class InputSourceOptionTest {

    @TempDir
    Path tempDir;

    @CommandLine.Command(name = "test")
    static class Holder {
        @CommandLine.Mixin
        InputSourceOption inputs = new InputSourceOption();

        @CommandLine.Option(names = "--hash", converter = HashKindConverter.class)
        HashKind hash;
    }

    private static Holder parse(String... args) {
        Holder holder = new Holder();
        new CommandLine(holder).parseArgs(args);
        return holder;
    }

    private Path file(String name) throws IOException {
        return Files.writeString(tempDir.resolve(name), "{}\n");
    }

    @Nested
    @DisplayName("resolution")
    class Resolution {

        @Test
        @DisplayName("should resolve VT files to the v2 layout")
        void shouldResolveVtFiles() throws IOException {
            Path a = file("a.json");
            Path b = file("b.json");

            InputSourceOption.InputSources sources = parse("--vt", a.toString(), "-vt", b.toString()).inputs.resolve();

            assertThat(sources.layout()).isEqualTo(ReportLayout.vt2);
            assertThat(sources.files()).containsExactly(a, b);
            assertThat(sources.defaultPrefix()).isEqualTo("a");
        }

        @Test
        @DisplayName("should select the v3 layout")
        void shouldSelectV3() throws IOException {
            Path a = file("reports.jsonl");

            InputSourceOption.InputSources sources = parse("--vt", a.toString(), "--vt3").inputs.resolve();

            assertThat(sources.layout()).isEqualTo(ReportLayout.vt3);
            assertThat(sources.layout().extractor(Set.of())).isInstanceOf(VtV3SampleExtractor.class);
        }

        @Test
        @DisplayName("should list directory files after explicit files, in name order")
        void shouldListDirectory() throws IOException {
            Path explicit = file("z.jsonl");
            Path dir = Files.createDirectory(tempDir.resolve("dir"));
            Path second = Files.writeString(dir.resolve("2.jsonl"), "{}");
            Path first = Files.writeString(dir.resolve("1.jsonl"), "{}");

            InputSourceOption.InputSources sources =
                parse("--lb", explicit.toString(), "--lbdir", dir.toString()).inputs.resolve();

            assertThat(sources.layout()).isEqualTo(ReportLayout.label);
            assertThat(sources.layout().extractor(null)).isInstanceOf(LabelSampleExtractor.class);
            assertThat(sources.files()).containsExactly(explicit, first, second);
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("should require an input")
        void shouldRequireInput() {
            assertThatThrownBy(() -> parse().inputs.resolve())
                .isInstanceOf(AvtagsConfigException.class)
                .hasMessageContaining("--vt, --lb, --vtdir, --lbdir");
        }

        @Test
        @DisplayName("should reject mixed input kinds")
        void shouldRejectMixedInputs() throws IOException {
            Path a = file("a.json");

            assertThatThrownBy(() -> parse("--vt", a.toString(), "--lb", a.toString()).inputs.resolve())
                .isInstanceOf(AvtagsConfigException.class)
                .hasMessageContaining("cannot be combined");
        }

        @Test
        @DisplayName("should reject missing files and directories")
        void shouldRejectMissingInputs() {
            assertThatThrownBy(() -> parse("--vt", tempDir.resolve("nope").toString()).inputs.resolve())
                .isInstanceOf(AvtagsConfigException.class)
                .hasMessageContaining("does not exist");
            assertThatThrownBy(() -> parse("--vtdir", tempDir.resolve("nodir").toString()).inputs.resolve())
                .isInstanceOf(AvtagsConfigException.class);
        }

        @Test
        @DisplayName("should reject an empty directory")
        void shouldRejectEmptyDirectory() throws IOException {
            Path dir = Files.createDirectory(tempDir.resolve("empty"));

            assertThatThrownBy(() -> parse("--vtdir", dir.toString()).inputs.resolve())
                .isInstanceOf(AvtagsConfigException.class)
                .hasMessageContaining("holds no files");
        }
    }

    @Test
    @DisplayName("should convert hash names and reject unknown ones")
    void shouldConvertHashKinds() {
        assertThat(parse("--hash", "SHA1").hash).isEqualTo(HashKind.SHA1);
        assertThatThrownBy(() -> parse("--hash", "crc"))
            .isInstanceOf(CommandLine.ParameterException.class)
            .hasMessageContaining("crc");
    }
}
