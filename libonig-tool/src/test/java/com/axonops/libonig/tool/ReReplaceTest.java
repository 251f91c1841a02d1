/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.libonig.tool;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the re_replace command line tool.
 */
@DisplayName("re_replace")
class ReReplaceTest {

    @TempDir
    Path dir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setup() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String stdin, String... args) {
        return run(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)), args);
    }

    private int run(InputStream stdin, String... args) {
        return ReReplace.run(args, stdin,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private Path file(String name, String content) throws IOException {
        Path path = dir.resolve(name);
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path;
    }

    // ========== Stdin ==========

    @Test
    @DisplayName("Stdin is replaced onto stdout")
    void stdin_replaced() {
        int status = run("key:value\nfoo:bar\n", "(\\w+):(\\w+)", "$2=$1");

        assertThat(status).isEqualTo(ReReplace.EXIT_OK);
        assertThat(stdout()).isEqualTo("value=key\nbar=foo\n");
        assertThat(stderr()).isEmpty();
    }

    @Test
    @DisplayName("-i matches case-insensitively")
    void ignoreCase() {
        assertThat(run("Hello HELLO hello", "-i", "hello", "hi")).isZero();
        assertThat(stdout()).isEqualTo("hi hi hi");
    }

    @Test
    @DisplayName("Without -i matching is case-sensitive")
    void caseSensitive() {
        assertThat(run("Hello hello", "hello", "hi")).isZero();
        assertThat(stdout()).isEqualTo("Hello hi");
    }

    @Test
    @DisplayName("Multi-byte UTF-8 text is preserved")
    void utf8() {
        assertThat(run("café über", "é", "e")).isZero();
        assertThat(stdout()).isEqualTo("cafe über");
    }

    @Test
    @DisplayName("Empty stdin produces empty output")
    void emptyStdin() {
        assertThat(run("", "a", "b")).isZero();
        assertThat(stdout()).isEmpty();
    }

    @Test
    @DisplayName("Stdin read failure exits 4")
    void stdinReadFailure() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("broken pipe");
            }
        };

        assertThat(run(broken, "a", "b")).isEqualTo(ReReplace.EXIT_STDIN_READ);
        assertThat(stderr()).contains("broken pipe");
    }

    // ========== Usage ==========

    @Test
    @DisplayName("Missing arguments exit 2")
    void missingArguments() {
        assertThat(run("", "onlypattern")).isEqualTo(ReReplace.EXIT_USAGE);
        assertThat(stderr()).contains(ReReplace.SYNTAX);
    }

    @Test
    @DisplayName("Unknown option exits 2")
    void unknownOption() {
        assertThat(run("", "-z", "a", "b")).isEqualTo(ReReplace.EXIT_USAGE);
        assertThat(stderr()).contains("re_replace");
    }

    @Test
    @DisplayName("--help prints usage and exits 0")
    void help() {
        assertThat(run("", "--help")).isZero();
        assertThat(stdout()).contains(ReReplace.SYNTAX).contains("--write");
    }

    @Test
    @DisplayName("-- ends options so a pattern may start with a dash")
    void doubleDash() {
        assertThat(run("a-b", "--", "-b", "+")).isZero();
        assertThat(stdout()).isEqualTo("a+");
    }

    @Test
    @DisplayName("Pattern compile error exits 3")
    void compileError() {
        assertThat(run("abc", "(unclosed", "x")).isEqualTo(ReReplace.EXIT_COMPILE);
        assertThat(stderr()).contains("Pattern compilation failed");
        assertThat(stdout()).isEmpty();
    }

    // ========== Files ==========

    @Test
    @DisplayName("Files are replaced onto stdout in order")
    void files_toStdout() throws IOException {
        Path a = file("a.txt", "one two");
        Path b = file("b.txt", "three");

        assertThat(run("", "(\\w+)", "[$1]", a.toString(), b.toString())).isZero();

        assertThat(stdout()).isEqualTo("[one] [two][three]");
        assertThat(Files.readString(a)).isEqualTo("one two");
    }

    @Test
    @DisplayName("-w rewrites files in place")
    void files_inPlace() throws IOException {
        Path a = file("a.txt", "2024-01-15");

        assertThat(run("", "-w", "(\\d+)-(\\d+)-(\\d+)", "$3/$2/$1", a.toString())).isZero();

        assertThat(Files.readString(a)).isEqualTo("15/01/2024");
        assertThat(stdout()).isEmpty();
    }

    @Test
    @DisplayName("-w with a pattern that matches empty keeps non-ASCII text intact")
    void files_inPlace_zeroWidthUtf8() throws IOException {
        Path a = file("a.txt", "naïve\n");

        assertThat(run("", "-w", "z*", "", a.toString())).isZero();

        assertThat(Files.readString(a)).isEqualTo("naïve\n");
    }

    @Test
    @DisplayName("Bytes that are not valid UTF-8 are copied through unchanged")
    void stdin_invalidUtf8Preserved() {
        byte[] input = {'a', (byte) 0xFF, 'b', '.'};

        assertThat(run(new ByteArrayInputStream(input), "b", "c")).isZero();

        assertThat(out.toByteArray()).isEqualTo(new byte[] {'a', (byte) 0xFF, 'c', '.'});
    }

    @Test
    @DisplayName("A missing file exits 6 and later files are still processed")
    void missingFile_continues() throws IOException {
        Path good = file("good.txt", "aaa");
        Path missing = dir.resolve("missing.txt");

        int status = run("", "a", "b", missing.toString(), good.toString());

        assertThat(status).isEqualTo(ReReplace.EXIT_FILE_OPEN);
        assertThat(stdout()).isEqualTo("bbb");
        assertThat(stderr()).contains("missing.txt");
    }

    @Test
    @DisplayName("A directory argument cannot be opened")
    void directory_openFailure() {
        assertThat(run("", "a", "b", dir.toString())).isEqualTo(ReReplace.EXIT_FILE_OPEN);
    }

    @Test
    @DisplayName("Exit status is that of the last failure")
    void lastFailureWins() throws IOException {
        Path missing = dir.resolve("missing.txt");
        Path good = file("good.txt", "x");

        int status = run("", "x", "y", missing.toString(), good.toString(), dir.toString());

        assertThat(status).isEqualTo(ReReplace.EXIT_FILE_OPEN);
        assertThat(stdout()).isEqualTo("y");
    }
}
