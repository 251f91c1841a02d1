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

package com.axonops.libonig.api;

import com.axonops.libonig.encoding.CodeUnit;
import com.axonops.libonig.encoding.Subject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for replace-all, split and escaping.
 */
@DisplayName("Replace")
class ReplaceTest {

    // ========== Onig.replace ==========

    @Test
    @DisplayName("Every match is replaced")
    void replace_all() {
        try (Pattern p = Pattern.compile("\\d+")) {
            assertThat(Onig.replace(Subject.of("a1b22c"), p, "#")).isEqualTo("a#b#c");
        }
    }

    @Test
    @DisplayName("Templates expand per match")
    void replace_template() {
        try (Pattern p = Pattern.compile("(\\w+)=(\\w+)")) {
            assertThat(Onig.replace(Subject.of("a=1, b=2"), p, "$2:$1")).isEqualTo("1:a, 2:b");
        }
    }

    @Test
    @DisplayName("FORMAT_FIRST_ONLY replaces once and copies the rest")
    void replace_firstOnly() {
        try (Pattern p = Pattern.compile("\\d+")) {
            assertThat(Onig.replace(Subject.of("a1b22c"), p, "#", EnumSet.of(MatchFlag.FORMAT_FIRST_ONLY)))
                .isEqualTo("a#b22c");
        }
    }

    @Test
    @DisplayName("FORMAT_NO_COPY drops unmatched text")
    void replace_noCopy() {
        try (Pattern p = Pattern.compile("(\\d+)")) {
            assertThat(Onig.replace(Subject.of("a1b22c"), p, "[$1]", EnumSet.of(MatchFlag.FORMAT_NO_COPY)))
                .isEqualTo("[1][22]");
        }
    }

    @Test
    @DisplayName("FORMAT_LITERAL inserts the template as is")
    void replace_literal() {
        try (Pattern p = Pattern.compile("(\\d)")) {
            assertThat(Onig.replace(Subject.of("a1b2"), p, "$1", EnumSet.of(MatchFlag.FORMAT_LITERAL)))
                .isEqualTo("a$1b$1");
        }
    }

    @Test
    @DisplayName("Zero-width matches insert between every unit")
    void replace_zeroWidth() {
        try (Pattern empty = Pattern.compile("");
             Pattern star = Pattern.compile("x*")) {
            assertThat(Onig.replace(Subject.of("ab"), empty, "-")).isEqualTo("-a-b-");
            assertThat(Onig.replace(Subject.of("axxb"), star, "-")).isEqualTo("-a--b-");
        }
    }

    @Test
    @DisplayName("No match returns the subject text")
    void replace_noMatch() {
        try (Pattern p = Pattern.compile("z")) {
            assertThat(Onig.replace(Subject.of("abc"), p, "#")).isEqualTo("abc");
        }
    }

    @Test
    @DisplayName("UTF8 subjects are replaced without decoding the whole input")
    void replace_utf8() {
        try (Pattern p = Pattern.compile("ü", CodeUnit.UTF8, EnumSet.noneOf(SyntaxOption.class))) {
            byte[] bytes = "grüße, müde".getBytes(StandardCharsets.UTF_8);
            assertThat(Onig.replace(Subject.utf8(bytes), p, "ue")).isEqualTo("grueße, muede");
        }
    }

    @Test
    @DisplayName("Empty matches inside UTF8 characters leave the characters intact")
    void replace_utf8_zeroWidthKeepsCharacters() {
        try (Pattern p = Pattern.compile("x*", CodeUnit.UTF8, EnumSet.noneOf(SyntaxOption.class))) {
            Subject subject = Subject.utf8("café".getBytes(StandardCharsets.UTF_8));

            assertThat(Onig.replace(subject, p, "")).isEqualTo("café");
            assertThat(Onig.replaceUnits(subject, p, "", MatchFlag.NONE).toByteArray())
                .isEqualTo("café".getBytes(StandardCharsets.UTF_8));
        }
    }

    @Test
    @DisplayName("UTF8 output is assembled byte by byte")
    void replace_utf8_unitLevelOutput() {
        byte[] e = "é".getBytes(StandardCharsets.UTF_8);
        try (Pattern p = Pattern.compile("", CodeUnit.UTF8, EnumSet.noneOf(SyntaxOption.class))) {
            byte[] out = Onig.replaceUnits(Subject.utf8(e), p, "-", MatchFlag.NONE).toByteArray();

            assertThat(out).isEqualTo(new byte[] {'-', e[0], '-', e[1], '-'});
        }
    }

    @Test
    @DisplayName("Prefix, suffix and non-BMP template text survive UTF8 replacement")
    void replace_utf8_templateText() {
        try (Pattern p = Pattern.compile("b", CodeUnit.UTF8, EnumSet.noneOf(SyntaxOption.class))) {
            Subject subject = Subject.utf8("ébè".getBytes(StandardCharsets.UTF_8));

            assertThat(Onig.replace(subject, p, "[$`|$']")).isEqualTo("é[é|è]è");
            assertThat(Onig.replace(subject, p, "😀")).isEqualTo("é😀è");
        }
    }

    // ========== Pattern conveniences ==========

    @Test
    @DisplayName("replaceAll on Java text")
    void pattern_replaceAll() {
        try (Pattern p = Pattern.compile("\\s+")) {
            assertThat(p.replaceAll("a  b\tc", " ")).isEqualTo("a b c");
        }
    }

    @Test
    @DisplayName("split keeps empty pieces")
    void pattern_split() {
        try (Pattern p = Pattern.compile(",")) {
            assertThat(p.split("a,,b,")).containsExactly("a", "", "b", "");
            assertThat(p.split("")).containsExactly("");
        }
    }

    // ========== escape ==========

    @Test
    @DisplayName("Metacharacters are escaped")
    void escape_metacharacters() {
        assertThat(Onig.escape("a.b*c")).isEqualTo("a\\.b\\*c");
        assertThat(Onig.escape("\n\t")).isEqualTo("\\n\\t");
        assertThat(Onig.escape("plain")).isEqualTo("plain");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "1+1=2 (yes?)",
        "[ok] {x} $5 ^ | \\ # -",
        "tab\there\r\nnew line\f\u000B",
        "ünïcödé"
    })
    @DisplayName("Escaped text matches itself literally")
    void escape_roundTrip(String text) {
        try (Pattern p = Pattern.compile(Onig.escape(text));
             Pattern free = Pattern.compile(Onig.escape(text), EnumSet.of(SyntaxOption.FREE_SPACING))) {
            assertThat(p.matches(text)).isTrue();
            assertThat(free.matches(text)).isTrue();
        }
    }
}
