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

package com.axonops.libonig.locale;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for expanding POSIX bracket classes into literal member sets.
 */
@DisplayName("POSIX Class Expansion")
class PosixClassExpanderTest {

    private final PosixClassExpander ascii = new PosixClassExpander(CharClassifier.forLocale(Locale.ROOT), 128);

    // ========== Recognized classes ==========

    @Test
    @DisplayName("digit expands to 0-9")
    void digit_expanded() {
        assertThat(ascii.expand("[[:digit:]]+")).isEqualTo("[0123456789]+");
    }

    @Test
    @DisplayName("Negated bracket keeps its caret")
    void negated_bracket() {
        assertThat(ascii.expand("[^[:upper:]]")).isEqualTo("[^ABCDEFGHIJKLMNOPQRSTUVWXYZ]");
    }

    @Test
    @DisplayName("Classes combine with other bracket members")
    void mixedMembers() {
        assertThat(ascii.expand("[_[:xdigit:]]")).isEqualTo("[_0123456789ABCDEFabcdef]");
    }

    @Test
    @DisplayName("Bracket metacharacters are escaped and hyphen moved to the end")
    void punct_escapedAndHyphenLast() {
        assertThat(ascii.expand("[[:punct:]]"))
            .isEqualTo("[!\"#$%&'()*+,./:;<=>?@\\[\\\\\\]^_`\\{|\\}~-]");
    }

    @Test
    @DisplayName("Caret is escaped when it is the first member")
    void caretFirst_escaped() {
        PosixClassExpander caretOnly = new PosixClassExpander((cls, c) -> c == '^', 128);
        assertThat(caretOnly.expand("[[:punct:]]")).isEqualTo("[\\^]");
    }

    @Test
    @DisplayName("Empty class becomes an unmatchable unit")
    void emptyClass_unmatchable() {
        PosixClassExpander none = new PosixClassExpander((cls, c) -> false, 128);
        assertThat(none.expand("[[:alpha:]]")).isEqualTo("[" + PosixClassExpander.UNMATCHABLE + "]");
    }

    @Test
    @DisplayName("Non-root locale adds Latin-1 letters when scanning bytes")
    void unicodeLocale_latin1Letters() {
        PosixClassExpander german = new PosixClassExpander(CharClassifier.forLocale(Locale.GERMANY), 256);
        assertThat(german.expand("[[:lower:]]")).contains("ä", "ö", "ü", "ß").doesNotContain("A");
    }

    // ========== Pass-through ==========

    @ParameterizedTest
    @ValueSource(strings = {
        "[[:bogus:]]",
        "[[:digit]",
        "\\[[:digit:]]",
        "abc",
        "[a-z]",
        "[\\]]"
    })
    @DisplayName("Unknown, malformed and escaped classes pass through unchanged")
    void passThrough(String pattern) {
        assertThat(ascii.expand(pattern)).isEqualTo(pattern);
    }

    @Test
    @DisplayName("Scan limit must be positive")
    void scanLimit_validated() {
        assertThatIllegalArgumentException()
            .isThrownBy(() -> new PosixClassExpander(CharClassifier.forLocale(Locale.ROOT), 0));
    }
}
