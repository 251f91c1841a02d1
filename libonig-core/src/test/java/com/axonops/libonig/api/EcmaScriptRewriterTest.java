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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ECMAScript Rewriting")
class EcmaScriptRewriterTest {

    @Test
    @DisplayName("Anchors become buffer anchors without multiline")
    void anchors_singleLine() {
        assertThat(EcmaScriptRewriter.rewrite("^ab$", false)).isEqualTo("\\Aab\\z");
    }

    @Test
    @DisplayName("Anchors become line-boundary lookarounds with multiline")
    void anchors_multiline() {
        assertThat(EcmaScriptRewriter.rewrite("^a$", true))
            .isEqualTo(EcmaScriptRewriter.LINE_START + "a" + EcmaScriptRewriter.LINE_END);
    }

    @Test
    @DisplayName("Anchors inside brackets and escaped anchors are kept")
    void anchors_inBracketsOrEscaped_kept() {
        assertThat(EcmaScriptRewriter.rewrite("[^$]\\^\\$", false)).isEqualTo("[^$]\\^\\$");
        assertThat(EcmaScriptRewriter.rewrite("[[:digit:]^]$", false)).isEqualTo("[[:digit:]^]\\z");
    }

    @ParameterizedTest
    @CsvSource({
        "'\\x41', '\\x{41}'",
        "'\\u00e9', '\\x{00e9}'",
        "'\\0', '\\x{0}'",
        "'a\\0b', 'a\\x{0}b'",
        "'\\01', '\\01'",
        "'\\xZZ', '\\xZZ'",
        "'\\u12', '\\u12'",
        "'\\d+\\.', '\\d+\\.'"
    })
    @DisplayName("Code point escapes are normalized, other escapes copied")
    void escapes(String input, String expected) {
        assertThat(EcmaScriptRewriter.rewrite(input, false)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Trailing backslash is copied")
    void trailingBackslash() {
        assertThat(EcmaScriptRewriter.rewrite("a\\", false)).isEqualTo("a\\");
    }
}
