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

package com.axonops.libonig.encoding;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for unit-level output assembly.
 */
@DisplayName("UnitBuilder")
class UnitBuilderTest {

    @Test
    @DisplayName("A UTF8 character split across appends is reassembled")
    void utf8_splitCharacter() {
        Subject subject = Subject.utf8("naïve".getBytes(StandardCharsets.UTF_8));
        UnitBuilder out = new UnitBuilder(CodeUnit.UTF8);

        // ï is two bytes at [2, 4)
        out.appendUnits(subject, 0, 3).append("").appendUnits(subject, 3, subject.length());

        assertThat(out.toString()).isEqualTo("naïve");
        assertThat(out.length()).isEqualTo(6);
    }

    @Test
    @DisplayName("Java text is encoded into UTF8 units")
    void utf8_appendText() {
        UnitBuilder out = new UnitBuilder(CodeUnit.UTF8).append("é").append('-').append("😀");

        assertThat(out.length()).isEqualTo(2 + 1 + 4);
        assertThat(out.toString()).isEqualTo("é-😀");
    }

    @Test
    @DisplayName("UTF16 surrogate halves from separate appends form one character")
    void utf16_splitSurrogates() {
        Subject subject = Subject.of("a😀b");
        UnitBuilder out = new UnitBuilder(CodeUnit.UTF16)
            .appendUnits(subject, 0, 2)
            .appendUnits(subject, 2, 4);

        assertThat(out.toString()).isEqualTo("a😀b");
        assertThat(out.toByteArray()).isEqualTo("a😀b".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("UTF32 units are code points")
    void utf32_codePoints() {
        Subject subject = Subject.codePoints("x😀");
        UnitBuilder out = new UnitBuilder(CodeUnit.UTF32).appendUnits(subject, 0, 2);

        assertThat(out.length()).isEqualTo(2);
        assertThat(out.toString()).isEqualTo("x😀");
    }

    @Test
    @DisplayName("Units of a different width are rejected")
    void mismatchedUnit() {
        UnitBuilder out = new UnitBuilder(CodeUnit.UTF8);

        assertThatIllegalArgumentException()
            .isThrownBy(() -> out.appendUnits(Subject.of("abc"), 0, 1))
            .withMessageContaining("UTF16");
    }

    @Test
    @DisplayName("Out-of-range slices are rejected")
    void outOfRange() {
        UnitBuilder out = new UnitBuilder(CodeUnit.UTF16);

        assertThatThrownBy(() -> out.appendUnits(Subject.of("abc"), 2, 4))
            .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
