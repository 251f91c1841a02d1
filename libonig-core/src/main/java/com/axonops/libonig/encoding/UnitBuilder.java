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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Growable output of code units, decoded to text only once at the end.
 *
 * <p>Slices of a subject are copied unit by unit, so a multi-byte UTF-8 character that is split
 * across two appends is reassembled intact. Java text appended with {@link #append(CharSequence)}
 * is encoded into the builder's unit first.
 *
 * <pre>{@code
 * UnitBuilder out = new UnitBuilder(CodeUnit.UTF8, subject.length());
 * out.appendUnits(subject, 0, 2).append("x").appendUnits(subject, 2, subject.length());
 * byte[] bytes = out.toByteArray();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class UnitBuilder {

    private final CodeUnit codeUnit;
    // UTF-8 keeps raw bytes; UTF-16 and UTF-32 units are lossless as Java chars and code points
    private final ByteArrayOutputStream bytes;
    private final StringBuilder chars;

    public UnitBuilder(CodeUnit codeUnit) {
        this(codeUnit, 16);
    }

    public UnitBuilder(CodeUnit codeUnit, int capacity) {
        this.codeUnit = Objects.requireNonNull(codeUnit, "codeUnit cannot be null");
        if (codeUnit == CodeUnit.UTF8) {
            this.bytes = new ByteArrayOutputStream(Math.max(capacity, 16));
            this.chars = null;
        } else {
            this.bytes = null;
            this.chars = new StringBuilder(Math.max(capacity, 16));
        }
    }

    public CodeUnit codeUnit() {
        return codeUnit;
    }

    /**
     * Appends the units {@code [begin, end)} of {@code subject} unchanged.
     *
     * @throws IllegalArgumentException if the subject has a different code unit
     */
    public UnitBuilder appendUnits(Subject subject, int begin, int end) {
        Objects.requireNonNull(subject, "subject cannot be null");
        if (subject.codeUnit() != codeUnit) {
            throw new IllegalArgumentException(
                "Onig: Cannot append " + subject.codeUnit() + " units to a " + codeUnit + " builder");
        }
        Objects.checkFromToIndex(begin, end, subject.length());
        for (int i = begin; i < end; i++) {
            int unit = subject.unitAt(i);
            if (bytes != null) {
                bytes.write(unit);
            } else if (codeUnit == CodeUnit.UTF16) {
                chars.append((char) unit);
            } else {
                chars.appendCodePoint(unit);
            }
        }
        return this;
    }

    /**
     * Appends Java text, encoded into this builder's unit.
     */
    public UnitBuilder append(CharSequence text) {
        if (bytes != null) {
            byte[] encoded = text.toString().getBytes(StandardCharsets.UTF_8);
            bytes.write(encoded, 0, encoded.length);
        } else {
            chars.append(text);
        }
        return this;
    }

    public UnitBuilder append(char c) {
        if (bytes != null && c < 0x80) {
            bytes.write(c);
            return this;
        }
        return append(String.valueOf(c));
    }

    /**
     * Number of units appended so far.
     */
    public int length() {
        if (bytes != null) {
            return bytes.size();
        }
        return codeUnit == CodeUnit.UTF16 ? chars.length() : chars.codePointCount(0, chars.length());
    }

    /**
     * The units in UTF-8 form. For a UTF-8 builder these are exactly the bytes appended, including
     * any that are not well-formed UTF-8.
     */
    public byte[] toByteArray() {
        if (bytes != null) {
            return bytes.toByteArray();
        }
        return chars.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Decodes the appended units as text.
     */
    @Override
    public String toString() {
        return bytes != null ? bytes.toString(StandardCharsets.UTF_8) : chars.toString();
    }
}
