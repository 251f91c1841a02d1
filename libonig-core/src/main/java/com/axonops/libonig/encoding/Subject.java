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

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;

/**
 * A sequence of code units that patterns are matched against.
 *
 * <p>Positions are code-unit indices in {@code [0, length()]}. Match results hold a reference to
 * the subject and never copy it, so the subject's storage must not change while results derived
 * from it are in use.
 *
 * <h2>Engine buffers</h2>
 *
 * <p>The engine only reads contiguous bytes. Subjects whose storage already has that layout
 * (UTF-8 {@code byte[]} and heap {@link ByteBuffer}) hand their array straight to the engine.
 * Every other subject is copied once into an owned buffer on first use, and that buffer is reused
 * for all later searches over the same subject.
 *
 * <pre>{@code
 * Subject text = Subject.of("key:value");             // UTF-16 units, String indices
 * Subject raw = Subject.utf8(bytes);                   // UTF-8 units, zero-copy
 * Subject list = Subject.of(units, CodeUnit.UTF32);    // any List, copied
 * }</pre>
 *
 * @since 1.0.0
 */
public abstract class Subject {

    private final CodeUnit codeUnit;
    private EngineBuffer engineBuffer;

    protected Subject(CodeUnit codeUnit) {
        this.codeUnit = Objects.requireNonNull(codeUnit, "codeUnit cannot be null");
    }

    /**
     * UTF-16 subject over Java text; positions are {@code String} indices.
     */
    public static Subject of(CharSequence text) {
        return new CharSequenceSubject(text);
    }

    /**
     * Subject over an arbitrary list of unit values. Always takes the copying path.
     *
     * @param units unit values (bytes 0-255, UTF-16 code units or code points)
     * @param codeUnit width of each element
     */
    public static Subject of(List<Integer> units, CodeUnit codeUnit) {
        return new ListSubject(units, codeUnit);
    }

    /**
     * UTF-8 subject over the whole array, without copying.
     */
    public static Subject utf8(byte[] bytes) {
        return new ByteArraySubject(bytes, 0, bytes.length);
    }

    /**
     * UTF-8 subject over {@code bytes[offset .. offset + length)}, without copying.
     */
    public static Subject utf8(byte[] bytes, int offset, int length) {
        return new ByteArraySubject(bytes, offset, length);
    }

    /**
     * UTF-8 subject over the remaining bytes of a buffer.
     *
     * <p>Accessible heap buffers are used in place; direct or read-only buffers are copied. The
     * buffer's position is not modified.
     */
    public static Subject utf8(ByteBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer cannot be null");
        if (buffer.hasArray()) {
            return new ByteArraySubject(
                buffer.array(), buffer.arrayOffset() + buffer.position(), buffer.remaining());
        }
        byte[] copy = new byte[buffer.remaining()];
        buffer.duplicate().get(copy);
        return new ByteArraySubject(copy, 0, copy.length, true);
    }

    /**
     * UTF-32 subject over an array of code points.
     */
    public static Subject utf32(int[] codePoints) {
        return new IntArraySubject(codePoints);
    }

    /**
     * UTF-32 subject over the code points of Java text; positions are code-point indices.
     */
    public static Subject codePoints(CharSequence text) {
        return new IntArraySubject(text.codePoints().toArray());
    }

    /**
     * Width and encoding of this subject's units.
     */
    public final CodeUnit codeUnit() {
        return codeUnit;
    }

    /**
     * Number of code units.
     */
    public abstract int length();

    /**
     * Unit value at {@code index}.
     */
    public abstract int unitAt(int index);

    /**
     * Text of {@code [begin, end)}.
     */
    public String text(int begin, int end) {
        Objects.checkFromToIndex(begin, end, length());
        return codeUnit.decode(this, begin, end);
    }

    /**
     * Text of the whole subject.
     */
    @Override
    public String toString() {
        return text(0, length());
    }

    /**
     * Whether an engine buffer has already been produced for this subject.
     */
    public final boolean hasEngineBuffer() {
        return engineBuffer != null;
    }

    /**
     * Contiguous engine view of this subject, created on first call.
     */
    public final EngineBuffer engineBuffer() {
        EngineBuffer buffer = engineBuffer;
        if (buffer == null) {
            buffer = createEngineBuffer();
            engineBuffer = buffer;
        }
        return buffer;
    }

    /**
     * Produces the engine view. Contiguous subjects override this to skip the copy.
     */
    protected EngineBuffer createEngineBuffer() {
        byte[] bytes = codeUnit.materialize(this);
        return new EngineBuffer(bytes, 0, bytes.length, true);
    }
}
