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

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * UTF-8 subject backed by a slice of a byte array. The array is passed to the engine as-is.
 */
final class ByteArraySubject extends Subject {

    private final byte[] bytes;
    private final int offset;
    private final int length;
    private final boolean copied;

    ByteArraySubject(byte[] bytes, int offset, int length) {
        this(bytes, offset, length, false);
    }

    ByteArraySubject(byte[] bytes, int offset, int length, boolean copied) {
        super(CodeUnit.UTF8);
        this.bytes = Objects.requireNonNull(bytes, "bytes cannot be null");
        Objects.checkFromIndexSize(offset, length, bytes.length);
        this.offset = offset;
        this.length = length;
        this.copied = copied;
    }

    @Override
    public int length() {
        return length;
    }

    @Override
    public int unitAt(int index) {
        Objects.checkIndex(index, length);
        return bytes[offset + index] & 0xFF;
    }

    @Override
    public String text(int begin, int end) {
        Objects.checkFromToIndex(begin, end, length);
        return new String(bytes, offset + begin, end - begin, StandardCharsets.UTF_8);
    }

    @Override
    protected EngineBuffer createEngineBuffer() {
        return new EngineBuffer(bytes, offset, length, copied);
    }
}
