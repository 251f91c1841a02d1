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

import java.util.Objects;

/**
 * Contiguous byte view of a subject in the engine's layout.
 *
 * <p>{@code bytes[offset .. offset + length)} holds the subject; engine offsets are relative to
 * {@code offset}. When {@code copied} is false the array is the caller's own storage (zero-copy).
 *
 * @param bytes backing array
 * @param offset first byte of the subject
 * @param length subject length in bytes
 * @param copied whether the bytes were materialized from a non-contiguous subject
 * @since 1.0.0
 */
public record EngineBuffer(byte[] bytes, int offset, int length, boolean copied) {

    public EngineBuffer {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        Objects.checkFromIndexSize(offset, length, bytes.length);
    }

    /**
     * Exclusive end of the subject inside {@link #bytes()}.
     */
    public int end() {
        return offset + length;
    }
}
