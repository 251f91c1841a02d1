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

import org.jcodings.Encoding;
import org.jcodings.specific.UTF16BEEncoding;
import org.jcodings.specific.UTF16LEEncoding;
import org.jcodings.specific.UTF32BEEncoding;
import org.jcodings.specific.UTF32LEEncoding;
import org.jcodings.specific.UTF8Encoding;

import java.io.ByteArrayOutputStream;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Fixed-width storage unit of a subject or pattern.
 *
 * <p>Each constant knows its width in bytes, the engine encoding used for it and how a single
 * unit is laid out in the byte buffer handed to the engine. Wide units use the host byte order:
 *
 * <ul>
 *   <li>{@link #UTF8} - 1 byte, UTF-8</li>
 *   <li>{@link #UTF16} - 2 bytes, UTF-16LE or UTF-16BE</li>
 *   <li>{@link #UTF32} - 4 bytes, UTF-32LE or UTF-32BE</li>
 * </ul>
 *
 * <p>Engine offsets are always in bytes; {@link #toUnits(int)} converts them back and rejects
 * offsets that are not a multiple of the width.
 *
 * @since 1.0.0
 */
public enum CodeUnit {

    UTF8(1, 256) {
        @Override
        public Encoding engineEncoding() {
            return UTF8Encoding.INSTANCE;
        }

        @Override
        public byte[] encode(String text) {
            return text.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        void writeUnit(int unit, byte[] dst, int offset) {
            dst[offset] = (byte) unit;
        }

        @Override
        public String decode(Subject subject, int begin, int end) {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream(end - begin);
            for (int i = begin; i < end; i++) {
                bytes.write(subject.unitAt(i));
            }
            return bytes.toString(StandardCharsets.UTF_8);
        }
    },

    UTF16(2, 128) {
        @Override
        public Encoding engineEncoding() {
            return LITTLE_ENDIAN ? UTF16LEEncoding.INSTANCE : UTF16BEEncoding.INSTANCE;
        }

        @Override
        public byte[] encode(String text) {
            byte[] out = new byte[text.length() * 2];
            for (int i = 0; i < text.length(); i++) {
                writeUnit(text.charAt(i), out, i * 2);
            }
            return out;
        }

        @Override
        void writeUnit(int unit, byte[] dst, int offset) {
            if (LITTLE_ENDIAN) {
                dst[offset] = (byte) unit;
                dst[offset + 1] = (byte) (unit >>> 8);
            } else {
                dst[offset] = (byte) (unit >>> 8);
                dst[offset + 1] = (byte) unit;
            }
        }

        @Override
        public String decode(Subject subject, int begin, int end) {
            StringBuilder sb = new StringBuilder(end - begin);
            for (int i = begin; i < end; i++) {
                sb.append((char) subject.unitAt(i));
            }
            return sb.toString();
        }
    },

    UTF32(4, 128) {
        @Override
        public Encoding engineEncoding() {
            return LITTLE_ENDIAN ? UTF32LEEncoding.INSTANCE : UTF32BEEncoding.INSTANCE;
        }

        @Override
        public byte[] encode(String text) {
            int[] codePoints = text.codePoints().toArray();
            byte[] out = new byte[codePoints.length * 4];
            for (int i = 0; i < codePoints.length; i++) {
                writeUnit(codePoints[i], out, i * 4);
            }
            return out;
        }

        @Override
        void writeUnit(int unit, byte[] dst, int offset) {
            if (LITTLE_ENDIAN) {
                dst[offset] = (byte) unit;
                dst[offset + 1] = (byte) (unit >>> 8);
                dst[offset + 2] = (byte) (unit >>> 16);
                dst[offset + 3] = (byte) (unit >>> 24);
            } else {
                dst[offset] = (byte) (unit >>> 24);
                dst[offset + 1] = (byte) (unit >>> 16);
                dst[offset + 2] = (byte) (unit >>> 8);
                dst[offset + 3] = (byte) unit;
            }
        }

        @Override
        public String decode(Subject subject, int begin, int end) {
            StringBuilder sb = new StringBuilder(end - begin);
            for (int i = begin; i < end; i++) {
                sb.appendCodePoint(subject.unitAt(i));
            }
            return sb.toString();
        }
    };

    private static final boolean LITTLE_ENDIAN = ByteOrder.nativeOrder() == ByteOrder.LITTLE_ENDIAN;

    private final int width;
    private final int classScanLimit;

    CodeUnit(int width, int classScanLimit) {
        this.width = width;
        this.classScanLimit = classScanLimit;
    }

    /**
     * Width of one unit in bytes (1, 2 or 4).
     */
    public int width() {
        return width;
    }

    /**
     * Exclusive upper bound of the unit values scanned when a POSIX bracket class is expanded
     * against a locale: all byte values for UTF-8, ASCII for the wider units.
     */
    public int classScanLimit() {
        return classScanLimit;
    }

    /**
     * Engine encoding for this unit, in host byte order for wide units.
     */
    public abstract Encoding engineEncoding();

    /**
     * Serializes Java text into the engine byte layout of this unit.
     *
     * @param text pattern or subject text
     * @return engine bytes
     */
    public abstract byte[] encode(String text);

    /**
     * Decodes {@code [begin, end)} of a subject into Java text.
     */
    public abstract String decode(Subject subject, int begin, int end);

    abstract void writeUnit(int unit, byte[] dst, int offset);

    /**
     * Converts an engine byte offset into a unit count.
     *
     * @param byteOffset offset reported by the engine
     * @return offset in code units
     * @throws IllegalStateException if the offset is not a multiple of the unit width
     */
    public int toUnits(int byteOffset) {
        if (byteOffset % width != 0) {
            throw new IllegalStateException(
                "Onig: Engine returned byte offset " + byteOffset + " which is not aligned to "
                    + name() + " units of " + width + " bytes");
        }
        return byteOffset / width;
    }

    /**
     * Converts a unit count into an engine byte offset.
     */
    public int toBytes(int units) {
        return units * width;
    }

    /**
     * Copies every unit of the subject into a freshly allocated engine buffer.
     */
    byte[] materialize(Subject subject) {
        int length = subject.length();
        byte[] out = new byte[length * width];
        for (int i = 0; i < length; i++) {
            writeUnit(subject.unitAt(i), out, i * width);
        }
        return out;
    }
}
