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
 * UTF-16 subject over Java text. Java chars are UTF-16 code units, so positions line up with
 * {@link String} indices.
 */
final class CharSequenceSubject extends Subject {

    private final CharSequence text;

    CharSequenceSubject(CharSequence text) {
        super(CodeUnit.UTF16);
        this.text = Objects.requireNonNull(text, "text cannot be null");
    }

    @Override
    public int length() {
        return text.length();
    }

    @Override
    public int unitAt(int index) {
        return text.charAt(index);
    }

    @Override
    public String text(int begin, int end) {
        return text.subSequence(begin, end).toString();
    }

    @Override
    protected EngineBuffer createEngineBuffer() {
        byte[] bytes = CodeUnit.UTF16.encode(text.toString());
        return new EngineBuffer(bytes, 0, bytes.length, true);
    }
}
