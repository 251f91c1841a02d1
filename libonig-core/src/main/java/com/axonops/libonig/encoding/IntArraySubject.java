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
 * UTF-32 subject over an array of code points.
 */
final class IntArraySubject extends Subject {

    private final int[] codePoints;

    IntArraySubject(int[] codePoints) {
        super(CodeUnit.UTF32);
        this.codePoints = Objects.requireNonNull(codePoints, "codePoints cannot be null");
    }

    @Override
    public int length() {
        return codePoints.length;
    }

    @Override
    public int unitAt(int index) {
        return codePoints[index];
    }

    @Override
    public String text(int begin, int end) {
        Objects.checkFromToIndex(begin, end, codePoints.length);
        return new String(codePoints, begin, end - begin);
    }
}
