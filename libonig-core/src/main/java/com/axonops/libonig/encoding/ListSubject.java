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

import java.util.List;
import java.util.Objects;

/**
 * Subject over a {@link List} of unit values, e.g. a {@code LinkedList}. Nothing about the list's
 * storage is contiguous, so the engine always sees a copy.
 */
final class ListSubject extends Subject {

    private final List<Integer> units;

    ListSubject(List<Integer> units, CodeUnit codeUnit) {
        super(codeUnit);
        this.units = Objects.requireNonNull(units, "units cannot be null");
    }

    @Override
    public int length() {
        return units.size();
    }

    @Override
    public int unitAt(int index) {
        return units.get(index);
    }

    @Override
    protected EngineBuffer createEngineBuffer() {
        CodeUnit unit = codeUnit();
        byte[] bytes = new byte[units.size() * unit.width()];
        int offset = 0;
        // iterate rather than index: linked lists are O(n) per get()
        for (Integer value : units) {
            unit.writeUnit(value, bytes, offset);
            offset += unit.width();
        }
        return new EngineBuffer(bytes, 0, bytes.length, true);
    }
}
