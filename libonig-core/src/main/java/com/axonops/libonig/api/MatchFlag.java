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

import com.axonops.libonig.engine.EngineOption;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-call flags for search, match, iteration and replacement.
 *
 * @since 1.0.0
 */
public enum MatchFlag {
    /** The subject start is not a line start. */
    NOT_BOL,
    /** The subject end is not a line end. */
    NOT_EOL,
    /** An empty match is not a match. */
    NOT_NULL,
    /** Accepted for compatibility. */
    ANY,
    /** Accepted for compatibility: the engine always sees the text before the search start. */
    PREV_AVAIL,
    /** Replace only the first match. */
    FORMAT_FIRST_ONLY,
    /** Do not copy text outside the matches when replacing. */
    FORMAT_NO_COPY,
    /** Insert the replacement template verbatim. */
    FORMAT_LITERAL;

    /** Shared empty set; never mutate. */
    public static final Set<MatchFlag> NONE = Set.of();

    static EnumSet<EngineOption> engineOptions(Set<MatchFlag> flags) {
        EnumSet<EngineOption> result = EnumSet.noneOf(EngineOption.class);
        if (flags.contains(NOT_BOL)) {
            result.add(EngineOption.NOT_BOL);
        }
        if (flags.contains(NOT_EOL)) {
            result.add(EngineOption.NOT_EOL);
        }
        return result;
    }
}
