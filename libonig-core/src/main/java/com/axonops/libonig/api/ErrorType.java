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

/**
 * Category of a pattern compilation failure, numbered like the standard regex error types.
 *
 * @see PatternCompilationException#getErrorType()
 * @since 1.0.0
 */
public enum ErrorType {
    /** Invalid collating element name. */
    COLLATE(1),
    /** Invalid character class or property name. */
    CTYPE(2),
    /** Invalid or trailing escape. */
    ESCAPE(3),
    /** Back reference to a group or name that does not exist. */
    BACKREF(4),
    /** Unbalanced square bracket. */
    BRACK(5),
    /** Unbalanced parenthesis. */
    PAREN(6),
    /** Invalid character range in a bracket expression. */
    RANGE(7),
    /** Not enough memory to compile. */
    SPACE(8),
    /** Repeat operator without a valid target. */
    BADREPEAT(9),
    /** Invalid range inside {@code {...}}. */
    BADBRACE(10),
    /** Any other malformed pattern. */
    BADPATTERN(11),
    /** Pattern exceeds an engine limit. */
    COMPLEXITY(12),
    /** Engine ran out of stack. */
    STACK(13);

    private final int code;

    ErrorType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
