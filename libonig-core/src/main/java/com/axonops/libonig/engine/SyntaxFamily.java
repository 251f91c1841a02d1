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

package com.axonops.libonig.engine;

/**
 * Pattern grammars the engine can parse.
 *
 * @since 1.0.0
 */
public enum SyntaxFamily {
    POSIX_BASIC(true),
    POSIX_EXTENDED(true),
    GREP(true),
    NATIVE(false);

    private final boolean posixBracketClasses;

    SyntaxFamily(boolean posixBracketClasses) {
        this.posixBracketClasses = posixBracketClasses;
    }

    /**
     * Whether the grammar resolves {@code [:alpha:]}-style classes itself.
     */
    public boolean hasPosixBracketClasses() {
        return posixBracketClasses;
    }
}
