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

import com.axonops.libonig.api.PatternCompilationException;
import com.axonops.libonig.encoding.CodeUnit;
import com.axonops.libonig.encoding.EngineBuffer;

import java.util.Set;

/**
 * Adapter interface for the regex engine.
 * Enables substituting the engine in unit tests while keeping the production path direct.
 *
 * <p>Production implementation ({@link JoniEngine}) delegates to Joni. Test implementations can
 * return arbitrary status codes to exercise the facade's error handling.</p>
 *
 * <p>All offsets are in bytes relative to {@link EngineBuffer#offset()}.</p>
 *
 * <p><b>Internal API:</b> Not part of public API contract. Used internally by Pattern and the
 * match drivers. Public visibility required for cross-package access from api package.</p>
 */
public interface OnigEngine {

    /** Search/match status: no match. */
    int MISMATCH = -1;

    /** Search/match status: matching was interrupted. */
    int ERR_INTERRUPTED = -2;

    /** Internal engine fault while matching. */
    int ERR_INTERNAL = -11;

    /** Pattern syntax error. */
    int ERR_SYNTAX = -100;

    /** Invalid value in pattern, e.g. an undefined group reference. */
    int ERR_INVALID_VALUE = -200;

    // Lifecycle
    void initialize(Set<CodeUnit> codeUnits);
    void teardown();
    boolean isInitialized();

    // Pattern lifecycle
    EngineHandle compile(byte[] pattern, Set<EngineOption> options, SyntaxFamily syntax, CodeUnit codeUnit)
        throws PatternCompilationException;
    void free(EngineHandle handle);
    int captureCount(EngineHandle handle);
    int nameToIndex(EngineHandle handle, byte[] name);

    // Matching
    int search(EngineHandle handle, EngineBuffer buffer, int windowBegin, int windowEnd,
               Set<EngineOption> options, EngineRegion region);
    int match(EngineHandle handle, EngineBuffer buffer, int at, Set<EngineOption> options, EngineRegion region);

    // Diagnostics
    String errorMessage(int code);
    String version();
}
