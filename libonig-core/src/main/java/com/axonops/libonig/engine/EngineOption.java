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
 * Engine-level options. The first group applies at compile time, the last two at search time.
 *
 * @since 1.0.0
 */
public enum EngineOption {
    /** Case-insensitive matching. */
    IGNORE_CASE,
    /** Free-spacing syntax: whitespace and comments in the pattern are ignored. */
    EXTEND,
    /** Dot also matches newline. */
    DOT_ALL,
    /** {@code $} matches only at the end of the buffer. */
    SINGLE_LINE,
    /** Clears the syntax's default single-line behaviour. */
    NEGATE_SINGLE_LINE,
    /** Plain groups do not capture. */
    DONT_CAPTURE_GROUP,

    /** The buffer start is not the beginning of a line. */
    NOT_BOL,
    /** The buffer end is not the end of a line. */
    NOT_EOL
}
