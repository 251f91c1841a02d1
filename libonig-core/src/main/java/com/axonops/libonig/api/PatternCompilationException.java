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
 * Thrown when a regex pattern fails to compile.
 *
 * <p>The engine throws it without the pattern text; {@link Pattern} rethrows it with the text
 * attached.
 *
 * @since 1.0.0
 */
public final class PatternCompilationException extends OnigException {

    private final int code;
    private final ErrorType errorType;
    private final String engineMessage;
    private final String pattern;

    public PatternCompilationException(int code, ErrorType errorType, String engineMessage) {
        super("Onig: Pattern compilation failed: " + engineMessage);
        this.code = code;
        this.errorType = errorType;
        this.engineMessage = engineMessage;
        this.pattern = null;
    }

    public PatternCompilationException(int code, ErrorType errorType, String engineMessage, String pattern) {
        super("Onig: Pattern compilation failed: " + engineMessage + " (pattern: " + truncate(pattern) + ")");
        this.code = code;
        this.errorType = errorType;
        this.engineMessage = engineMessage;
        this.pattern = pattern;
    }

    /**
     * Engine status code.
     */
    public int getCode() {
        return code;
    }

    /**
     * What kind of mistake the pattern contains.
     */
    public ErrorType getErrorType() {
        return errorType;
    }

    public String getEngineMessage() {
        return engineMessage;
    }

    /**
     * Pattern text, or null when thrown directly by the engine.
     */
    public String getPattern() {
        return pattern;
    }

    private static String truncate(String s) {
        return s != null && s.length() > 100 ? s.substring(0, 97) + "..." : s;
    }
}
