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
import com.axonops.libonig.engine.SyntaxFamily;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Compile-time options for a {@link Pattern}. Combine them in an {@link EnumSet}.
 *
 * <p>The grammar selectors are mutually exclusive in effect: when several are present the first
 * one in {@link #GRAMMAR_PRIORITY} wins. Without any, {@link #NATIVE} applies.
 *
 * @since 1.0.0
 */
public enum SyntaxOption {
    /** Case-insensitive matching. */
    ICASE,
    /** Native and POSIX grammars: dot matches newline. ECMAScript: anchors match at line breaks. */
    MULTILINE,
    /** Whitespace and {@code #} comments in the pattern are ignored. */
    FREE_SPACING,
    /** Groups do not capture; only the whole match is reported. */
    NOSUBS,

    POSIX_BASIC,
    POSIX_EXTENDED,
    AWK,
    GREP,
    EGREP,
    ECMASCRIPT,
    NATIVE,

    /** Enables {@code \N} and {@code \k<name>} in replacement templates. */
    NATIVE_BACKREFS,
    /** Expands {@code [:class:]} against the pattern's locale. */
    COLLATE,
    /** Accepted for compatibility. */
    OPTIMIZE;

    static final List<SyntaxOption> GRAMMAR_PRIORITY =
        List.of(POSIX_BASIC, POSIX_EXTENDED, AWK, GREP, EGREP, ECMASCRIPT, NATIVE);

    /**
     * The grammar selected by an option set.
     */
    public static SyntaxOption grammar(Set<SyntaxOption> options) {
        for (SyntaxOption grammar : GRAMMAR_PRIORITY) {
            if (options.contains(grammar)) {
                return grammar;
            }
        }
        return NATIVE;
    }

    /**
     * Engine grammar for an option set.
     */
    static SyntaxFamily syntaxFamily(Set<SyntaxOption> options) {
        return switch (grammar(options)) {
            case POSIX_BASIC -> SyntaxFamily.POSIX_BASIC;
            case POSIX_EXTENDED, AWK, EGREP -> SyntaxFamily.POSIX_EXTENDED;
            case GREP -> SyntaxFamily.GREP;
            default -> SyntaxFamily.NATIVE;
        };
    }

    /**
     * Engine compile options for an option set.
     */
    static EnumSet<EngineOption> engineOptions(Set<SyntaxOption> options) {
        EnumSet<EngineOption> result = EnumSet.noneOf(EngineOption.class);
        if (options.contains(ICASE)) {
            result.add(EngineOption.IGNORE_CASE);
        }
        if (grammar(options) == ECMASCRIPT) {
            // line-aware anchors are rewritten into the pattern instead
            result.add(EngineOption.SINGLE_LINE);
        } else if (options.contains(MULTILINE)) {
            result.add(EngineOption.DOT_ALL);
            result.add(EngineOption.NEGATE_SINGLE_LINE);
        } else {
            result.add(EngineOption.SINGLE_LINE);
        }
        if (options.contains(FREE_SPACING)) {
            result.add(EngineOption.EXTEND);
        }
        if (options.contains(NOSUBS)) {
            result.add(EngineOption.DONT_CAPTURE_GROUP);
        }
        return result;
    }

    /**
     * Whether {@code [:class:]} tokens must be expanded before compilation.
     */
    static boolean needsLocaleExpansion(Set<SyntaxOption> options) {
        return options.contains(COLLATE) && !syntaxFamily(options).hasPosixBracketClasses();
    }
}
