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
 * Rewrites ECMAScript pattern text into the native grammar before compilation.
 *
 * <p>Anchors outside bracket expressions become absolute ({@code \A}, {@code \z}), or line-aware
 * lookarounds when multiline is requested, leaving the dot untouched. {@code \xHH}, the four-digit
 * unicode escape and a lone {@code \0} become {@code \x{...}} code point escapes.
 */
final class EcmaScriptRewriter {

    static final String LINE_START =
        "(?:\\A|(?<=\\n)|(?<=\\r\\n)|(?<=\\r)|(?<=\\x{2028})|(?<=\\x{2029}))";
    static final String LINE_END =
        "(?:\\z|(?=\\r\\n|\\r|\\n|\\x{2028}|\\x{2029}))";

    private EcmaScriptRewriter() {
    }

    static String rewrite(String pattern, boolean multiline) {
        StringBuilder out = new StringBuilder(pattern.length() + 16);
        int len = pattern.length();
        int depth = 0;
        int i = 0;
        while (i < len) {
            char c = pattern.charAt(i);
            if (c == '\\' && i + 1 < len) {
                i = rewriteEscape(pattern, i, out);
                continue;
            }
            if (c == '[') {
                depth++;
            } else if (c == ']' && depth > 0) {
                depth--;
            } else if (depth == 0 && c == '^') {
                out.append(multiline ? LINE_START : "\\A");
                i++;
                continue;
            } else if (depth == 0 && c == '$') {
                out.append(multiline ? LINE_END : "\\z");
                i++;
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    /**
     * Handles the escape at {@code i}, returning the index after it.
     */
    private static int rewriteEscape(String pattern, int i, StringBuilder out) {
        char next = pattern.charAt(i + 1);
        if (next == 'x' && hexRun(pattern, i + 2, 2)) {
            out.append("\\x{").append(pattern, i + 2, i + 4).append('}');
            return i + 4;
        }
        if (next == 'u' && hexRun(pattern, i + 2, 4)) {
            out.append("\\x{").append(pattern, i + 2, i + 6).append('}');
            return i + 6;
        }
        if (next == '0' && (i + 2 >= pattern.length() || !isOctal(pattern.charAt(i + 2)))) {
            out.append("\\x{0}");
            return i + 2;
        }
        out.append('\\').append(next);
        return i + 2;
    }

    private static boolean hexRun(String s, int from, int count) {
        if (from + count > s.length()) {
            return false;
        }
        for (int i = from; i < from + count; i++) {
            if (!isHex(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isOctal(char c) {
        return c >= '0' && c <= '7';
    }
}
