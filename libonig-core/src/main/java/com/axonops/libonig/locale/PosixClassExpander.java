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

package com.axonops.libonig.locale;

import java.util.Objects;

/**
 * Rewrites POSIX bracket classes ({@code [[:alpha:]]}) into literal unit sets for grammars that do
 * not understand them, using a locale's {@link CharClassifier}.
 *
 * <p>Only recognized class names inside a bracket expression are replaced. Unknown names,
 * unterminated tokens and everything outside brackets are copied unchanged. Backslash escapes are
 * copied as pairs so {@code \[} never opens a bracket.
 *
 * @since 1.0.0
 */
public final class PosixClassExpander {

    /** Stands in for a class with no members so the bracket stays non-empty. */
    static final char UNMATCHABLE = '\u007F';

    private final CharClassifier classifier;
    private final int scanLimit;

    /**
     * @param classifier locale classification
     * @param scanLimit exclusive upper bound of the code points tested for membership
     */
    public PosixClassExpander(CharClassifier classifier, int scanLimit) {
        this.classifier = Objects.requireNonNull(classifier, "classifier cannot be null");
        if (scanLimit <= 0) {
            throw new IllegalArgumentException("scanLimit must be positive: " + scanLimit);
        }
        this.scanLimit = scanLimit;
    }

    public String expand(String pattern) {
        StringBuilder out = new StringBuilder(pattern.length());
        int len = pattern.length();
        int i = 0;
        while (i < len) {
            char c = pattern.charAt(i);
            if (c == '\\' && i + 1 < len) {
                out.append(c).append(pattern.charAt(i + 1));
                i += 2;
            } else if (c == '[') {
                i = expandBracket(pattern, i, out);
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Copies one bracket expression starting at {@code open}, returning the index after it.
     */
    private int expandBracket(String pattern, int open, StringBuilder out) {
        int len = pattern.length();
        int i = open;
        out.append(pattern.charAt(i++));
        if (i < len && pattern.charAt(i) == '^') {
            out.append(pattern.charAt(i++));
        }
        while (i < len && pattern.charAt(i) != ']') {
            char c = pattern.charAt(i);
            if (c == '\\' && i + 1 < len) {
                out.append(c).append(pattern.charAt(i + 1));
                i += 2;
                continue;
            }
            if (c == '[' && i + 2 < len && pattern.charAt(i + 1) == ':') {
                int nameStart = i + 2;
                int colon = nameStart;
                while (colon < len && pattern.charAt(colon) != ':') {
                    colon++;
                }
                if (colon + 1 < len && pattern.charAt(colon + 1) == ']') {
                    PosixClass posixClass = PosixClass.forName(pattern.substring(nameStart, colon));
                    if (posixClass != null) {
                        appendMembers(posixClass, out);
                    } else {
                        out.append(pattern, i, colon + 2);
                    }
                    i = colon + 2;
                } else {
                    // unterminated token
                    out.append(pattern, i, colon);
                    i = colon;
                }
                continue;
            }
            out.append(c);
            i++;
        }
        if (i < len) {
            out.append(pattern.charAt(i++));
        }
        return i;
    }

    private void appendMembers(PosixClass posixClass, StringBuilder out) {
        int start = out.length();
        boolean hyphen = false;
        for (int cp = 0; cp < scanLimit; cp++) {
            if (!classifier.is(posixClass, cp)) {
                continue;
            }
            switch (cp) {
                case '-' -> hyphen = true;
                case '\\', ']', '[', '{', '}' -> out.append('\\').appendCodePoint(cp);
                case '^' -> {
                    if (out.length() == start) {
                        out.append('\\');
                    }
                    out.append('^');
                }
                default -> out.appendCodePoint(cp);
            }
        }
        if (hyphen) {
            out.append('-');
        }
        if (out.length() == start) {
            out.append(UNMATCHABLE);
        }
    }
}
