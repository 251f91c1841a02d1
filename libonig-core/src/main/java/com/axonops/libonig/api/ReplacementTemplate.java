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

import com.axonops.libonig.encoding.CodeUnit;
import com.axonops.libonig.encoding.Subject;
import com.axonops.libonig.encoding.UnitBuilder;

import java.util.Objects;

/**
 * Expands replacement templates against a {@link MatchResult}.
 *
 * <h2>Dollar references (always available)</h2>
 * <ul>
 *   <li>{@code $$} - a literal dollar
 *   <li>{@code $&} or {@code $0} - the whole match
 *   <li>{@code $`} / {@code $'} - text before / after the match
 *   <li>{@code $+} - the highest-numbered group that participated
 *   <li>{@code $N} - group N, taking the longest digit prefix that names an existing group
 *   <li>{@code ${N}} / {@code ${name}} - group by number or name
 * </ul>
 *
 * <h2>Backslash references (pattern compiled with {@link SyntaxOption#NATIVE_BACKREFS})</h2>
 * <ul>
 *   <li>{@code \N} - group N when the whole digit run names a group, otherwise copied verbatim
 *   <li>{@code \k<name>} / {@code \k'name'} - named group
 * </ul>
 *
 * <p>{@code \\}, {@code \n}, {@code \t} and {@code \r} are recognized in both dialects. Anything
 * else is copied as written. References to groups that do not exist or did not participate
 * expand to nothing; expansion never throws for them.
 *
 * @since 1.0.0
 */
public final class ReplacementTemplate {

    private ReplacementTemplate() {
        // Utility class
    }

    /**
     * Expands {@code template} against {@code match}.
     *
     * @throws IllegalStateException if the match is not ready
     */
    public static String expand(String template, MatchResult match) {
        Objects.requireNonNull(template, "template cannot be null");
        Objects.requireNonNull(match, "match cannot be null");
        Subject subject = match.subject();
        UnitBuilder out = new UnitBuilder(
            subject == null ? CodeUnit.UTF16 : subject.codeUnit(), template.length() + 16);
        expand(template, match, out);
        return out.toString();
    }

    /**
     * Appends the expansion of {@code template} to {@code out}.
     */
    public static void expand(String template, MatchResult match, StringBuilder out) {
        Objects.requireNonNull(out, "out cannot be null");
        out.append(expand(template, match));
    }

    /**
     * Appends the expansion of {@code template} to {@code out} at code-unit level. Group text is
     * copied as subject units, so the builder must use the subject's code unit.
     */
    public static void expand(String template, MatchResult match, UnitBuilder out) {
        Objects.requireNonNull(template, "template cannot be null");
        Objects.requireNonNull(match, "match cannot be null");
        Objects.requireNonNull(out, "out cannot be null");
        Pattern pattern = match.pattern();
        boolean backslashRefs = pattern != null && pattern.options().contains(SyntaxOption.NATIVE_BACKREFS);

        int len = template.length();
        int i = 0;
        while (i < len) {
            char c = template.charAt(i);
            if (c == '$') {
                i = expandDollar(template, i, match, out);
            } else if (c == '\\') {
                i = expandBackslash(template, i, match, backslashRefs, out);
            } else {
                int literalEnd = i + 1;
                while (literalEnd < len && template.charAt(literalEnd) != '$' && template.charAt(literalEnd) != '\\') {
                    literalEnd++;
                }
                out.append(template.substring(i, literalEnd));
                i = literalEnd;
            }
        }
    }

    // ========== $ dialect ==========

    private static int expandDollar(String t, int at, MatchResult m, UnitBuilder out) {
        int i = at + 1;
        if (i >= t.length()) {
            out.append('$');
            return i;
        }
        char n = t.charAt(i);
        switch (n) {
            case '$' -> {
                out.append('$');
                return i + 1;
            }
            case '&' -> {
                appendGroup(m, 0, out);
                return i + 1;
            }
            case '`' -> {
                appendIfMatched(m.prefix(), m, out);
                return i + 1;
            }
            case '\'' -> {
                appendIfMatched(m.suffix(), m, out);
                return i + 1;
            }
            case '+' -> {
                appendGroup(m, lastParticipatingGroup(m), out);
                return i + 1;
            }
            case '{' -> {
                return expandBraced(t, i + 1, m, out);
            }
            default -> {
                if (isDigit(n)) {
                    return expandDollarDigits(t, i, m, out);
                }
                out.append('$').append(n);
                return i + 1;
            }
        }
    }

    /**
     * {@code ${...}} starting after the opening brace.
     */
    private static int expandBraced(String t, int nameStart, MatchResult m, UnitBuilder out) {
        int close = t.indexOf('}', nameStart);
        if (close < 0) {
            out.append("${");
            return nameStart;
        }
        String name = t.substring(nameStart, close);
        if (!name.isEmpty() && allDigits(name)) {
            appendGroup(m, parseGroup(name), out);
        } else if (!name.isEmpty()) {
            appendGroup(m, groupIndex(m, name), out);
        }
        return close + 1;
    }

    /**
     * Bare {@code $N}: the longest digit prefix naming an existing group wins; when none does,
     * the whole digit run is consumed and expands to nothing.
     */
    private static int expandDollarDigits(String t, int digitsStart, MatchResult m, UnitBuilder out) {
        int runEnd = digitRunEnd(t, digitsStart);
        int groups = m.size();
        for (int end = runEnd; end > digitsStart; end--) {
            int group = parseGroup(t.substring(digitsStart, end));
            if (group >= 0 && group < groups) {
                appendGroup(m, group, out);
                return end;
            }
        }
        return runEnd;
    }

    // ========== \ dialect ==========

    private static int expandBackslash(String t, int at, MatchResult m, boolean backslashRefs, UnitBuilder out) {
        int i = at + 1;
        if (i >= t.length()) {
            out.append('\\');
            return i;
        }
        char n = t.charAt(i);
        switch (n) {
            case '\\' -> {
                out.append('\\');
                return i + 1;
            }
            case 'n' -> {
                out.append('\n');
                return i + 1;
            }
            case 't' -> {
                out.append('\t');
                return i + 1;
            }
            case 'r' -> {
                out.append('\r');
                return i + 1;
            }
            default -> {
                if (backslashRefs && isDigit(n)) {
                    return expandBackslashDigits(t, i, m, out);
                }
                if (backslashRefs && n == 'k') {
                    return expandNamedBackref(t, i + 1, m, out);
                }
                out.append('\\').append(n);
                return i + 1;
            }
        }
    }

    private static int expandBackslashDigits(String t, int digitsStart, MatchResult m, UnitBuilder out) {
        int runEnd = digitRunEnd(t, digitsStart);
        int group = parseGroup(t.substring(digitsStart, runEnd));
        if (group >= 0 && group < m.size()) {
            appendGroup(m, group, out);
        } else {
            // not a group: keep the escape as written
            out.append('\\').append(t.substring(digitsStart, runEnd));
        }
        return runEnd;
    }

    /**
     * {@code \k<name>} or {@code \k'name'} starting after the {@code k}.
     */
    private static int expandNamedBackref(String t, int open, MatchResult m, UnitBuilder out) {
        if (open < t.length()) {
            char delimiter = t.charAt(open);
            char closing = delimiter == '<' ? '>' : delimiter == '\'' ? '\'' : 0;
            if (closing != 0) {
                int close = t.indexOf(closing, open + 1);
                if (close > open + 1) {
                    appendGroup(m, groupIndex(m, t.substring(open + 1, close)), out);
                    return close + 1;
                }
            }
        }
        out.append("\\k");
        return open;
    }

    // ========== Helpers ==========

    private static int lastParticipatingGroup(MatchResult m) {
        for (int g = m.size() - 1; g >= 1; g--) {
            if (m.get(g).matched()) {
                return g;
            }
        }
        return -1;
    }

    private static int groupIndex(MatchResult m, String name) {
        Pattern pattern = m.pattern();
        return pattern == null ? -1 : pattern.nameToIndex(name);
    }

    private static void appendGroup(MatchResult m, int group, UnitBuilder out) {
        if (group < 0 || group >= m.size()) {
            return;
        }
        appendIfMatched(m.get(group), m, out);
    }

    private static void appendIfMatched(SubMatch sub, MatchResult m, UnitBuilder out) {
        if (sub.matched() && !m.isEmpty()) {
            out.appendUnits(sub.subject(), sub.begin(), sub.end());
        }
    }

    /**
     * Parses a digit run, saturating so that absurdly long runs never name a group.
     */
    private static int parseGroup(String digits) {
        int value = 0;
        for (int i = 0; i < digits.length(); i++) {
            value = value * 10 + (digits.charAt(i) - '0');
            if (value > 100_000) {
                return Integer.MAX_VALUE;
            }
        }
        return value;
    }

    private static int digitRunEnd(String t, int from) {
        int i = from;
        while (i < t.length() && isDigit(t.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean allDigits(String s) {
        return digitRunEnd(s, 0) == s.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
