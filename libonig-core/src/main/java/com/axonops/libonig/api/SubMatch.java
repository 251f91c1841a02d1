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

import com.axonops.libonig.encoding.Subject;

import java.util.Objects;

/**
 * One capture group of a match: a view of {@code [begin, end)} in the subject.
 *
 * <p>Positions are code-unit indices. The text is decoded only when {@link #str()} is called.
 * A group that did not take part in the match has {@code matched() == false} and
 * {@code begin == end ==} the end of the searched range.
 *
 * @since 1.0.0
 */
public final class SubMatch implements Comparable<SubMatch> {

    private final Subject subject;
    private final int begin;
    private final int end;
    private final boolean matched;

    SubMatch(Subject subject, int begin, int end, boolean matched) {
        this.subject = Objects.requireNonNull(subject, "subject cannot be null");
        if (begin < 0 || end < begin || end > subject.length()) {
            throw new IndexOutOfBoundsException(
                "Sub-match [" + begin + ", " + end + ") outside subject of length " + subject.length());
        }
        this.begin = begin;
        this.end = end;
        this.matched = matched;
    }

    static SubMatch unmatched(Subject subject, int position) {
        return new SubMatch(subject, position, position, false);
    }

    public Subject subject() {
        return subject;
    }

    public int begin() {
        return begin;
    }

    public int end() {
        return end;
    }

    public boolean matched() {
        return matched;
    }

    /**
     * Length in code units; 0 when unmatched.
     */
    public int length() {
        return matched ? end - begin : 0;
    }

    /**
     * Matched text, or the empty string when unmatched.
     */
    public String str() {
        return matched ? subject.text(begin, end) : "";
    }

    /**
     * Whether the matched text equals {@code text}.
     */
    public boolean contentEquals(CharSequence text) {
        return str().contentEquals(text);
    }

    /**
     * Compares the matched text lexicographically.
     */
    @Override
    public int compareTo(SubMatch other) {
        return str().compareTo(other.str());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SubMatch that)) {
            return false;
        }
        return subject == that.subject && begin == that.begin && end == that.end && matched == that.matched;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(subject), begin, end, matched);
    }

    @Override
    public String toString() {
        return str();
    }
}
