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
import com.axonops.libonig.metrics.MetricNames;
import com.axonops.libonig.metrics.OnigMetricsRegistry;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks successive non-overlapping matches of a pattern over a subject.
 *
 * <p>The iterator is either positioned on a match ({@link #current()}) or exhausted. After a
 * zero-width match the next search starts one code unit further on, so iteration always
 * terminates. Advancing an exhausted iterator does nothing.
 *
 * <p>{@link #current()} is a live view that the next {@link #advance()} overwrites;
 * {@link #next()} returns a detached copy.
 *
 * @since 1.0.0
 */
public final class RegexIterator implements Iterator<MatchResult> {

    private final Subject subject;
    private final Pattern pattern;
    private final Set<MatchFlag> flags;
    private final OnigMetricsRegistry metrics;
    private final MatchResult current = new MatchResult();
    private boolean exhausted;

    RegexIterator(Subject subject, Pattern pattern, Set<MatchFlag> flags) {
        this.subject = Objects.requireNonNull(subject, "subject cannot be null");
        this.pattern = Objects.requireNonNull(pattern, "pattern cannot be null");
        Objects.requireNonNull(flags, "flags cannot be null");
        this.flags = flags.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(flags));
        this.metrics = pattern.config().metricsRegistry();
        this.exhausted = subject.length() == 0 || !Onig.search(subject, 0, current, pattern, this.flags);
    }

    public Subject subject() {
        return subject;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    /**
     * The match the iterator is positioned on.
     *
     * @throws NoSuchElementException if exhausted
     */
    public MatchResult current() {
        if (exhausted) {
            throw new NoSuchElementException("Onig: Match iterator is exhausted");
        }
        return current;
    }

    /**
     * Moves to the next match, or to the exhausted state.
     */
    public RegexIterator advance() {
        if (exhausted) {
            return this;
        }
        metrics.incrementCounter(MetricNames.MATCHING_ITERATOR_ADVANCES);
        SubMatch whole = current.get(0);
        int from = whole.end();
        if (whole.begin() == from) {
            if (from == subject.length()) {
                exhausted = true;
                return this;
            }
            from++;
        }
        if (!Onig.search(subject, from, current, pattern, flags)) {
            exhausted = true;
        }
        return this;
    }

    @Override
    public boolean hasNext() {
        return !exhausted;
    }

    @Override
    public MatchResult next() {
        MatchResult snapshot = new MatchResult();
        snapshot.copyFrom(current());
        advance();
        return snapshot;
    }

    /**
     * Remaining matches as detached results.
     */
    public Stream<MatchResult> stream() {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * Positioned iterators are equal when their whole matches cover the same span; all exhausted
     * iterators are equal.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RegexIterator that)) {
            return false;
        }
        if (exhausted || that.exhausted) {
            return exhausted == that.exhausted;
        }
        SubMatch mine = current.get(0);
        SubMatch theirs = that.current.get(0);
        return mine.begin() == theirs.begin() && mine.end() == theirs.end();
    }

    @Override
    public int hashCode() {
        if (exhausted) {
            return 0;
        }
        SubMatch whole = current.get(0);
        return 31 * whole.begin() + whole.end() + 1;
    }

    @Override
    public String toString() {
        if (exhausted) {
            return "RegexIterator{exhausted}";
        }
        SubMatch whole = current.get(0);
        return "RegexIterator{match=[" + whole.begin() + ", " + whole.end() + ")}";
    }
}
