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

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Yields selected pieces of each match, and optionally the text between matches.
 *
 * <p>Each selector is a group number, or {@link #GAP} for the text between the previous match
 * (or the subject start) and the current one. For every match the selectors are emitted in
 * order. After the last match a selected {@code GAP} yields the remaining text once, even when
 * it is empty. A {@code GAP} is only emitted as the first selector of a match or as that trailing
 * piece.
 *
 * <pre>{@code
 * TokenIterator tokens = Onig.tokenize(Subject.of("apple,banana,cherry"), Pattern.compile(","), TokenIterator.GAP);
 * // apple, banana, cherry
 * }</pre>
 *
 * @since 1.0.0
 */
public final class TokenIterator implements Iterator<SubMatch> {

    /** Selects the unmatched text before each match. */
    public static final int GAP = -1;

    private enum State { ACTIVE, TRAILING, FINISHED }

    private final RegexIterator matches;
    private final Subject subject;
    private final int[] selectors;
    private final boolean gapSelected;

    private State state;
    private int cursor;
    private int previousEnd;
    private SubMatch token;

    TokenIterator(RegexIterator matches, int... selectors) {
        this.matches = Objects.requireNonNull(matches, "matches cannot be null");
        Objects.requireNonNull(selectors, "selectors cannot be null");
        if (selectors.length == 0) {
            throw new IllegalArgumentException("At least one selector is required");
        }
        boolean gap = false;
        for (int selector : selectors) {
            if (selector < GAP) {
                throw new IllegalArgumentException("Invalid selector: " + selector);
            }
            gap |= selector == GAP;
        }
        this.selectors = selectors.clone();
        this.gapSelected = gap;
        this.subject = matches.subject();

        if (matches.isExhausted()) {
            if (gapSelected) {
                token = gap(0, subject.length());
                state = State.TRAILING;
            } else {
                state = State.FINISHED;
            }
        } else {
            state = State.ACTIVE;
            settle();
        }
    }

    public boolean isFinished() {
        return state == State.FINISHED;
    }

    /**
     * The token the iterator is positioned on.
     *
     * @throws NoSuchElementException if finished
     */
    public SubMatch current() {
        if (state == State.FINISHED) {
            throw new NoSuchElementException("Onig: Token iterator is finished");
        }
        return token;
    }

    /**
     * Moves to the next token, or to the finished state.
     */
    public TokenIterator advance() {
        switch (state) {
            case ACTIVE -> {
                cursor++;
                settle();
            }
            case TRAILING -> {
                token = null;
                state = State.FINISHED;
            }
            case FINISHED -> {
                // terminal
            }
        }
        return this;
    }

    /**
     * Positions on the token for {@code cursor}, moving through matches as selectors run out.
     */
    private void settle() {
        while (true) {
            if (cursor < selectors.length) {
                int selector = selectors[cursor];
                if (selector != GAP) {
                    token = matches.current().get(selector);
                    return;
                }
                if (cursor == 0) {
                    token = gap(previousEnd, matches.current().get(0).begin());
                    return;
                }
                cursor++;
                continue;
            }
            previousEnd = matches.current().get(0).end();
            matches.advance();
            if (matches.isExhausted()) {
                if (gapSelected) {
                    token = gap(previousEnd, subject.length());
                    state = State.TRAILING;
                } else {
                    token = null;
                    state = State.FINISHED;
                }
                return;
            }
            cursor = 0;
        }
    }

    private SubMatch gap(int begin, int end) {
        return new SubMatch(subject, begin, end, begin != end);
    }

    @Override
    public boolean hasNext() {
        return state != State.FINISHED;
    }

    @Override
    public SubMatch next() {
        SubMatch result = current();
        advance();
        return result;
    }

    public Stream<SubMatch> stream() {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * Finished iterators are equal; otherwise the state, selector position and token span must
     * agree.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TokenIterator that)) {
            return false;
        }
        if (state == State.FINISHED || that.state == State.FINISHED) {
            return state == that.state;
        }
        return state == that.state
            && cursor == that.cursor
            && token.begin() == that.token.begin()
            && token.end() == that.token.end()
            && Arrays.equals(selectors, that.selectors);
    }

    @Override
    public int hashCode() {
        if (state == State.FINISHED) {
            return 0;
        }
        return Objects.hash(state, cursor, token.begin(), token.end());
    }

    @Override
    public String toString() {
        return "TokenIterator{state=" + state + ", token=" + (token == null ? "-" : "[" + token.begin() + ", "
            + token.end() + ")") + "}";
    }
}
