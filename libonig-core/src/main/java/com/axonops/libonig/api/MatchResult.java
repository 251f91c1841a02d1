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
import com.axonops.libonig.engine.EngineRegion;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Result of a search or match: the whole match at index 0 followed by the capture groups.
 *
 * <p>A MatchResult is a reusable container. It is not ready until it has been passed to
 * {@link Onig#search} or {@link Onig#match}; after that it stays ready, and a call that finds
 * nothing leaves it ready and empty.
 *
 * <pre>{@code
 * Pattern pattern = Pattern.compile("(\\w+)@(?<domain>\\w+)\\.com");
 * MatchResult m = new MatchResult();
 * if (Onig.search(Subject.of("mail bob@example.com"), m, pattern)) {
 *     m.str(1);           // "bob"
 *     m.get("domain");    // "example"
 *     m.prefix().str();   // "mail "
 * }
 * }</pre>
 *
 * <p>Not thread-safe. Sub-matches are views into the subject, which must not change while they
 * are in use.
 *
 * @since 1.0.0
 */
public final class MatchResult implements Iterable<SubMatch> {

  private static final SubMatch[] NO_SUBS = new SubMatch[0];

  private Subject subject;
  private int rangeBegin;
  private int rangeEnd;
  private SubMatch[] subs = NO_SUBS;
  private boolean ready;
  private Pattern pattern;

  public MatchResult() {
    // Not ready until filled by a search
  }

  // ========== Population (drivers only) ==========

  void setNotFound(Subject subject, int rangeBegin, int rangeEnd, Pattern pattern) {
    setRange(subject, rangeBegin, rangeEnd, pattern);
    this.subs = NO_SUBS;
  }

  /**
   * Fills the result from an engine region whose offsets are relative to the subject start.
   *
   * @param groups number of groups to materialize (1 when captures are disabled)
   */
  void setMatch(Subject subject, int rangeBegin, int rangeEnd, Pattern pattern,
                EngineRegion region, int groups) {
    setRange(subject, rangeBegin, rangeEnd, pattern);
    CodeUnit unit = subject.codeUnit();
    SubMatch[] filled = new SubMatch[groups];
    for (int i = 0; i < groups; i++) {
      if (i < region.size() && region.participated(i)) {
        filled[i] = new SubMatch(subject, unit.toUnits(region.begin(i)), unit.toUnits(region.end(i)), true);
      } else {
        filled[i] = SubMatch.unmatched(subject, rangeEnd);
      }
    }
    this.subs = filled;
  }

  private void setRange(Subject subject, int rangeBegin, int rangeEnd, Pattern pattern) {
    this.subject = Objects.requireNonNull(subject, "subject cannot be null");
    Objects.checkFromToIndex(rangeBegin, rangeEnd, subject.length());
    this.rangeBegin = rangeBegin;
    this.rangeEnd = rangeEnd;
    this.pattern = pattern;
    this.ready = true;
  }

  /**
   * Copies another result into this one (sub-matches are immutable and shared).
   */
  void copyFrom(MatchResult other) {
    this.subject = other.subject;
    this.rangeBegin = other.rangeBegin;
    this.rangeEnd = other.rangeEnd;
    this.subs = other.subs;
    this.pattern = other.pattern;
    this.ready = other.ready;
  }

  // ========== State ==========

  /**
   * Whether a search or match has populated this result.
   */
  public boolean ready() {
    return ready;
  }

  /**
   * Whether the last search found nothing.
   *
   * @throws IllegalStateException if not ready
   */
  public boolean isEmpty() {
    checkReady();
    return subs.length == 0;
  }

  /**
   * Number of sub-matches including the whole match; 0 when nothing was found.
   *
   * @throws IllegalStateException if not ready
   */
  public int size() {
    checkReady();
    return subs.length;
  }

  public Subject subject() {
    checkReady();
    return subject;
  }

  public int rangeBegin() {
    checkReady();
    return rangeBegin;
  }

  public int rangeEnd() {
    checkReady();
    return rangeEnd;
  }

  /**
   * Pattern that produced this result.
   */
  public Pattern pattern() {
    checkReady();
    return pattern;
  }

  // ========== Sub-match access ==========

  /**
   * Gets a sub-match by index. Indexes past the last group give an unmatched, empty sub-match
   * at the end of the searched range.
   *
   * @throws IllegalStateException if not ready
   */
  public SubMatch get(int index) {
    checkReady();
    if (index < 0 || index >= subs.length) {
      return SubMatch.unmatched(subject, rangeEnd);
    }
    return subs[index];
  }

  /**
   * Gets a named group. Unknown names give an unmatched sub-match.
   *
   * @throws IllegalStateException if not ready
   */
  public SubMatch get(String name) {
    Objects.requireNonNull(name, "name cannot be null");
    checkReady();
    int index = pattern != null ? pattern.nameToIndex(name) : -1;
    return get(index);
  }

  /**
   * Start of group {@code index} in code units.
   */
  public int position(int index) {
    return get(index).begin();
  }

  /**
   * Length of group {@code index} in code units.
   */
  public int length(int index) {
    return get(index).length();
  }

  /**
   * Text of group {@code index}; empty when it did not participate.
   */
  public String str(int index) {
    return get(index).str();
  }

  /**
   * Whole match text.
   */
  public String str() {
    return str(0);
  }

  /**
   * Text between the start of the searched range and the match.
   */
  public SubMatch prefix() {
    checkReady();
    if (subs.length == 0) {
      return SubMatch.unmatched(subject, rangeBegin);
    }
    return new SubMatch(subject, rangeBegin, subs[0].begin(), rangeBegin != subs[0].begin());
  }

  /**
   * Text between the match and the end of the searched range.
   */
  public SubMatch suffix() {
    checkReady();
    if (subs.length == 0) {
      return SubMatch.unmatched(subject, rangeEnd);
    }
    return new SubMatch(subject, subs[0].end(), rangeEnd, subs[0].end() != rangeEnd);
  }

  // ========== Formatting ==========

  /**
   * Expands a replacement template against this match.
   *
   * @see ReplacementTemplate
   */
  public String format(String template) {
    return format(template, MatchFlag.NONE);
  }

  public String format(String template, Set<MatchFlag> flags) {
    Objects.requireNonNull(template, "template cannot be null");
    checkReady();
    if (flags.contains(MatchFlag.FORMAT_LITERAL)) {
      return template;
    }
    return ReplacementTemplate.expand(template, this);
  }

  @Override
  public Iterator<SubMatch> iterator() {
    checkReady();
    SubMatch[] snapshot = subs;
    return new Iterator<>() {
      private int next;

      @Override
      public boolean hasNext() {
        return next < snapshot.length;
      }

      @Override
      public SubMatch next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return snapshot[next++];
      }
    };
  }

  @Override
  public String toString() {
    if (!ready) {
      return "MatchResult{not ready}";
    }
    return "MatchResult{range=[" + rangeBegin + ", " + rangeEnd + "), subs=" + Arrays.toString(subs) + "}";
  }

  private void checkReady() {
    if (!ready) {
      throw new IllegalStateException("Onig: MatchResult is not ready (no search has populated it)");
    }
  }
}
