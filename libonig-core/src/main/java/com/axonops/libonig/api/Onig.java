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

import com.axonops.libonig.config.OnigConfig;
import com.axonops.libonig.encoding.CodeUnit;
import com.axonops.libonig.encoding.EngineBuffer;
import com.axonops.libonig.encoding.Subject;
import com.axonops.libonig.encoding.UnitBuilder;
import com.axonops.libonig.engine.EngineLoader;
import com.axonops.libonig.engine.EngineRegion;
import com.axonops.libonig.engine.OnigEngine;
import com.axonops.libonig.metrics.MetricNames;
import com.axonops.libonig.metrics.OnigMetricsRegistry;
import com.axonops.libonig.util.ResourceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Main entry point: search, match, replace and iterate over {@link Subject}s.
 *
 * <pre>{@code
 * try (Onig.Scope scope = Onig.init();
 *      Pattern p = Pattern.compile("(\\w+):(\\w+)")) {
 *     MatchResult m = new MatchResult();
 *     if (Onig.search(Subject.of("key:value"), m, p)) {
 *         m.format("$2=$1");   // "value=key"
 *     }
 * }
 * }</pre>
 *
 * Thread-safe: all methods can be called concurrently; the results and iterators they fill or
 * return belong to the caller.
 *
 * @since 1.0.0
 */
public final class Onig {
    private static final Logger logger = LoggerFactory.getLogger(Onig.class);

    private static final ResourceTracker resourceTracker = new ResourceTracker();

    private static volatile OnigConfig config = OnigConfig.DEFAULT;

    private Onig() {
        // Utility class
    }

    // ========== Configuration ==========

    /**
     * Configuration used by {@code Pattern.compile} overloads without an explicit config.
     */
    public static OnigConfig config() {
        return config;
    }

    /**
     * Installs the process-wide default configuration and registers resource gauges on its
     * metrics registry. Patterns already compiled keep their configuration.
     */
    public static void configure(OnigConfig newConfig) {
        Objects.requireNonNull(newConfig, "config cannot be null");
        OnigConfig previous = config;
        config = newConfig;
        if (previous.metricsRegistry() != newConfig.metricsRegistry()) {
            previous.metricsRegistry().removeGauge(MetricNames.RESOURCES_PATTERNS_ACTIVE);
        }
        resourceTracker.registerGauges(newConfig.metricsRegistry());
        logger.debug("Onig: Configuration installed - engine: {}", newConfig.engine().version());
    }

    /**
     * Active and freed pattern accounting.
     */
    public static ResourceTracker resourceTracker() {
        return resourceTracker;
    }

    // ========== Engine scope ==========

    /**
     * Initializes the configured engine for all code units until the returned scope is closed.
     */
    public static Scope init() {
        return init(EnumSet.allOf(CodeUnit.class));
    }

    /**
     * Initializes the configured engine for the given code units until the returned scope is
     * closed. Scopes nest; the engine is torn down when the outermost scope that brought it up
     * closes.
     *
     * @throws EngineInitializationException if the engine cannot be initialized
     */
    public static Scope init(Set<CodeUnit> codeUnits) {
        Objects.requireNonNull(codeUnits, "codeUnits cannot be null");
        OnigEngine engine = config.engine();
        EngineLoader.acquire(engine, codeUnits);
        return new Scope(engine);
    }

    /**
     * Open engine initialization scope.
     */
    public static final class Scope implements AutoCloseable {
        private final OnigEngine engine;
        private boolean closed;

        private Scope(OnigEngine engine) {
            this.engine = engine;
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                EngineLoader.release(engine);
            }
        }
    }

    // ========== Search / match ==========

    public static boolean search(Subject subject, MatchResult result, Pattern pattern) {
        return search(subject, 0, result, pattern, MatchFlag.NONE);
    }

    public static boolean search(Subject subject, MatchResult result, Pattern pattern, Set<MatchFlag> flags) {
        return search(subject, 0, result, pattern, flags);
    }

    /**
     * Finds the first match starting at or after {@code from}.
     *
     * <p>The engine sees the whole subject, so look-behind and word boundaries observe the text
     * before {@code from}. The result's range is the whole subject.
     *
     * @return true if a match was found; {@code result} is ready either way
     * @throws IllegalArgumentException if subject and pattern code units differ
     * @throws MatchEngineException if the engine fails
     */
    public static boolean search(Subject subject, int from, MatchResult result, Pattern pattern,
                                 Set<MatchFlag> flags) {
        Objects.requireNonNull(subject, "subject cannot be null");
        Objects.requireNonNull(result, "result cannot be null");
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Objects.requireNonNull(flags, "flags cannot be null");
        Objects.checkFromToIndex(from, subject.length(), subject.length());

        Pattern.CompiledState state = pattern.state();
        checkCodeUnits(subject, pattern);
        OnigEngine engine = pattern.config().engine();
        OnigMetricsRegistry metrics = pattern.config().metricsRegistry();
        CodeUnit unit = subject.codeUnit();
        EngineBuffer buffer = engineBuffer(subject, metrics);
        EngineRegion region = new EngineRegion();

        long startNanos = metrics.isEnabled() ? System.nanoTime() : 0L;
        int status = engine.search(state.handle(), buffer, unit.toBytes(from), buffer.length(),
            MatchFlag.engineOptions(flags), region);
        if (metrics.isEnabled()) {
            metrics.recordTimer(MetricNames.MATCHING_SEARCH_LATENCY, System.nanoTime() - startNanos);
            metrics.incrementCounter(MetricNames.MATCHING_SEARCH_OPERATIONS);
        }

        return complete(status, engine, metrics, subject, result, pattern, state, flags, region);
    }

    public static boolean match(Subject subject, MatchResult result, Pattern pattern) {
        return match(subject, result, pattern, MatchFlag.NONE);
    }

    /**
     * Whether the whole subject matches. On success {@code result} holds the groups.
     *
     * @throws IllegalArgumentException if subject and pattern code units differ
     * @throws MatchEngineException if the engine fails
     */
    public static boolean match(Subject subject, MatchResult result, Pattern pattern, Set<MatchFlag> flags) {
        Objects.requireNonNull(subject, "subject cannot be null");
        Objects.requireNonNull(result, "result cannot be null");
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Objects.requireNonNull(flags, "flags cannot be null");

        Pattern.CompiledState state = pattern.state();
        checkCodeUnits(subject, pattern);
        OnigEngine engine = pattern.config().engine();
        OnigMetricsRegistry metrics = pattern.config().metricsRegistry();
        EngineBuffer buffer = engineBuffer(subject, metrics);
        EngineRegion region = new EngineRegion();

        long startNanos = metrics.isEnabled() ? System.nanoTime() : 0L;
        int status = engine.match(state.handle(), buffer, 0, MatchFlag.engineOptions(flags), region);
        if (metrics.isEnabled()) {
            metrics.recordTimer(MetricNames.MATCHING_FULL_MATCH_LATENCY, System.nanoTime() - startNanos);
            metrics.incrementCounter(MetricNames.MATCHING_FULL_MATCH_OPERATIONS);
        }

        if (status >= 0 && region.end(0) != buffer.length()) {
            status = OnigEngine.MISMATCH;
        }
        return complete(status, engine, metrics, subject, result, pattern, state, flags, region);
    }

    private static boolean complete(int status, OnigEngine engine, OnigMetricsRegistry metrics, Subject subject,
                                    MatchResult result, Pattern pattern, Pattern.CompiledState state,
                                    Set<MatchFlag> flags, EngineRegion region) {
        int length = subject.length();
        if (status == OnigEngine.MISMATCH) {
            result.setNotFound(subject, 0, length, pattern);
            return false;
        }
        if (status < 0) {
            metrics.incrementCounter(MetricNames.ERRORS_ENGINE);
            String message = engine.errorMessage(status);
            logger.debug("Onig: Engine error {} - {}", status, message);
            throw new MatchEngineException(status, message);
        }
        if (flags.contains(MatchFlag.NOT_NULL) && region.begin(0) == region.end(0)) {
            result.setNotFound(subject, 0, length, pattern);
            return false;
        }
        int groups = state.options().contains(SyntaxOption.NOSUBS) ? 1 : region.size();
        result.setMatch(subject, 0, length, pattern, region, groups);
        return true;
    }

    private static void checkCodeUnits(Subject subject, Pattern pattern) {
        if (subject.codeUnit() != pattern.codeUnit()) {
            throw new IllegalArgumentException("Onig: Subject code unit " + subject.codeUnit()
                + " does not match pattern code unit " + pattern.codeUnit());
        }
    }

    private static EngineBuffer engineBuffer(Subject subject, OnigMetricsRegistry metrics) {
        boolean cached = subject.hasEngineBuffer();
        EngineBuffer buffer = subject.engineBuffer();
        if (!cached && buffer.copied()) {
            metrics.incrementCounter(MetricNames.ENGINE_BUFFER_COPIES);
            logger.debug("Onig: Subject copied into engine buffer - units: {}, bytes: {}",
                subject.length(), buffer.length());
        }
        return buffer;
    }

    // ========== Replace ==========

    public static String replace(Subject subject, Pattern pattern, String template) {
        return replace(subject, pattern, template, MatchFlag.NONE);
    }

    /**
     * Replaces matches of {@code pattern} in {@code subject}.
     *
     * <p>{@link MatchFlag#FORMAT_FIRST_ONLY} stops after the first match,
     * {@link MatchFlag#FORMAT_NO_COPY} drops the text outside matches and
     * {@link MatchFlag#FORMAT_LITERAL} inserts the template unexpanded.
     */
    public static String replace(Subject subject, Pattern pattern, String template, Set<MatchFlag> flags) {
        return replaceUnits(subject, pattern, template, flags).toString();
    }

    /**
     * Same as {@link #replace(Subject, Pattern, String, Set)} but returns the output as code units
     * of the subject's width, so UTF-8 output can be written back byte for byte.
     */
    public static UnitBuilder replaceUnits(Subject subject, Pattern pattern, String template, Set<MatchFlag> flags) {
        Objects.requireNonNull(subject, "subject cannot be null");
        Objects.requireNonNull(template, "template cannot be null");
        OnigMetricsRegistry metrics = pattern.config().metricsRegistry();
        boolean copy = !flags.contains(MatchFlag.FORMAT_NO_COPY);
        boolean literal = flags.contains(MatchFlag.FORMAT_LITERAL);
        boolean firstOnly = flags.contains(MatchFlag.FORMAT_FIRST_ONLY);

        long startNanos = metrics.isEnabled() ? System.nanoTime() : 0L;
        UnitBuilder out = new UnitBuilder(subject.codeUnit(), subject.length() + 16);
        int last = 0;
        RegexIterator matches = new RegexIterator(subject, pattern, flags);
        while (!matches.isExhausted()) {
            MatchResult current = matches.current();
            SubMatch whole = current.get(0);
            if (copy) {
                out.appendUnits(subject, last, whole.begin());
            }
            if (literal) {
                out.append(template);
            } else {
                ReplacementTemplate.expand(template, current, out);
            }
            last = whole.end();
            if (firstOnly) {
                break;
            }
            matches.advance();
        }
        if (copy) {
            out.appendUnits(subject, last, subject.length());
        }
        if (metrics.isEnabled()) {
            metrics.recordTimer(MetricNames.REPLACE_LATENCY, System.nanoTime() - startNanos);
            metrics.incrementCounter(MetricNames.REPLACE_OPERATIONS);
        }
        return out;
    }

    // ========== Iteration ==========

    public static RegexIterator iterate(Subject subject, Pattern pattern) {
        return new RegexIterator(subject, pattern, MatchFlag.NONE);
    }

    public static RegexIterator iterate(Subject subject, Pattern pattern, Set<MatchFlag> flags) {
        return new RegexIterator(subject, pattern, flags);
    }

    /**
     * Token iterator over the selected groups of each match; {@link TokenIterator#GAP} selects the
     * text between matches.
     */
    public static TokenIterator tokenize(Subject subject, Pattern pattern, int... selectors) {
        return new TokenIterator(new RegexIterator(subject, pattern, MatchFlag.NONE), selectors);
    }

    public static TokenIterator tokenize(Subject subject, Pattern pattern, Set<MatchFlag> flags, int... selectors) {
        return new TokenIterator(new RegexIterator(subject, pattern, flags), selectors);
    }

    // ========== Utilities ==========

    /**
     * Quotes {@code text} so that it matches itself in the native grammar, including under
     * {@link SyntaxOption#FREE_SPACING}.
     */
    public static String escape(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        StringBuilder out = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\', '^', '$', '.', '|', '?', '*', '+', '(', ')', '[', ']', '{', '}', '-', '#', ' ' ->
                    out.append('\\').append(c);
                case '\n' -> out.append("\\n");
                case '\t' -> out.append("\\t");
                case '\r' -> out.append("\\r");
                case '\f' -> out.append("\\f");
                case '\u000B' -> out.append("\\x{b}");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
