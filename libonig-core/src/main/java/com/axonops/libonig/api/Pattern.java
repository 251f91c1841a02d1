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
import com.axonops.libonig.encoding.Subject;
import com.axonops.libonig.engine.EngineHandle;
import com.axonops.libonig.engine.EngineLoader;
import com.axonops.libonig.engine.OnigEngine;
import com.axonops.libonig.locale.CharClassifier;
import com.axonops.libonig.locale.PosixClassExpander;
import com.axonops.libonig.metrics.MetricNames;
import com.axonops.libonig.metrics.OnigMetricsRegistry;
import com.axonops.libonig.util.PatternHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A compiled regular expression over one code-unit width.
 *
 * Thread-safe for matching: once construction, {@link #assign} or {@link #imbue} has returned,
 * any number of threads may search with the same Pattern. {@code assign}/{@code imbue} must not
 * run concurrently with a search on the same instance.
 *
 * Resource Management: a Pattern owns an engine handle and should be closed when no longer
 * needed. Using a closed Pattern throws {@link IllegalStateException}.
 *
 * <pre>{@code
 * try (Pattern p = Pattern.compile("(\\w+):(\\w+)")) {
 *     p.replaceAll("key:value", "$2=$1");   // "value=key"
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Pattern implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Pattern.class);

    private final CodeUnit codeUnit;
    private final OnigConfig config;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile CompiledState state;

    /**
     * Everything derived from one compilation; replaced as a unit.
     */
    record CompiledState(
        String text,
        Set<SyntaxOption> options,
        Locale locale,
        EngineHandle handle,
        int markCount) {
    }

    private Pattern(CodeUnit codeUnit, OnigConfig config, CompiledState state) {
        this.codeUnit = codeUnit;
        this.config = config;
        this.state = state;
    }

    // ========== Compilation ==========

    /**
     * Compiles a native-grammar pattern for UTF-16 subjects.
     */
    public static Pattern compile(String text) {
        return compile(text, CodeUnit.UTF16, EnumSet.noneOf(SyntaxOption.class));
    }

    public static Pattern compile(String text, Set<SyntaxOption> options) {
        return compile(text, CodeUnit.UTF16, options);
    }

    public static Pattern compile(String text, CodeUnit codeUnit, Set<SyntaxOption> options) {
        OnigConfig config = Onig.config();
        return compile(text, codeUnit, options, config.defaultLocale(), config);
    }

    public static Pattern compile(String text, CodeUnit codeUnit, Set<SyntaxOption> options, Locale locale) {
        return compile(text, codeUnit, options, locale, Onig.config());
    }

    /**
     * Compiles a pattern.
     *
     * @param text pattern text
     * @param codeUnit width of the subjects this pattern will search
     * @param options grammar and compile options
     * @param locale locale used to expand {@code [:class:]} tokens under {@link SyntaxOption#COLLATE}
     * @param config engine and metrics
     * @return compiled pattern (close when done)
     * @throws PatternCompilationException if the engine rejects the pattern
     */
    public static Pattern compile(String text, CodeUnit codeUnit, Set<SyntaxOption> options, Locale locale,
                                  OnigConfig config) {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(codeUnit, "codeUnit cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        Objects.requireNonNull(locale, "locale cannot be null");
        Objects.requireNonNull(config, "config cannot be null");

        CompiledState state = compileState(text, options, locale, codeUnit, config);
        return new Pattern(codeUnit, config, state);
    }

    private static CompiledState compileState(String text, Set<SyntaxOption> options, Locale locale,
                                              CodeUnit codeUnit, OnigConfig config) {
        OnigEngine engine = config.engine();
        OnigMetricsRegistry metrics = config.metricsRegistry();
        EngineLoader.ensureInitialized(engine);

        Set<SyntaxOption> frozen = options.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(options));
        String hash = PatternHasher.hashWithUnit(text, codeUnit.name());
        long startNanos = System.nanoTime();

        String prepared = preprocess(text, frozen, locale, codeUnit);
        EngineHandle handle;
        try {
            handle = engine.compile(codeUnit.encode(prepared), SyntaxOption.engineOptions(frozen),
                SyntaxOption.syntaxFamily(frozen), codeUnit);
        } catch (PatternCompilationException e) {
            metrics.incrementCounter(MetricNames.ERRORS_COMPILATION_FAILED);
            logger.debug("Onig: Pattern compilation failed - hash: {}, code: {}, type: {}, error: {}",
                hash, e.getCode(), e.getErrorType(), e.getEngineMessage());
            throw new PatternCompilationException(e.getCode(), e.getErrorType(), e.getEngineMessage(), text);
        }

        int markCount = frozen.contains(SyntaxOption.NOSUBS) ? 0 : engine.captureCount(handle);

        long durationNanos = System.nanoTime() - startNanos;
        metrics.recordTimer(MetricNames.PATTERNS_COMPILATION_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.PATTERNS_COMPILED);
        Onig.resourceTracker().trackPatternAllocated();

        logger.trace("Onig: Pattern compiled - hash: {}, grammar: {}, groups: {}, timeNs: {}",
            hash, SyntaxOption.grammar(frozen), markCount, durationNanos);
        return new CompiledState(text, frozen, locale, handle, markCount);
    }

    /**
     * Grammar rewrites applied before the text reaches the engine.
     */
    static String preprocess(String text, Set<SyntaxOption> options, Locale locale, CodeUnit codeUnit) {
        String prepared = text;
        if (SyntaxOption.grammar(options) == SyntaxOption.ECMASCRIPT) {
            prepared = EcmaScriptRewriter.rewrite(prepared, options.contains(SyntaxOption.MULTILINE));
        }
        if (SyntaxOption.needsLocaleExpansion(options)) {
            prepared = new PosixClassExpander(CharClassifier.forLocale(locale), codeUnit.classScanLimit())
                .expand(prepared);
        }
        return prepared;
    }

    // ========== Lifecycle ==========

    /**
     * Recompiles with new text, keeping the current options.
     *
     * @throws PatternCompilationException if the new text does not compile; the old state is kept
     */
    public Pattern assign(String text) {
        return assign(text, options());
    }

    /**
     * Recompiles with new text and options.
     *
     * @throws PatternCompilationException if the new text does not compile; the old state is kept
     */
    public Pattern assign(String text, Set<SyntaxOption> options) {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        CompiledState current = state();
        replaceState(compileState(text, options, current.locale(), codeUnit, config));
        return this;
    }

    /**
     * Sets the locale used for {@code [:class:]} expansion.
     *
     * <p>Recompiles when the pattern was compiled with {@link SyntaxOption#COLLATE}.
     *
     * @return the previous locale
     */
    public Locale imbue(Locale locale) {
        Objects.requireNonNull(locale, "locale cannot be null");
        CompiledState current = state();
        if (current.options().contains(SyntaxOption.COLLATE)) {
            replaceState(compileState(current.text(), current.options(), locale, codeUnit, config));
        } else {
            state = new CompiledState(current.text(), current.options(), locale, current.handle(), current.markCount());
        }
        return current.locale();
    }

    private void replaceState(CompiledState next) {
        CompiledState old = state;
        state = next;
        config.metricsRegistry().incrementCounter(MetricNames.PATTERNS_RECOMPILED);
        freeHandle(old);
        logger.trace("Onig: Pattern recompiled - hash: {}", PatternHasher.hash(next.text()));
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            freeHandle(state);
            logger.trace("Onig: Pattern closed - hash: {}", PatternHasher.hash(state.text()));
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void freeHandle(CompiledState compiled) {
        config.engine().free(compiled.handle());
        Onig.resourceTracker().trackPatternFreed(config.metricsRegistry());
    }

    // ========== Accessors ==========

    /**
     * Pattern text as given, before any preprocessing.
     */
    public String pattern() {
        return state().text();
    }

    public Set<SyntaxOption> options() {
        return state().options();
    }

    public Locale getLocale() {
        return state().locale();
    }

    public CodeUnit codeUnit() {
        return codeUnit;
    }

    /**
     * Number of capture groups; 0 under {@link SyntaxOption#NOSUBS}.
     */
    public int markCount() {
        return state().markCount();
    }

    /**
     * Group number of a named group.
     *
     * @return the group number, or -1 when no group has this name
     */
    public int nameToIndex(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        CompiledState current = state();
        return config.engine().nameToIndex(current.handle(), codeUnit.encode(name));
    }

    OnigConfig config() {
        return config;
    }

    CompiledState state() {
        checkNotClosed();
        return state;
    }

    // ========== Convenience ==========

    /**
     * Searches Java text and returns the result (empty when nothing matches).
     */
    public MatchResult search(CharSequence input) {
        MatchResult result = new MatchResult();
        Onig.search(subjectFor(input), result, this);
        return result;
    }

    /**
     * Whether the whole input matches.
     */
    public boolean matches(CharSequence input) {
        return Onig.match(subjectFor(input), new MatchResult(), this);
    }

    /**
     * Replaces every match in the input.
     *
     * @see ReplacementTemplate
     */
    public String replaceAll(CharSequence input, String template) {
        return Onig.replace(subjectFor(input), this, template);
    }

    /**
     * Splits the input around matches. Empty leading, inner and trailing pieces are kept.
     */
    public List<String> split(CharSequence input) {
        List<String> pieces = new ArrayList<>();
        TokenIterator tokens = Onig.tokenize(subjectFor(input), this, TokenIterator.GAP);
        while (tokens.hasNext()) {
            pieces.add(tokens.next().str());
        }
        return pieces;
    }

    /**
     * Wraps Java text in a subject of this pattern's code unit.
     */
    Subject subjectFor(CharSequence input) {
        Objects.requireNonNull(input, "input cannot be null");
        return switch (codeUnit) {
            case UTF8 -> Subject.utf8(input.toString().getBytes(StandardCharsets.UTF_8));
            case UTF16 -> Subject.of(input);
            case UTF32 -> Subject.codePoints(input);
        };
    }

    @Override
    public String toString() {
        CompiledState current = state;
        return "Pattern{hash=" + PatternHasher.hash(current.text()) + ", codeUnit=" + codeUnit
            + ", options=" + current.options() + ", closed=" + closed.get() + "}";
    }

    private void checkNotClosed() {
        if (closed.get()) {
            throw new IllegalStateException("Onig: Pattern is closed");
        }
    }
}
