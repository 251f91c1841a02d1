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
import com.axonops.libonig.engine.OnigEngine;
import com.axonops.libonig.metrics.DropwizardMetricsAdapter;
import com.axonops.libonig.metrics.MetricNames;
import com.axonops.libonig.test.FakeEngine;
import com.axonops.libonig.test.TestUtils;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests that engine faults and engine lifecycle surface through the public API.
 */
@DisplayName("Engine Errors and Scopes")
class EngineErrorTest {

    private static final String PREFIX = "test.onig";

    private FakeEngine engine;
    private MetricRegistry registry;
    private OnigConfig config;

    @BeforeEach
    void setup() {
        engine = new FakeEngine();
        registry = new MetricRegistry();
        config = OnigConfig.builder()
            .engine(engine)
            .metricsRegistry(new DropwizardMetricsAdapter(registry, PREFIX))
            .build();
    }

    private Pattern compile(String regex) {
        return Pattern.compile(regex, CodeUnit.UTF16, EnumSet.noneOf(SyntaxOption.class), Locale.ROOT, config);
    }

    // ========== Match failures ==========

    @Test
    @DisplayName("Search failure becomes MatchEngineException")
    void search_engineFailure_throws() {
        try (Pattern p = compile("a")) {
            engine.failWith(OnigEngine.ERR_INTERNAL);

            assertThatThrownBy(() -> Onig.search(Subject.of("a"), new MatchResult(), p))
                .isInstanceOf(MatchEngineException.class)
                .isInstanceOf(OnigException.class)
                .hasMessage("Onig: Match failed: internal engine error (code -11)")
                .satisfies(e -> assertThat(((MatchEngineException) e).getCode()).isEqualTo(OnigEngine.ERR_INTERNAL));
            assertThat(registry.counter(PREFIX + "." + MetricNames.ERRORS_ENGINE).getCount()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Interrupted match surfaces from full match")
    void match_interrupted_throws() {
        try (Pattern p = compile("a")) {
            engine.failWith(OnigEngine.ERR_INTERRUPTED);
            assertThatThrownBy(() -> Onig.match(Subject.of("a"), new MatchResult(), p))
                .isInstanceOf(MatchEngineException.class)
                .hasMessageContaining("match interrupted");
        }
    }

    @Test
    @DisplayName("Failures during iteration and replace propagate")
    void iterationAndReplace_propagate() {
        try (Pattern p = compile(",")) {
            RegexIterator it = Onig.iterate(Subject.of("a,b,c"), p);
            engine.failWith(OnigEngine.ERR_INTERNAL);

            assertThatThrownBy(it::advance).isInstanceOf(MatchEngineException.class);
            assertThatThrownBy(() -> Onig.replace(Subject.of("a,b"), p, "-"))
                .isInstanceOf(MatchEngineException.class);
            assertThatThrownBy(() -> p.split("a,b")).isInstanceOf(MatchEngineException.class);
        }
    }

    @Test
    @DisplayName("Compile failures are counted")
    void compileFailure_counted() {
        assertThatThrownBy(() -> compile("[unclosed")).isInstanceOf(PatternCompilationException.class);
        assertThat(registry.counter(PREFIX + "." + MetricNames.ERRORS_COMPILATION_FAILED).getCount()).isEqualTo(1);
    }

    // ========== Engine scopes ==========

    @Test
    @DisplayName("Compiling initializes the engine lazily")
    void compile_initializesLazily() {
        assertThat(engine.isInitialized()).isFalse();
        try (Pattern p = compile("a")) {
            assertThat(engine.isInitialized()).isTrue();
        }
        assertThat(engine.isInitialized()).isTrue();
    }

    @Test
    @DisplayName("init() scopes bring the configured engine up and down")
    void init_scopes() {
        OnigConfig original = TestUtils.replaceConfig(config);
        try {
            try (Onig.Scope outer = Onig.init()) {
                try (Onig.Scope inner = Onig.init(EnumSet.of(CodeUnit.UTF8))) {
                    assertThat(engine.initializeCalls()).isEqualTo(1);
                }
                assertThat(engine.isInitialized()).isTrue();
            }
            assertThat(engine.isInitialized()).isFalse();
            assertThat(engine.teardownCalls()).isEqualTo(1);
        } finally {
            TestUtils.restoreConfig(original);
        }
    }

    @Test
    @DisplayName("Closing a scope twice releases once")
    void scope_closeIdempotent() {
        OnigConfig original = TestUtils.replaceConfig(config);
        try {
            Onig.Scope outer = Onig.init();
            Onig.Scope inner = Onig.init();
            inner.close();
            inner.close();
            assertThat(engine.isInitialized()).isTrue();
            outer.close();
            assertThat(engine.isInitialized()).isFalse();
        } finally {
            TestUtils.restoreConfig(original);
        }
    }

    @Test
    @DisplayName("Initialization failure surfaces from init()")
    void init_failure() {
        OnigConfig original = TestUtils.replaceConfig(config);
        engine.failInitialize();
        try {
            assertThatThrownBy(Onig::init)
                .isInstanceOf(EngineInitializationException.class)
                .hasMessageStartingWith("Onig: Engine initialization error: ");
        } finally {
            TestUtils.restoreConfig(original);
        }
    }
}
