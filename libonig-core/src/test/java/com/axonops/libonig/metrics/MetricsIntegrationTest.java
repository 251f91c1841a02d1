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

package com.axonops.libonig.metrics;

import com.axonops.libonig.api.MatchResult;
import com.axonops.libonig.api.Onig;
import com.axonops.libonig.api.Pattern;
import com.axonops.libonig.api.RegexIterator;
import com.axonops.libonig.api.SyntaxOption;
import com.axonops.libonig.config.OnigConfig;
import com.axonops.libonig.encoding.CodeUnit;
import com.axonops.libonig.encoding.Subject;
import com.axonops.libonig.test.TestUtils;
import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests verifying metrics are actually collected during operations.
 *
 * <p>Installs a Dropwizard-backed config through {@link Onig#configure}, performs real
 * operations and checks the registry.
 */
@DisplayName("Metrics Integration")
class MetricsIntegrationTest {

    private static final String PREFIX = "test.onig";

    private MetricRegistry registry;
    private OnigConfig originalConfig;

    @BeforeEach
    void setup() {
        registry = new MetricRegistry();
        originalConfig = TestUtils.replaceConfigWithMetrics(registry, PREFIX);
    }

    @AfterEach
    void cleanup() {
        TestUtils.restoreConfig(originalConfig);
    }

    private Counter counter(String name) {
        return registry.counter(PREFIX + "." + name);
    }

    private Timer timer(String name) {
        return registry.timer(PREFIX + "." + name);
    }

    @Test
    @DisplayName("Compilation is counted and timed")
    void compilationMetrics() {
        try (Pattern a = Pattern.compile("test.*");
             Pattern b = Pattern.compile("other.*")) {
            assertThat(counter(MetricNames.PATTERNS_COMPILED).getCount()).isEqualTo(2);
            assertThat(timer(MetricNames.PATTERNS_COMPILATION_LATENCY).getCount()).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("Recompilation through assign and imbue is counted")
    void recompilationMetrics() {
        try (Pattern p = Pattern.compile("[[:alpha:]]", CodeUnit.UTF16, EnumSet.of(SyntaxOption.COLLATE),
            Locale.ROOT)) {
            p.assign("[[:digit:]]");
            p.imbue(Locale.FRANCE);
            assertThat(counter(MetricNames.PATTERNS_RECOMPILED).getCount()).isEqualTo(2);
            assertThat(counter(MetricNames.PATTERNS_COMPILED).getCount()).isEqualTo(3);
        }
    }

    @Test
    @DisplayName("Search and full match are counted and timed separately")
    void matchingMetrics() {
        try (Pattern p = Pattern.compile("\\d+")) {
            MatchResult m = new MatchResult();
            Onig.search(Subject.of("a1"), m, p);
            Onig.search(Subject.of("b"), m, p);
            Onig.match(Subject.of("12"), m, p);

            assertThat(counter(MetricNames.MATCHING_SEARCH_OPERATIONS).getCount()).isEqualTo(2);
            assertThat(timer(MetricNames.MATCHING_SEARCH_LATENCY).getCount()).isEqualTo(2);
            assertThat(counter(MetricNames.MATCHING_FULL_MATCH_OPERATIONS).getCount()).isEqualTo(1);
            assertThat(timer(MetricNames.MATCHING_FULL_MATCH_LATENCY).getCount()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Iterator advances and replace operations are counted")
    void iterationAndReplaceMetrics() {
        try (Pattern p = Pattern.compile("\\d")) {
            RegexIterator it = Onig.iterate(Subject.of("1 2 3"), p);
            while (!it.isExhausted()) {
                it.advance();
            }
            assertThat(counter(MetricNames.MATCHING_ITERATOR_ADVANCES).getCount()).isEqualTo(3);

            assertThat(p.replaceAll("1 2", "#")).isEqualTo("# #");
            assertThat(counter(MetricNames.REPLACE_OPERATIONS).getCount()).isEqualTo(1);
            assertThat(timer(MetricNames.REPLACE_LATENCY).getCount()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Engine buffer copies are counted once per subject")
    void bufferCopyMetrics() {
        try (Pattern utf16 = Pattern.compile("b");
             Pattern utf8 = Pattern.compile("b", CodeUnit.UTF8, EnumSet.noneOf(SyntaxOption.class))) {
            MatchResult m = new MatchResult();
            Subject copied = Subject.of("abc");
            Onig.search(copied, m, utf16);
            Onig.search(copied, m, utf16);
            Onig.search(Subject.of(List.of((int) 'b'), CodeUnit.UTF16), m, utf16);
            Onig.search(Subject.utf8(new byte[] {'a', 'b'}), m, utf8);

            assertThat(counter(MetricNames.ENGINE_BUFFER_COPIES).getCount()).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("Active patterns gauge follows compile and close")
    @SuppressWarnings("unchecked")
    void activePatternsGauge() {
        Gauge<Number> active = (Gauge<Number>) registry.getGauges()
            .get(PREFIX + "." + MetricNames.RESOURCES_PATTERNS_ACTIVE);
        assertThat(active).isNotNull();

        int before = active.getValue().intValue();
        Pattern p = Pattern.compile("gauge");
        assertThat(active.getValue().intValue()).isEqualTo(before + 1);
        p.close();
        assertThat(active.getValue().intValue()).isEqualTo(before);
        assertThat(counter(MetricNames.RESOURCES_PATTERNS_FREED).getCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Switching registries moves the gauge")
    void configure_movesGauge() {
        MetricRegistry other = new MetricRegistry();
        TestUtils.replaceConfigWithMetrics(other, PREFIX);

        assertThat(registry.getGauges()).doesNotContainKey(PREFIX + "." + MetricNames.RESOURCES_PATTERNS_ACTIVE);
        assertThat(other.getGauges()).containsKey(PREFIX + "." + MetricNames.RESOURCES_PATTERNS_ACTIVE);
    }

    @Test
    @DisplayName("All metric names share the documented suffixes")
    void metricNames_suffixes() {
        assertThat(List.of(
            MetricNames.PATTERNS_COMPILED, MetricNames.PATTERNS_RECOMPILED, MetricNames.MATCHING_SEARCH_OPERATIONS,
            MetricNames.MATCHING_FULL_MATCH_OPERATIONS, MetricNames.MATCHING_ITERATOR_ADVANCES,
            MetricNames.REPLACE_OPERATIONS, MetricNames.ENGINE_BUFFER_COPIES, MetricNames.RESOURCES_PATTERNS_FREED,
            MetricNames.ERRORS_COMPILATION_FAILED, MetricNames.ERRORS_ENGINE))
            .allSatisfy(name -> assertThat(name).endsWith(".total.count"));
        assertThat(MetricNames.RESOURCES_PATTERNS_ACTIVE).endsWith(".current.count");
        assertThat(MetricNames.MATCHING_SEARCH_LATENCY).endsWith(".latency");
    }
}
