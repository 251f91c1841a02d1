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

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Records the library's metrics into a Dropwizard {@link MetricRegistry} under a prefix.
 *
 * <p>Every counter and timer in {@link MetricNames#COUNTERS} and {@link MetricNames#TIMERS} is
 * registered when the adapter is created, so reporters show the full set at zero before the first
 * pattern is compiled. Handles are resolved once per name; recording on the match path does not
 * build metric names or consult the registry.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * OnigMetricsRegistry metrics = new DropwizardMetricsAdapter(registry, "com.myapp.regex");
 * // com.myapp.regex.patterns.compiled.total.count, com.myapp.regex.matching.search.latency, ...
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements OnigMetricsRegistry {

    /** Prefix used when none is given. */
    public static final String DEFAULT_PREFIX = "com.axonops.libonig";

    private final MetricRegistry registry;
    private final String prefix;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * @param registry registry to record into
     * @param prefix namespace prepended to every {@link MetricNames} name
     * @throws NullPointerException if registry or prefix is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
        MetricNames.COUNTERS.forEach(this::counter);
        MetricNames.TIMERS.forEach(this::timer);
    }

    @Override
    public void incrementCounter(String name) {
        counter(name).inc();
    }

    @Override
    public void incrementCounter(String name, long delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("Onig: Counter " + name + " cannot decrease (delta " + delta + ")");
        }
        counter(name).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        timer(name).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Registers a gauge, replacing any gauge already registered under the same name.
     *
     * @throws IllegalArgumentException if a counter or timer already uses the name
     */
    @Override
    public void registerGauge(String name, Supplier<Number> valueSupplier) {
        Objects.requireNonNull(valueSupplier, "valueSupplier cannot be null");
        String fullName = fullName(name);
        removeGauge(name);
        registry.register(fullName, (Gauge<Number>) valueSupplier::get);
    }

    /**
     * Removes the gauge registered under {@code name}. Counters and timers are never removed.
     */
    @Override
    public void removeGauge(String name) {
        String fullName = fullName(name);
        registry.removeMatching((metricName, metric) -> metric instanceof Gauge && metricName.equals(fullName));
    }

    /**
     * Registry name of a library metric, e.g. {@code <prefix>.patterns.compiled.total.count}.
     */
    public String fullName(String name) {
        return MetricRegistry.name(prefix, name);
    }

    public String getPrefix() {
        return prefix;
    }

    public MetricRegistry getRegistry() {
        return registry;
    }

    private Counter counter(String name) {
        return counters.computeIfAbsent(name, n -> registry.counter(fullName(n)));
    }

    private Timer timer(String name) {
        return timers.computeIfAbsent(name, n -> registry.timer(fullName(n)));
    }
}
