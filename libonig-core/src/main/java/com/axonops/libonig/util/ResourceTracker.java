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

package com.axonops.libonig.util;

import com.axonops.libonig.metrics.MetricNames;
import com.axonops.libonig.metrics.OnigMetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Tracks compiled pattern handles for monitoring.
 *
 * <p>Tracks ACTIVE (simultaneous) patterns as well as lifetime totals. A recompilation through
 * {@code assign} frees one handle and allocates another, so it leaves the active count unchanged.
 *
 * @since 1.0.0
 */
public final class ResourceTracker {
    private final Logger logger = LoggerFactory.getLogger(ResourceTracker.class);

    private final AtomicInteger activePatternsCount = new AtomicInteger(0);

    private final LongAdder totalPatternsCompiled = new LongAdder();
    private final LongAdder totalPatternsClosed = new LongAdder();

    /**
     * Tracks a new pattern handle.
     */
    public void trackPatternAllocated() {
        int current = activePatternsCount.incrementAndGet();
        totalPatternsCompiled.increment();
        logger.trace("Onig: Pattern allocated - active: {}, cumulative: {}", current, totalPatternsCompiled.sum());
    }

    /**
     * Tracks a pattern handle being freed.
     *
     * @param metricsRegistry optional metrics registry to record freed count
     */
    public void trackPatternFreed(OnigMetricsRegistry metricsRegistry) {
        int current = activePatternsCount.decrementAndGet();
        totalPatternsClosed.increment();

        if (metricsRegistry != null) {
            metricsRegistry.incrementCounter(MetricNames.RESOURCES_PATTERNS_FREED);
        }

        if (current < 0) {
            logger.error("Onig: Pattern count went negative ({}). This is a bug.", current);
            activePatternsCount.set(0);
        }

        logger.trace("Onig: Pattern freed - active: {}, cumulative closed: {}", current, totalPatternsClosed.sum());
    }

    /**
     * Registers the active-patterns gauge on the given registry.
     */
    public void registerGauges(OnigMetricsRegistry metricsRegistry) {
        metricsRegistry.registerGauge(MetricNames.RESOURCES_PATTERNS_ACTIVE, activePatternsCount::get);
    }

    public int getActivePatternCount() {
        return activePatternsCount.get();
    }

    public long getTotalPatternsCompiled() {
        return totalPatternsCompiled.sum();
    }

    public long getTotalPatternsClosed() {
        return totalPatternsClosed.sum();
    }

    /**
     * Resets all counters (for testing only).
     */
    public void reset() {
        activePatternsCount.set(0);
        totalPatternsCompiled.reset();
        totalPatternsClosed.reset();
        logger.trace("Onig: ResourceTracker reset");
    }

    /**
     * Gets statistics snapshot.
     */
    public ResourceStatistics getStatistics() {
        return new ResourceStatistics(
            activePatternsCount.get(),
            totalPatternsCompiled.sum(),
            totalPatternsClosed.sum()
        );
    }

    public record ResourceStatistics(
        int activePatterns,
        long totalCompiled,
        long totalClosed
    ) {
        public boolean hasPotentialLeaks() {
            return totalCompiled > (totalClosed + activePatterns);
        }
    }
}
