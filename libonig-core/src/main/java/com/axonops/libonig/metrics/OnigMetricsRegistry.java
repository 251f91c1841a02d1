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

import java.util.function.Supplier;

/**
 * Abstract metrics registry interface for libonig-java.
 *
 * <p>Allows the library to work with or without the Dropwizard Metrics dependency.
 *
 * <p><strong>Metric Types:</strong>
 * <ul>
 *   <li><strong>Counter:</strong> monotonically increasing count</li>
 *   <li><strong>Timer:</strong> duration in nanoseconds with histogram</li>
 *   <li><strong>Gauge:</strong> instantaneous value computed on demand</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> All implementations must be thread-safe.
 *
 * @since 1.0.0
 */
public interface OnigMetricsRegistry {

    /**
     * Whether recorded values go anywhere. Drivers only time operations when this is true.
     */
    default boolean isEnabled() {
        return true;
    }

    /**
     * Increment a counter by 1.
     *
     * @param name metric name (e.g., "patterns.compiled.total.count")
     */
    void incrementCounter(String name);

    /**
     * Increment a counter by a specific delta.
     *
     * @param name metric name
     * @param delta amount to increment (must be non-negative)
     */
    void incrementCounter(String name, long delta);

    /**
     * Record a timer measurement in nanoseconds.
     *
     * @param name metric name (e.g., "patterns.compilation.latency")
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Register a gauge that computes its value on demand. Replaces an existing gauge of the
     * same name. The supplier must be fast and must not block.
     *
     * @param name metric name (e.g., "resources.patterns.active.current.count")
     * @param valueSupplier function that returns the current value
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /**
     * Remove a previously registered gauge. No-op when absent.
     *
     * @param name metric name to remove
     */
    void removeGauge(String name);
}
