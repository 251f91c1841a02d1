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

package com.axonops.libonig.dropwizard;

import com.axonops.libonig.config.OnigConfig;
import com.axonops.libonig.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for {@link OnigConfig} with Dropwizard Metrics integration.
 *
 * <p>Works with any application that already owns a {@link MetricRegistry}:
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * Onig.configure(OnigMetricsConfig.withMetrics(registry, "com.mycompany.myapp.regex"));
 * }</pre>
 *
 * <p><strong>JMX Exposure:</strong> unless disabled, a {@link JmxReporter} is started for the
 * registry (once per process) so every metric is visible in the platform MBean server under the
 * {@code metrics} domain.
 *
 * @since 1.0.0
 */
public final class OnigMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(OnigMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private OnigMetricsConfig() {
        // Utility class
    }

    /**
     * Creates a config with Dropwizard metrics under the default prefix
     * ({@value DropwizardMetricsAdapter#DEFAULT_PREFIX}) and JMX enabled.
     */
    public static OnigConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Creates a config with Dropwizard metrics and JMX enabled.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     */
    public static OnigConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates a config with Dropwizard metrics.
     *
     * <p>The engine and default locale are those of {@link OnigConfig#DEFAULT}. Pass the result to
     * {@code Onig.configure} to make it the process-wide default and register the resource gauges.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to start a JmxReporter for the registry
     * @return configuration recording into {@code registry}
     */
    public static OnigConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return OnigConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .build();
    }

    /**
     * Whether a JmxReporter started by this class is running.
     */
    public static boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("Onig: Registering JmxReporter for metrics");
                JmxReporter reporter = JmxReporter.forRegistry(registry).build();
                reporter.start();
                jmxReporter = reporter;
                logger.info("Onig: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // not fatal, the registry may already be exposed
                logger.warn("Onig: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    /**
     * Stops the JmxReporter started by this class, if any.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("Onig: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
