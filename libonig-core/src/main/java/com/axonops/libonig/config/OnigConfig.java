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

package com.axonops.libonig.config;

import com.axonops.libonig.engine.JoniEngine;
import com.axonops.libonig.engine.OnigEngine;
import com.axonops.libonig.metrics.NoOpMetricsRegistry;
import com.axonops.libonig.metrics.OnigMetricsRegistry;
import java.util.Locale;
import java.util.Objects;

/**
 * Configuration for pattern compilation and matching.
 *
 * <p>Immutable. Pass to {@code Pattern.compile(..., config)} or install process-wide with
 * {@code Onig.configure(config)}.
 *
 * @param engine regex engine that compiles and runs patterns
 * @param defaultLocale locale used when a pattern is compiled without one; drives {@code [:class:]}
 *     expansion under COLLATE
 * @param metricsRegistry metrics sink (default: no-op)
 * @since 1.0.0
 */
public record OnigConfig(
    OnigEngine engine,
    Locale defaultLocale,
    OnigMetricsRegistry metricsRegistry) {

  /** Joni engine, root locale, metrics disabled. */
  public static final OnigConfig DEFAULT =
      new OnigConfig(
          JoniEngine.INSTANCE, // Production engine
          Locale.ROOT, // ASCII classification
          NoOpMetricsRegistry.INSTANCE // Metrics disabled (zero overhead)
          );

  public OnigConfig {
    Objects.requireNonNull(engine, "engine cannot be null");
    Objects.requireNonNull(defaultLocale, "defaultLocale cannot be null");
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
  }

  /**
   * Copy of this configuration with a different metrics registry.
   */
  public OnigConfig withMetricsRegistry(OnigMetricsRegistry registry) {
    return new OnigConfig(engine, defaultLocale, registry);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder starting from {@link #DEFAULT}.
   */
  public static class Builder {
    private OnigEngine engine = JoniEngine.INSTANCE;
    private Locale defaultLocale = Locale.ROOT;
    private OnigMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    public Builder engine(OnigEngine engine) {
      this.engine = engine;
      return this;
    }

    public Builder defaultLocale(Locale locale) {
      this.defaultLocale = locale;
      return this;
    }

    /**
     * Sets the metrics registry.
     *
     * <p>Use {@code DropwizardMetricsAdapter} for Dropwizard Metrics integration.
     */
    public Builder metricsRegistry(OnigMetricsRegistry metricsRegistry) {
      this.metricsRegistry = metricsRegistry;
      return this;
    }

    public OnigConfig build() {
      return new OnigConfig(engine, defaultLocale, metricsRegistry);
    }
  }
}
