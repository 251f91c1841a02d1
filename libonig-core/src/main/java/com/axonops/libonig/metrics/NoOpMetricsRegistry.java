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
 * Registry that discards everything; the one in {@link com.axonops.libonig.config.OnigConfig#DEFAULT}.
 *
 * <p>Reports {@link #isEnabled()} false so drivers skip reading the clock for timers.
 *
 * @since 1.0.0
 */
public enum NoOpMetricsRegistry implements OnigMetricsRegistry {
  INSTANCE;

  @Override
  public boolean isEnabled() {
    return false;
  }

  @Override
  public void incrementCounter(String name) {
  }

  @Override
  public void incrementCounter(String name, long delta) {
  }

  @Override
  public void recordTimer(String name, long durationNanos) {
  }

  @Override
  public void registerGauge(String name, Supplier<Number> valueSupplier) {
  }

  @Override
  public void removeGauge(String name) {
  }
}
