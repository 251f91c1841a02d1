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

import java.util.List;

/**
 * Metric name constants for regex facade instrumentation.
 *
 * <h2>Metric Categories</h2>
 *
 * <ul>
 *   <li><b>Pattern Compilation</b> - compilations, recompilations, latency
 *   <li><b>Matching</b> - searches, full matches, iterator advances and their latencies
 *   <li><b>Replacement</b> - replace-all operations and latency
 *   <li><b>Encoding</b> - engine buffer copies for non-contiguous subjects
 *   <li><b>Resources</b> - active and freed patterns
 *   <li><b>Errors</b> - compilation failures and engine faults
 * </ul>
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - suffix {@code .total.count}
 *   <li><b>Timer</b> - suffix {@code .latency}
 *   <li><b>Gauge</b> - suffix {@code .current.count}
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * Onig.configure(OnigMetricsConfig.withMetrics(registry, "myapp.regex", true));
 *
 * Counter compilations = registry.counter(
 *     MetricRegistry.name("myapp.regex", MetricNames.PATTERNS_COMPILED));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Pattern Compilation Metrics
  // ========================================

  /**
   * Total patterns compiled, including recompilations.
   * <p><b>Type:</b> Counter
   */
  public static final String PATTERNS_COMPILED = "patterns.compiled.total.count";

  /**
   * Pattern compilation latency, including preprocessing.
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String PATTERNS_COMPILATION_LATENCY = "patterns.compilation.latency";

  /**
   * Patterns recompiled through {@code assign} or {@code imbue}.
   * <p><b>Type:</b> Counter
   */
  public static final String PATTERNS_RECOMPILED = "patterns.recompiled.total.count";

  // ========================================
  // Matching Metrics
  // ========================================

  /**
   * Search operations (single-shot and iterator steps).
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_SEARCH_OPERATIONS = "matching.search.operations.total.count";

  /**
   * Search latency.
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String MATCHING_SEARCH_LATENCY = "matching.search.latency";

  /**
   * Full-match operations.
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_FULL_MATCH_OPERATIONS = "matching.full_match.operations.total.count";

  /**
   * Full-match latency.
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String MATCHING_FULL_MATCH_LATENCY = "matching.full_match.latency";

  /**
   * Sequential iterator advances.
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_ITERATOR_ADVANCES = "matching.iterator.advances.total.count";

  // ========================================
  // Replacement Metrics
  // ========================================

  /**
   * Replace-all operations.
   * <p><b>Type:</b> Counter
   */
  public static final String REPLACE_OPERATIONS = "replace.operations.total.count";

  /**
   * Replace-all latency.
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String REPLACE_LATENCY = "replace.latency";

  // ========================================
  // Encoding Metrics
  // ========================================

  /**
   * Subjects copied into a contiguous engine buffer.
   * <p><b>Type:</b> Counter
   * <p><b>Interpretation:</b> High values mean callers pass non-contiguous containers on hot paths
   */
  public static final String ENGINE_BUFFER_COPIES = "engine.buffer.copies.total.count";

  // ========================================
  // Resource Metrics
  // ========================================

  /**
   * Patterns currently holding a compiled engine handle.
   * <p><b>Type:</b> Gauge (count)
   */
  public static final String RESOURCES_PATTERNS_ACTIVE = "resources.patterns.active.current.count";

  /**
   * Patterns closed.
   * <p><b>Type:</b> Counter
   */
  public static final String RESOURCES_PATTERNS_FREED = "resources.patterns.freed.total.count";

  // ========================================
  // Error Metrics
  // ========================================

  /**
   * Pattern compilation failures.
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_COMPILATION_FAILED = "errors.compilation.failed.total.count";

  /**
   * Engine faults other than mismatch during search or match.
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_ENGINE = "errors.engine.total.count";

  // ========================================
  // Name sets
  // ========================================

  /** Every counter the library records. */
  public static final List<String> COUNTERS = List.of(
      PATTERNS_COMPILED,
      PATTERNS_RECOMPILED,
      MATCHING_SEARCH_OPERATIONS,
      MATCHING_FULL_MATCH_OPERATIONS,
      MATCHING_ITERATOR_ADVANCES,
      REPLACE_OPERATIONS,
      ENGINE_BUFFER_COPIES,
      RESOURCES_PATTERNS_FREED,
      ERRORS_COMPILATION_FAILED,
      ERRORS_ENGINE);

  /** Every timer the library records. */
  public static final List<String> TIMERS = List.of(
      PATTERNS_COMPILATION_LATENCY,
      MATCHING_SEARCH_LATENCY,
      MATCHING_FULL_MATCH_LATENCY,
      REPLACE_LATENCY);
}
