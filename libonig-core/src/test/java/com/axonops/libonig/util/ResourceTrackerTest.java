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

import com.axonops.libonig.metrics.NoOpMetricsRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Resource Tracking")
class ResourceTrackerTest {

    private ResourceTracker tracker;

    @BeforeEach
    void setup() {
        tracker = new ResourceTracker();
    }

    @Test
    @DisplayName("Allocations and frees update active and lifetime counts")
    void allocateAndFree() {
        tracker.trackPatternAllocated();
        tracker.trackPatternAllocated();
        tracker.trackPatternFreed(NoOpMetricsRegistry.INSTANCE);

        assertThat(tracker.getActivePatternCount()).isEqualTo(1);
        assertThat(tracker.getTotalPatternsCompiled()).isEqualTo(2);
        assertThat(tracker.getTotalPatternsClosed()).isEqualTo(1);

        ResourceTracker.ResourceStatistics stats = tracker.getStatistics();
        assertThat(stats.activePatterns()).isEqualTo(1);
        assertThat(stats.hasPotentialLeaks()).isFalse();
    }

    @Test
    @DisplayName("Active count never goes negative")
    void negativeCount_clamped() {
        tracker.trackPatternFreed(null);
        assertThat(tracker.getActivePatternCount()).isZero();
        assertThat(tracker.getTotalPatternsClosed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Reset clears everything")
    void reset() {
        tracker.trackPatternAllocated();
        tracker.reset();
        assertThat(tracker.getStatistics()).isEqualTo(new ResourceTracker.ResourceStatistics(0, 0, 0));
    }

    @Test
    @DisplayName("Leak detection compares lifetime totals")
    void leakDetection() {
        assertThat(new ResourceTracker.ResourceStatistics(1, 5, 3).hasPotentialLeaks()).isTrue();
        assertThat(new ResourceTracker.ResourceStatistics(2, 5, 3).hasPotentialLeaks()).isFalse();
    }

    // ========== PatternHasher ==========

    @Test
    @DisplayName("Hashes are stable hex strings that hide the text")
    void patternHasher() {
        String hash = PatternHasher.hash("password=\\w+");
        assertThat(hash).matches("[0-9a-f]+").isEqualTo(PatternHasher.hash("password=\\w+"));
        assertThat(hash).doesNotContain("password");
        assertThat(PatternHasher.hash(null)).isEqualTo("null");
        assertThat(PatternHasher.hashWithUnit("abc", "UTF16")).isEqualTo(PatternHasher.hash("abc") + "[UTF16]");
    }
}
