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

package com.axonops.libonig.engine;

import java.util.Arrays;

/**
 * Per-group byte offsets of one match, filled in by the engine.
 *
 * <p>Group 0 is the whole match. A group that did not take part in the match has
 * {@link #NOT_PARTICIPATED} as both begin and end.
 *
 * @since 1.0.0
 */
public final class EngineRegion {

    public static final int NOT_PARTICIPATED = -1;

    private static final int[] EMPTY = new int[0];

    private int groupCount;
    private int[] begins = EMPTY;
    private int[] ends = EMPTY;

    /**
     * Replaces the region contents. Only the first {@code groupCount} entries are read.
     */
    public void set(int groupCount, int[] begins, int[] ends) {
        if (groupCount < 0 || groupCount > begins.length || groupCount > ends.length) {
            throw new IllegalArgumentException("Invalid region size: " + groupCount);
        }
        this.groupCount = groupCount;
        this.begins = begins;
        this.ends = ends;
    }

    /**
     * Sets a single-group region for patterns compiled without captures.
     */
    public void set(int begin, int end) {
        set(1, new int[] {begin}, new int[] {end});
    }

    public void clear() {
        groupCount = 0;
        begins = EMPTY;
        ends = EMPTY;
    }

    /**
     * Number of groups including group 0.
     */
    public int size() {
        return groupCount;
    }

    public int begin(int group) {
        checkGroup(group);
        return begins[group];
    }

    public int end(int group) {
        checkGroup(group);
        return ends[group];
    }

    public boolean participated(int group) {
        return begin(group) != NOT_PARTICIPATED;
    }

    private void checkGroup(int group) {
        if (group < 0 || group >= groupCount) {
            throw new IndexOutOfBoundsException("Group " + group + " out of range, region has " + groupCount);
        }
    }

    @Override
    public String toString() {
        return "EngineRegion{begins=" + Arrays.toString(Arrays.copyOf(begins, groupCount))
            + ", ends=" + Arrays.toString(Arrays.copyOf(ends, groupCount)) + "}";
    }
}
