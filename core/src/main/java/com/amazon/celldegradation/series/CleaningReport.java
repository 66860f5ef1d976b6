/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.celldegradation.series;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

/**
 * Record of everything the cleaner removed or replaced in one channel. Nothing
 * leaves the cleaner silently: every excluded or repaired index appears here.
 */
public class CleaningReport {

    public enum Reason {
        /**
         * a repeated index, the first occurrence was kept
         */
        DUPLICATE,
        /**
         * value was NaN or infinite, replaced
         */
        NON_FINITE_VALUE,
        /**
         * value outside the physical range, replaced
         */
        OUT_OF_RANGE,
        /**
         * index was absent from the regular grid and was inserted
         */
        GAP_FILLED,
        /**
         * invalid sample removed under the DROP policy
         */
        DROPPED
    }

    @Getter
    public static class Entry {
        private final long index;
        private final double originalValue;
        private final Reason reason;

        public Entry(long index, double originalValue, Reason reason) {
            this.index = index;
            this.originalValue = originalValue;
            this.reason = reason;
        }

        @Override
        public String toString() {
            return reason + "@" + index + "(" + originalValue + ")";
        }
    }

    private final List<Entry> entries = new ArrayList<>();

    public void add(long index, double originalValue, Reason reason) {
        entries.add(new Entry(index, originalValue, reason));
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public Map<Reason, Integer> countsByReason() {
        Map<Reason, Integer> counts = new EnumMap<>(Reason.class);
        for (Entry entry : entries) {
            counts.merge(entry.reason, 1, Integer::sum);
        }
        return counts;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return countsByReason().toString();
    }
}
