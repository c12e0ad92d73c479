/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.apache.reshuffle.executor;

import org.apache.reshuffle.hash.DistributionKey;
import org.apache.reshuffle.hash.SegmentHasher;

import org.apache.paimon.data.InternalRow;

/**
 * Resolves the segment of a row of a hash distributed table for a fixed segment count. Produces
 * the same segment as {@link org.apache.reshuffle.sink.SegmentChannelComputer} for that count.
 */
public class HashResolver {

    private final DistributionKey distributionKey;
    private final SegmentHasher hasher;

    public HashResolver(DistributionKey distributionKey, int targetCount) {
        this.distributionKey = distributionKey;
        this.hasher = distributionKey.createHasher(targetCount);
    }

    /** Returns the segment in {@code [0, targetCount)} the row belongs to. */
    public int resolve(InternalRow row) {
        return distributionKey.segment(hasher, row);
    }

    public int targetCount() {
        return hasher.numSegments();
    }
}
