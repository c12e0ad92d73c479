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

import org.apache.reshuffle.cluster.ClusterTopology;

import java.util.Arrays;

import static org.apache.paimon.utils.Preconditions.checkState;

/**
 * The new segments an old segment seeds with a copy of a replicated table, and a round-robin
 * cursor over them.
 *
 * <p>Old segment {@code i} copies to {@code i + O, i + 2O, ...} below {@code N}. Across all old
 * segments these lists partition {@code [O, N)}. For {@code O = 3, N = 7}: segment 0 seeds 3 and
 * 6, segment 1 seeds 4, segment 2 seeds 5. New segments seed nothing.
 */
public class ReplicatedDestinationSet {

    private final int[] destinations;

    private int cursor;

    private ReplicatedDestinationSet(int[] destinations) {
        this.destinations = destinations;
        this.cursor = 0;
    }

    public static ReplicatedDestinationSet forSegment(ClusterTopology topology) {
        return new ReplicatedDestinationSet(
                destinations(topology.selfIndex(), topology.oldCount(), topology.newCount()));
    }

    static int[] destinations(int selfIndex, int oldCount, int newCount) {
        if (selfIndex >= oldCount || selfIndex + oldCount >= newCount) {
            return new int[0];
        }
        int[] result = new int[(newCount - selfIndex - 1) / oldCount];
        int segment = selfIndex + oldCount;
        for (int i = 0; i < result.length; i++) {
            result[i] = segment;
            segment += oldCount;
        }
        return result;
    }

    /** Returns the destination under the cursor and advances it, wrapping at the end. */
    public int next() {
        checkState(destinations.length > 0, "Segment has no replicated destinations.");
        int destination = destinations[cursor];
        cursor++;
        if (cursor >= destinations.length) {
            cursor = 0;
        }
        return destination;
    }

    /** Whether the cursor is at the first destination, i.e. a full round has been produced. */
    public boolean atStart() {
        return cursor == 0;
    }

    public void reset() {
        cursor = 0;
    }

    public boolean isEmpty() {
        return destinations.length == 0;
    }

    public int size() {
        return destinations.length;
    }

    public int cursor() {
        return cursor;
    }

    public int[] destinations() {
        return destinations.clone();
    }

    @Override
    public String toString() {
        return Arrays.toString(destinations);
    }
}
