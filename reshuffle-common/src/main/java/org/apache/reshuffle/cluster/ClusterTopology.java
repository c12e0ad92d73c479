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


package org.apache.reshuffle.cluster;

import java.io.Serializable;
import java.util.Objects;

import static org.apache.paimon.utils.Preconditions.checkArgument;
import static org.apache.paimon.utils.Preconditions.checkNotNull;

/**
 * Immutable snapshot of a cluster expansion: the segment count {@code O} a table was distributed
 * on, the segment count {@code N} of the expanded cluster and the id of the running segment.
 *
 * <p>Segments {@code [0, O)} are old segments holding legacy data, segments {@code [O, N)} were
 * added by the expansion and hold nothing yet.
 */
public final class ClusterTopology implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int oldCount;
    private final int newCount;
    private final int selfIndex;

    private ClusterTopology(int oldCount, int newCount, int selfIndex) {
        checkArgument(oldCount > 0, "Old segment count must be positive, but is %s.", oldCount);
        checkArgument(
                newCount > oldCount,
                "New segment count %s must be greater than old segment count %s.",
                newCount,
                oldCount);
        checkArgument(
                selfIndex >= 0 && selfIndex < newCount,
                "Segment index %s is out of the cluster range [0, %s).",
                selfIndex,
                newCount);
        this.oldCount = oldCount;
        this.newCount = newCount;
        this.selfIndex = selfIndex;
    }

    public static ClusterTopology of(int oldCount, int newCount, int selfIndex) {
        return new ClusterTopology(oldCount, newCount, selfIndex);
    }

    /** Captures the live membership once, so later membership changes are not observed. */
    public static ClusterTopology snapshot(int oldCount, ClusterMembership membership) {
        checkNotNull(membership, "Cluster membership must not be null.");
        return new ClusterTopology(oldCount, membership.segmentCount(), membership.selfIndex());
    }

    public int oldCount() {
        return oldCount;
    }

    public int newCount() {
        return newCount;
    }

    public int selfIndex() {
        return selfIndex;
    }

    /** Whether the running segment was added by the expansion and thus owns no legacy data. */
    public boolean isNewSegment() {
        return selfIndex >= oldCount;
    }

    public boolean contains(int segment) {
        return segment >= 0 && segment < newCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ClusterTopology that = (ClusterTopology) o;
        return oldCount == that.oldCount
                && newCount == that.newCount
                && selfIndex == that.selfIndex;
    }

    @Override
    public int hashCode() {
        return Objects.hash(oldCount, newCount, selfIndex);
    }

    @Override
    public String toString() {
        return "ClusterTopology{oldCount="
                + oldCount
                + ", newCount="
                + newCount
                + ", selfIndex="
                + selfIndex
                + '}';
    }
}
