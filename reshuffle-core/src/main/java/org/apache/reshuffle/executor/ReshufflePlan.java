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

import org.apache.reshuffle.distribution.DistributionPolicy;
import org.apache.reshuffle.hash.DistributionKey;

import org.apache.paimon.types.DataTypeRoot;
import org.apache.paimon.types.RowType;

import javax.annotation.Nullable;

import java.io.Serializable;

import static org.apache.paimon.utils.Preconditions.checkArgument;
import static org.apache.paimon.utils.Preconditions.checkNotNull;

/**
 * Planner output describing one reshuffle: the shape of the split rows, the distribution policy
 * of the table, the segment count the table is currently distributed on and the {@code INT}
 * column receiving the destination segment. The new segment count and the running segment are
 * not part of the plan, they are read from the live cluster when the operator is created.
 */
public class ReshufflePlan implements Serializable {

    private static final long serialVersionUID = 1L;

    private final RowType rowType;
    private final DistributionPolicy policy;
    private final int oldSegmentCount;
    private final int destinationSlot;
    @Nullable private final DistributionKey distributionKey;

    public ReshufflePlan(
            RowType rowType, DistributionPolicy policy, int oldSegmentCount, int destinationSlot) {
        this.rowType = checkNotNull(rowType, "Row type must not be null.");
        this.policy = checkNotNull(policy, "Distribution policy must not be null.");
        checkArgument(
                oldSegmentCount > 0,
                "Old segment count must be positive, but is %s.",
                oldSegmentCount);
        checkArgument(
                destinationSlot >= 0 && destinationSlot < rowType.getFieldCount(),
                "Destination slot %s does not exist in %s.",
                destinationSlot,
                rowType);
        checkArgument(
                rowType.getTypeAt(destinationSlot).getTypeRoot() == DataTypeRoot.INTEGER,
                "Destination slot %s must be of type INT, but is %s.",
                destinationSlot,
                rowType.getTypeAt(destinationSlot));
        this.oldSegmentCount = oldSegmentCount;
        this.destinationSlot = destinationSlot;
        this.distributionKey =
                policy.kind() == DistributionPolicy.Kind.HASH
                        ? DistributionKey.of(rowType, policy.keyColumns())
                        : null;
    }

    public RowType rowType() {
        return rowType;
    }

    public DistributionPolicy policy() {
        return policy;
    }

    public int oldSegmentCount() {
        return oldSegmentCount;
    }

    public int destinationSlot() {
        return destinationSlot;
    }

    /** The distribution key of a hash distributed table, {@code null} for other policies. */
    @Nullable
    public DistributionKey distributionKey() {
        return distributionKey;
    }

    @Override
    public String toString() {
        return "ReshufflePlan{policy="
                + policy
                + ", oldSegmentCount="
                + oldSegmentCount
                + ", destinationSlot="
                + destinationSlot
                + ", rowType="
                + rowType
                + '}';
    }
}
