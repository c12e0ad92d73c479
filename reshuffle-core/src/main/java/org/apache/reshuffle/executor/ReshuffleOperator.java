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

import org.apache.reshuffle.cluster.ClusterMembership;
import org.apache.reshuffle.cluster.ClusterTopology;
import org.apache.reshuffle.distribution.DistributionPolicy;
import org.apache.reshuffle.exception.ReshuffleInvariantException;
import org.apache.reshuffle.options.ReshuffleOptions;

import org.apache.paimon.annotation.VisibleForTesting;
import org.apache.paimon.data.GenericRow;
import org.apache.paimon.types.RowKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.Closeable;
import java.io.IOException;
import java.util.Random;

import static org.apache.paimon.utils.Preconditions.checkArgument;
import static org.apache.paimon.utils.Preconditions.checkNotNull;
import static org.apache.paimon.utils.Preconditions.checkState;

/**
 * Computes the destination segment of the split rows of a table that is reshuffled from {@code O}
 * old segments onto {@code N} segments, and writes it into the destination slot of each row. The
 * exchange downstream routes every row by that slot.
 *
 * <ul>
 *   <li>Hash distributed tables: an inserted row goes to the segment the ordinary write path
 *       chooses for {@code N} segments. A deleted row passes through; with {@link
 *       ReshuffleOptions#VERIFY_CONSISTENCY} it is checked to belong to this segment under {@code
 *       O} segments.
 *   <li>Randomly distributed tables: an inserted row goes to a uniformly random segment in {@code
 *       [O, N)}. A deleted row passes through.
 *   <li>Replicated tables: nothing is deleted, deleted rows are dropped. An inserted row is emitted
 *       once per new segment this segment seeds (see {@link ReplicatedDestinationSet}) before the
 *       next row is pulled.
 * </ul>
 *
 * <p>A segment added by the expansion holds no legacy data and ends immediately without pulling
 * from upstream. So does a segment with nothing to seed for a replicated table.
 *
 * <p>This class is not thread safe.
 */
public class ReshuffleOperator implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(ReshuffleOperator.class);

    /** Whether a replicated row is buffered for further emissions. */
    public enum State {
        AWAITING_ROW,
        REPLAYING_ROW
    }

    private final ClusterTopology topology;
    private final DistributionPolicy.Kind policyKind;
    private final int destinationSlot;
    private final boolean verifyConsistency;
    private final RowSource upstream;

    @Nullable private HashResolver newHashResolver;
    @Nullable private HashResolver oldHashResolver;
    @Nullable private RandomResolver randomResolver;
    @Nullable private ReplicatedDestinationSet replicatedDestinations;

    /** Ends the stream without pulling, this segment has nothing to send. */
    private final boolean noWork;

    @Nullable private GenericRow bufferedRow;
    private boolean closed;

    private long rowsPulled;
    private long rowsEmitted;
    private long rowsDiscarded;

    public ReshuffleOperator(
            ReshufflePlan plan,
            ClusterTopology topology,
            ReshuffleOptions options,
            RowSource upstream) {
        checkNotNull(plan, "Reshuffle plan must not be null.");
        this.topology = checkNotNull(topology, "Cluster topology must not be null.");
        this.upstream = checkNotNull(upstream, "Upstream source must not be null.");
        checkArgument(
                plan.oldSegmentCount() == topology.oldCount(),
                "Plan was made for %s old segments, but topology has %s.",
                plan.oldSegmentCount(),
                topology.oldCount());
        this.policyKind = plan.policy().kind();
        this.destinationSlot = plan.destinationSlot();
        this.verifyConsistency = options.verifyConsistency();

        switch (policyKind) {
            case HASH:
                this.newHashResolver =
                        new HashResolver(plan.distributionKey(), topology.newCount());
                if (verifyConsistency) {
                    this.oldHashResolver =
                            new HashResolver(plan.distributionKey(), topology.oldCount());
                }
                break;
            case RANDOM:
                Long seed = options.randomSeed();
                Random random = seed == null ? new Random() : new Random(seed);
                this.randomResolver = new RandomResolver(topology, random);
                break;
            case REPLICATED:
                this.replicatedDestinations = ReplicatedDestinationSet.forSegment(topology);
                break;
            default:
                throw new UnsupportedOperationException("Unsupported policy: " + policyKind);
        }

        if (topology.isNewSegment()) {
            LOG.info(
                    "Segment {} was added by the expansion from {} to {} segments, "
                            + "it has no data to reshuffle.",
                    topology.selfIndex(),
                    topology.oldCount(),
                    topology.newCount());
            this.noWork = true;
        } else if (replicatedDestinations != null && replicatedDestinations.isEmpty()) {
            LOG.info(
                    "Segment {} has no new segment to seed for the expansion from {} to {} "
                            + "segments.",
                    topology.selfIndex(),
                    topology.oldCount(),
                    topology.newCount());
            this.noWork = true;
        } else {
            this.noWork = false;
        }

        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "Created reshuffle operator for {} on {}, verify consistency: {}, "
                            + "replicated destinations: {}.",
                    plan,
                    topology,
                    verifyConsistency,
                    replicatedDestinations);
        }
    }

    /** Creates an operator for the cluster as it is right now. */
    public static ReshuffleOperator create(
            ReshufflePlan plan,
            ClusterMembership membership,
            ReshuffleOptions options,
            RowSource upstream) {
        ClusterTopology topology = ClusterTopology.snapshot(plan.oldSegmentCount(), membership);
        return new ReshuffleOperator(plan, topology, options, upstream);
    }

    /**
     * Returns the next row with its destination set, or {@code null} at the end of the stream.
     *
     * @throws ReshuffleInvariantException if a row breaks an invariant of the reshuffle
     */
    @Nullable
    public GenericRow next() throws IOException {
        checkState(!closed, "Reshuffle operator is already closed.");
        if (noWork) {
            return null;
        }

        switch (policyKind) {
            case HASH:
            case RANDOM:
                return nextPartitioned();
            case REPLICATED:
                return nextReplicated();
            default:
                throw new UnsupportedOperationException("Unsupported policy: " + policyKind);
        }
    }

    @Nullable
    private GenericRow nextPartitioned() throws IOException {
        GenericRow row = upstream.next();
        if (row == null) {
            return null;
        }
        rowsPulled++;

        RowKind action = row.getRowKind();
        if (action == RowKind.INSERT) {
            int destination =
                    policyKind == DistributionPolicy.Kind.HASH
                            ? newHashResolver.resolve(row)
                            : randomResolver.resolve();
            checkDestination(destination);
            row.setField(destinationSlot, destination);
        } else if (action == RowKind.DELETE) {
            if (verifyConsistency) {
                verifyDeletedRow(row);
            }
        } else {
            throw unexpectedAction(action);
        }

        rowsEmitted++;
        return row;
    }

    @Nullable
    private GenericRow nextReplicated() throws IOException {
        GenericRow row = bufferedRow;
        while (row == null) {
            row = upstream.next();
            if (row == null) {
                return null;
            }
            rowsPulled++;

            RowKind action = row.getRowKind();
            if (action == RowKind.DELETE) {
                // new segments never had the row, there is nothing to delete
                rowsDiscarded++;
                row = null;
            } else if (action != RowKind.INSERT) {
                throw unexpectedAction(action);
            }
        }
        bufferedRow = row;

        int destination = replicatedDestinations.next();
        checkDestination(destination);
        GenericRow copy = copy(row);
        copy.setField(destinationSlot, destination);

        if (replicatedDestinations.atStart()) {
            bufferedRow = null;
        }
        rowsEmitted++;
        return copy;
    }

    private void verifyDeletedRow(GenericRow row) {
        Object current = row.getField(destinationSlot);
        if (!(current instanceof Integer) || !topology.contains((Integer) current)) {
            throw new ReshuffleInvariantException(
                    "Deleted row %s carries invalid segment %s, cluster has %s segments.",
                    row,
                    current,
                    topology.newCount());
        }
        if (oldHashResolver != null) {
            int oldSegment = oldHashResolver.resolve(row);
            if (oldSegment != topology.selfIndex()) {
                throw new ReshuffleInvariantException(
                        "Deleted row %s hashes to segment %s under %s segments, "
                                + "but was read on segment %s.",
                        row,
                        oldSegment,
                        topology.oldCount(),
                        topology.selfIndex());
            }
        }
    }

    private void checkDestination(int destination) {
        if (!topology.contains(destination)) {
            throw new ReshuffleInvariantException(
                    "Resolved destination segment %s is out of the cluster range [0, %s).",
                    destination,
                    topology.newCount());
        }
    }

    private ReshuffleInvariantException unexpectedAction(RowKind action) {
        return new ReshuffleInvariantException(
                "Split row must be INSERT or DELETE, but is %s.", action);
    }

    private static GenericRow copy(GenericRow row) {
        GenericRow copy = new GenericRow(row.getRowKind(), row.getFieldCount());
        for (int i = 0; i < row.getFieldCount(); i++) {
            copy.setField(i, row.getField(i));
        }
        return copy;
    }

    /** Restarts the reshuffle from the first upstream row. */
    public void rescan() throws IOException {
        checkState(!closed, "Reshuffle operator is already closed.");
        bufferedRow = null;
        if (replicatedDestinations != null) {
            replicatedDestinations.reset();
        }
        upstream.rescan();
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        bufferedRow = null;
        newHashResolver = null;
        oldHashResolver = null;
        randomResolver = null;
        try {
            upstream.close();
        } finally {
            LOG.info(
                    "Reshuffle on segment {} closed, pulled {} rows, emitted {} rows, "
                            + "discarded {} rows.",
                    topology.selfIndex(),
                    rowsPulled,
                    rowsEmitted,
                    rowsDiscarded);
        }
    }

    public State state() {
        return bufferedRow == null ? State.AWAITING_ROW : State.REPLAYING_ROW;
    }

    public ClusterTopology topology() {
        return topology;
    }

    public long rowsPulled() {
        return rowsPulled;
    }

    public long rowsEmitted() {
        return rowsEmitted;
    }

    public long rowsDiscarded() {
        return rowsDiscarded;
    }

    @VisibleForTesting
    boolean hasOldHashResolver() {
        return oldHashResolver != null;
    }

    @VisibleForTesting
    boolean isClosed() {
        return closed;
    }
}
