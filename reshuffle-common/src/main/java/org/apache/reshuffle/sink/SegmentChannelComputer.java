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


package org.apache.reshuffle.sink;

import org.apache.reshuffle.hash.DistributionKey;
import org.apache.reshuffle.hash.SegmentHasher;

import org.apache.paimon.data.InternalRow;
import org.apache.paimon.types.RowType;

import java.io.Serializable;

import static org.apache.paimon.utils.Preconditions.checkState;

/**
 * Computes which segment an inserted row of a hash distributed table is written to. This is the
 * placement every ordinary write uses, a reshuffle must reproduce it exactly.
 */
public class SegmentChannelComputer implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DistributionKey distributionKey;

    private transient SegmentHasher hasher;

    public SegmentChannelComputer(RowType rowType, int[] keyColumns) {
        this.distributionKey = DistributionKey.of(rowType, keyColumns);
    }

    public void setup(int numSegments) {
        this.hasher = distributionKey.createHasher(numSegments);
    }

    public int channel(InternalRow row) {
        checkState(hasher != null, "setup must be called before computing channels.");
        return distributionKey.segment(hasher, row);
    }

    @Override
    public String toString() {
        return "shuffle by distribution key " + distributionKey.keyTypes();
    }
}
