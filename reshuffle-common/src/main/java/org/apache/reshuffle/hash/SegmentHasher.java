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


package org.apache.reshuffle.hash;

import org.apache.paimon.annotation.VisibleForTesting;
import org.apache.paimon.types.DataType;

import javax.annotation.Nullable;

import java.util.List;

import static org.apache.paimon.utils.Preconditions.checkArgument;

/**
 * Multi-column hash accumulator of a hash distributed table, configured for a fixed number of
 * segments. A row is placed by {@link #init()}, one {@link #add} per key column in key order and a
 * final {@link #reduce()}.
 *
 * <p>Each {@link #add} rotates the 32 bit accumulator left by one and, for a non-null value, xors
 * in the hash of the value computed by the hasher of that key position. {@link #reduce()} maps the
 * accumulator to a segment with {@link JumpConsistentHash}.
 *
 * <p>This class is not thread safe.
 */
public class SegmentHasher {

    private final int numSegments;
    private final ValueHasher[] hashers;

    private int hash;

    public SegmentHasher(int numSegments, List<DataType> keyTypes) {
        checkArgument(numSegments > 0, "Num segments is illegal: " + numSegments);
        this.numSegments = numSegments;
        this.hashers = new ValueHasher[keyTypes.size()];
        for (int i = 0; i < hashers.length; i++) {
            hashers[i] = ValueHashers.create(keyTypes.get(i));
        }
    }

    public void init() {
        hash = 0;
    }

    /**
     * Mixes a key column into the accumulator.
     *
     * @param position 1-based position of the key column in the distribution key
     * @param value the column value, {@code null} for SQL NULL
     */
    public void add(int position, @Nullable Object value) {
        int h = (hash << 1) | (hash >>> 31);
        if (value != null) {
            h ^= hashers[position - 1].hash(value);
        }
        hash = h;
    }

    /** Reduces the accumulator to a segment in {@code [0, numSegments)}. */
    public int reduce() {
        return JumpConsistentHash.bucket(hash & 0xFFFFFFFFL, numSegments);
    }

    public int numSegments() {
        return numSegments;
    }

    public int numKeys() {
        return hashers.length;
    }

    @VisibleForTesting
    int hash() {
        return hash;
    }
}
