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


package org.apache.reshuffle.distribution;

import java.io.Serializable;
import java.util.Arrays;

import static org.apache.paimon.utils.Preconditions.checkArgument;
import static org.apache.paimon.utils.Preconditions.checkNotNull;

/**
 * The rule by which the rows of a table are assigned to segments. Exactly one of:
 *
 * <ul>
 *   <li>{@link Kind#HASH}: hash of an ordered list of key columns.
 *   <li>{@link Kind#RANDOM}: uniformly random, no key columns.
 *   <li>{@link Kind#REPLICATED}: every segment holds a full copy of the table.
 * </ul>
 */
public final class DistributionPolicy implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final int[] NO_KEYS = new int[0];

    private static final DistributionPolicy RANDOM = new DistributionPolicy(Kind.RANDOM, NO_KEYS);

    private static final DistributionPolicy REPLICATED =
            new DistributionPolicy(Kind.REPLICATED, NO_KEYS);

    /** Kind of a {@link DistributionPolicy}. */
    public enum Kind {
        HASH,
        RANDOM,
        REPLICATED
    }

    private final Kind kind;
    private final int[] keyColumns;

    private DistributionPolicy(Kind kind, int[] keyColumns) {
        this.kind = kind;
        this.keyColumns = keyColumns;
    }

    /** Hash distribution on the given 0-based column indices, in mixing order. */
    public static DistributionPolicy hash(int... keyColumns) {
        checkNotNull(keyColumns, "Key columns must not be null.");
        checkArgument(
                keyColumns.length > 0, "Hash distribution needs at least one key column.");
        for (int column : keyColumns) {
            checkArgument(column >= 0, "Key column index must not be negative: %s", column);
        }
        return new DistributionPolicy(Kind.HASH, keyColumns.clone());
    }

    public static DistributionPolicy random() {
        return RANDOM;
    }

    public static DistributionPolicy replicated() {
        return REPLICATED;
    }

    public Kind kind() {
        return kind;
    }

    /** Key column indices, empty unless this is a {@link Kind#HASH} policy. */
    public int[] keyColumns() {
        return keyColumns.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DistributionPolicy that = (DistributionPolicy) o;
        return kind == that.kind && Arrays.equals(keyColumns, that.keyColumns);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + Arrays.hashCode(keyColumns);
    }

    @Override
    public String toString() {
        return kind == Kind.HASH ? "HASH" + Arrays.toString(keyColumns) : kind.name();
    }
}
