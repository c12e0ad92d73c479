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

import org.apache.paimon.data.InternalRow;
import org.apache.paimon.types.DataType;
import org.apache.paimon.types.RowType;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.apache.paimon.utils.Preconditions.checkArgument;

/** The ordered key columns of a hash distributed table and how to read them from a row. */
public class DistributionKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int[] keyColumns;
    private final List<DataType> keyTypes;
    private final InternalRow.FieldGetter[] getters;

    private DistributionKey(int[] keyColumns, List<DataType> keyTypes) {
        this.keyColumns = keyColumns;
        this.keyTypes = Collections.unmodifiableList(keyTypes);
        this.getters = new InternalRow.FieldGetter[keyColumns.length];
        for (int i = 0; i < keyColumns.length; i++) {
            getters[i] = InternalRow.createFieldGetter(keyTypes.get(i), keyColumns[i]);
        }
    }

    public static DistributionKey of(RowType rowType, int[] keyColumns) {
        checkArgument(keyColumns.length > 0, "Distribution key needs at least one column.");
        List<DataType> keyTypes = new ArrayList<>(keyColumns.length);
        for (int column : keyColumns) {
            checkArgument(
                    column >= 0 && column < rowType.getFieldCount(),
                    "Key column %s does not exist in %s.",
                    column,
                    rowType);
            DataType type = rowType.getTypeAt(column);
            // fail early on types we cannot hash
            ValueHashers.create(type);
            keyTypes.add(type);
        }
        return new DistributionKey(keyColumns.clone(), keyTypes);
    }

    public SegmentHasher createHasher(int numSegments) {
        return new SegmentHasher(numSegments, keyTypes);
    }

    /** Computes the segment of the row using the given hasher. */
    public int segment(SegmentHasher hasher, InternalRow row) {
        hasher.init();
        for (int i = 0; i < getters.length; i++) {
            hasher.add(i + 1, getters[i].getFieldOrNull(row));
        }
        return hasher.reduce();
    }

    public int[] keyColumns() {
        return keyColumns.clone();
    }

    public List<DataType> keyTypes() {
        return keyTypes;
    }
}
