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

import org.apache.reshuffle.hash.JumpConsistentHash;
import org.apache.reshuffle.hash.ValueHashers;

import org.apache.paimon.data.BinaryString;
import org.apache.paimon.data.GenericRow;
import org.apache.paimon.types.DataTypes;
import org.apache.paimon.types.RowType;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link SegmentChannelComputer}. */
public class SegmentChannelComputerTest {

    private static final RowType ROW_TYPE =
            RowType.of(DataTypes.STRING(), DataTypes.BIGINT(), DataTypes.INT());

    @Test
    public void testSingleKeyColumn() {
        SegmentChannelComputer computer = new SegmentChannelComputer(ROW_TYPE, new int[] {1});
        computer.setup(4);

        GenericRow row = GenericRow.of(BinaryString.fromString("a"), 100L, 0);
        int expected =
                JumpConsistentHash.bucket(ValueHashers.hashLong(100L) & 0xFFFFFFFFL, 4);
        assertThat(computer.channel(row)).isEqualTo(expected);
    }

    @Test
    public void testOnlyKeyColumnsMatter() {
        SegmentChannelComputer computer = new SegmentChannelComputer(ROW_TYPE, new int[] {1, 0});
        computer.setup(11);
        for (long i = 0; i < 200; i++) {
            GenericRow first = GenericRow.of(BinaryString.fromString("n" + i), i, 1);
            GenericRow second = GenericRow.of(BinaryString.fromString("n" + i), i, 2);
            assertThat(computer.channel(first))
                    .isEqualTo(computer.channel(second))
                    .isBetween(0, 10);
        }
    }

    @Test
    public void testNullKey() {
        SegmentChannelComputer computer = new SegmentChannelComputer(ROW_TYPE, new int[] {0});
        computer.setup(3);
        assertThat(computer.channel(GenericRow.of(null, 1L, 0)))
                .isEqualTo(JumpConsistentHash.bucket(0L, 3));
    }

    @Test
    public void testSetupRequired() {
        SegmentChannelComputer computer = new SegmentChannelComputer(ROW_TYPE, new int[] {0});
        assertThatThrownBy(() -> computer.channel(GenericRow.of(null, 1L, 0)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testMissingKeyColumn() {
        assertThatThrownBy(() -> new SegmentChannelComputer(ROW_TYPE, new int[] {3}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Key column 3 does not exist");
    }
}
