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

import org.apache.paimon.data.BinaryString;
import org.apache.paimon.data.Decimal;
import org.apache.paimon.data.Timestamp;
import org.apache.paimon.types.DataTypes;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link ValueHashers}. */
public class ValueHashersTest {

    @Test
    public void testIntegralTypesAgree() {
        int expected = ValueHashers.hashLong(42L);
        assertThat(ValueHashers.create(DataTypes.TINYINT()).hash((byte) 42)).isEqualTo(expected);
        assertThat(ValueHashers.create(DataTypes.SMALLINT()).hash((short) 42))
                .isEqualTo(expected);
        assertThat(ValueHashers.create(DataTypes.INT()).hash(42)).isEqualTo(expected);
        assertThat(ValueHashers.create(DataTypes.BIGINT()).hash(42L)).isEqualTo(expected);
        assertThat(ValueHashers.create(DataTypes.DATE()).hash(42)).isEqualTo(expected);
    }

    @Test
    public void testFloatingPointNormalization() {
        ValueHasher doubles = ValueHashers.create(DataTypes.DOUBLE());
        assertThat(doubles.hash(-0.0d)).isEqualTo(doubles.hash(0.0d));
        assertThat(doubles.hash(Double.longBitsToDouble(0x7ff8000000000001L)))
                .isEqualTo(doubles.hash(Double.NaN));

        ValueHasher floats = ValueHashers.create(DataTypes.FLOAT());
        assertThat(floats.hash(-0.0f)).isEqualTo(floats.hash(0.0f));
        assertThat(floats.hash(1.5f)).isNotEqualTo(floats.hash(2.5f));
    }

    @Test
    public void testStringsHashByContent() {
        ValueHasher strings = ValueHashers.create(DataTypes.STRING());
        BinaryString first = BinaryString.fromString("segment");
        BinaryString second = BinaryString.fromBytes("segment".getBytes());
        assertThat(strings.hash(first)).isEqualTo(strings.hash(second));
        assertThat(strings.hash(first)).isNotEqualTo(strings.hash(BinaryString.fromString("x")));

        ValueHasher bytes = ValueHashers.create(DataTypes.BYTES());
        assertThat(bytes.hash("segment".getBytes())).isEqualTo(strings.hash(first));
    }

    @Test
    public void testDecimalAndTimestamp() {
        ValueHasher compact = ValueHashers.create(DataTypes.DECIMAL(10, 2));
        Decimal small = Decimal.fromBigDecimal(new BigDecimal("12.34"), 10, 2);
        assertThat(compact.hash(small)).isEqualTo(ValueHashers.hashLong(1234L));

        ValueHasher wide = ValueHashers.create(DataTypes.DECIMAL(30, 2));
        Decimal large = Decimal.fromBigDecimal(new BigDecimal("12.34"), 30, 2);
        Decimal same = Decimal.fromBigDecimal(BigDecimal.valueOf(1234L, 2), 30, 2);
        assertThat(large.isCompact()).isFalse();
        assertThat(wide.hash(large)).isEqualTo(wide.hash(same));

        ValueHasher timestamps = ValueHashers.create(DataTypes.TIMESTAMP(6));
        Timestamp timestamp = Timestamp.fromEpochMillis(1_000L, 5);
        assertThat(timestamps.hash(timestamp))
                .isEqualTo(ValueHashers.hashLong(1_000L) ^ 5)
                .isNotEqualTo(timestamps.hash(Timestamp.fromEpochMillis(1_000L)));
    }

    @Test
    public void testUnsupportedType() {
        assertThatThrownBy(() -> ValueHashers.create(DataTypes.ARRAY(DataTypes.INT())))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessageContaining("Unsupported type as distribution key");
    }
}
