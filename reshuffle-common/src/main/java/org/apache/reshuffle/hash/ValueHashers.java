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
import org.apache.paimon.types.DataType;
import org.apache.paimon.utils.MurmurHashUtils;

/** Factory of the per-type {@link ValueHasher}s used for distribution keys. */
public final class ValueHashers {

    private ValueHashers() {}

    /**
     * Creates the hasher for values of the given type.
     *
     * @throws UnsupportedOperationException if the type cannot be used as a distribution key.
     */
    public static ValueHasher create(DataType type) {
        switch (type.getTypeRoot()) {
            case BOOLEAN:
                return value -> hashLong((Boolean) value ? 1L : 0L);
            case TINYINT:
                return value -> hashLong((Byte) value);
            case SMALLINT:
                return value -> hashLong((Short) value);
            case INTEGER:
            case DATE:
            case TIME_WITHOUT_TIME_ZONE:
                return value -> hashLong((Integer) value);
            case BIGINT:
                return value -> hashLong((Long) value);
            case FLOAT:
                return value -> hashFloat((Float) value);
            case DOUBLE:
                return value -> hashDouble((Double) value);
            case CHAR:
            case VARCHAR:
                return value -> MurmurHashUtils.hashBytes(((BinaryString) value).toBytes());
            case BINARY:
            case VARBINARY:
                return value -> MurmurHashUtils.hashBytes((byte[]) value);
            case DECIMAL:
                return value -> hashDecimal((Decimal) value);
            case TIMESTAMP_WITHOUT_TIME_ZONE:
            case TIMESTAMP_WITH_LOCAL_TIME_ZONE:
                return value -> hashTimestamp((Timestamp) value);
            default:
                throw new UnsupportedOperationException(
                        "Unsupported type as distribution key: " + type);
        }
    }

    /** Thomas Wang's 64 bit integer hash, folded to 32 bits. */
    public static int hashLong(long key) {
        key = (~key) + (key << 21);
        key = key ^ (key >>> 24);
        key = (key + (key << 3)) + (key << 8);
        key = key ^ (key >>> 14);
        key = (key + (key << 2)) + (key << 4);
        key = key ^ (key >>> 28);
        key = key + (key << 31);
        return (int) (key ^ (key >>> 32));
    }

    static int hashFloat(float value) {
        // -0.0 equals 0.0, all NaNs collapse to one bit pattern
        if (value == 0.0f) {
            value = 0.0f;
        }
        return hashLong(Float.floatToIntBits(value));
    }

    static int hashDouble(double value) {
        if (value == 0.0d) {
            value = 0.0d;
        }
        return hashLong(Double.doubleToLongBits(value));
    }

    static int hashDecimal(Decimal value) {
        if (value.isCompact()) {
            return hashLong(value.toUnscaledLong());
        }
        return MurmurHashUtils.hashBytes(value.toUnscaledBytes());
    }

    static int hashTimestamp(Timestamp value) {
        return hashLong(value.getMillisecond()) ^ value.getNanoOfMillisecond();
    }
}
