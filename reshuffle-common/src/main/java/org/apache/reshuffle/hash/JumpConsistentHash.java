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

import static org.apache.paimon.utils.Preconditions.checkArgument;

/**
 * Jump consistent hash (Lamping and Veach). Growing the number of buckets from {@code O} to
 * {@code N} keeps every key either in its old bucket or moves it to a bucket in {@code [O, N)}.
 */
public final class JumpConsistentHash {

    private static final long MULTIPLIER = 2862933555777941757L;

    private JumpConsistentHash() {}

    public static int bucket(long key, int numBuckets) {
        checkArgument(numBuckets > 0, "Num bucket is illegal: " + numBuckets);
        long b = -1;
        long j = 0;
        while (j < numBuckets) {
            b = j;
            key = key * MULTIPLIER + 1;
            j = (long) ((b + 1) * ((double) (1L << 31) / (double) ((key >>> 33) + 1)));
        }
        return (int) b;
    }
}
