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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link JumpConsistentHash}. */
public class JumpConsistentHashTest {

    @Test
    public void testSingleBucket() {
        Random random = new Random(7);
        for (int i = 0; i < 100; i++) {
            assertThat(JumpConsistentHash.bucket(random.nextLong(), 1)).isEqualTo(0);
        }
    }

    @Test
    public void testIllegalBuckets() {
        assertThatThrownBy(() -> JumpConsistentHash.bucket(1L, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Num bucket is illegal");
    }

    @ParameterizedTest
    @CsvSource({"1, 2", "3, 5", "3, 7", "4, 16", "16, 17"})
    public void testGrowingKeepsOrMovesToNewBuckets(int oldCount, int newCount) {
        Random random = new Random(oldCount * 31L + newCount);
        for (int i = 0; i < 10_000; i++) {
            long key = random.nextInt() & 0xFFFFFFFFL;
            int oldBucket = JumpConsistentHash.bucket(key, oldCount);
            int newBucket = JumpConsistentHash.bucket(key, newCount);
            assertThat(oldBucket).isBetween(0, oldCount - 1);
            assertThat(newBucket).isBetween(0, newCount - 1);
            if (newBucket != oldBucket) {
                assertThat(newBucket).isGreaterThanOrEqualTo(oldCount);
            }
        }
    }

    @Test
    public void testBalanced() {
        int numBuckets = 7;
        int[] counts = new int[numBuckets];
        Random random = new Random(42);
        int keys = 70_000;
        for (int i = 0; i < keys; i++) {
            counts[JumpConsistentHash.bucket(random.nextInt() & 0xFFFFFFFFL, numBuckets)]++;
        }
        for (int count : counts) {
            assertThat(count).isBetween(9_000, 11_000);
        }
    }
}
