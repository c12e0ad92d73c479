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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link DistributionPolicy}. */
public class DistributionPolicyTest {

    @Test
    public void testHashPolicy() {
        int[] keys = new int[] {2, 0};
        DistributionPolicy policy = DistributionPolicy.hash(keys);
        keys[0] = 5;

        assertThat(policy.kind()).isEqualTo(DistributionPolicy.Kind.HASH);
        assertThat(policy.keyColumns()).containsExactly(2, 0);
        assertThat(policy).isEqualTo(DistributionPolicy.hash(2, 0));
        assertThat(policy).isNotEqualTo(DistributionPolicy.hash(0, 2));
        assertThat(policy.toString()).isEqualTo("HASH[2, 0]");
    }

    @Test
    public void testPoliciesWithoutKeys() {
        assertThat(DistributionPolicy.random().kind()).isEqualTo(DistributionPolicy.Kind.RANDOM);
        assertThat(DistributionPolicy.random().keyColumns()).isEmpty();
        assertThat(DistributionPolicy.replicated().kind())
                .isEqualTo(DistributionPolicy.Kind.REPLICATED);
        assertThat(DistributionPolicy.replicated().keyColumns()).isEmpty();
        assertThat(DistributionPolicy.random()).isNotEqualTo(DistributionPolicy.replicated());
    }

    @Test
    public void testInvalidHashPolicy() {
        assertThatThrownBy(() -> DistributionPolicy.hash())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one key column");
        assertThatThrownBy(() -> DistributionPolicy.hash(1, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not be negative");
    }
}
