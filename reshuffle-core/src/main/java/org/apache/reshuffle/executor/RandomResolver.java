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


package org.apache.reshuffle.executor;

import org.apache.reshuffle.cluster.ClusterTopology;

import java.util.Random;

/**
 * Picks a destination for a row of a randomly distributed table, uniformly among the segments
 * added by the expansion, i.e. in {@code [O, N)}. The segment a random row currently lives on can
 * not be derived from its content, so there is nothing to resolve for deleted rows.
 */
public class RandomResolver {

    private final int oldCount;
    private final int newSegments;
    private final Random random;

    public RandomResolver(ClusterTopology topology, Random random) {
        this.oldCount = topology.oldCount();
        this.newSegments = topology.newCount() - topology.oldCount();
        this.random = random;
    }

    public int resolve() {
        return oldCount + random.nextInt(newSegments);
    }
}
