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


package org.apache.reshuffle.options;

import org.apache.paimon.options.ConfigOption;
import org.apache.paimon.options.ConfigOptions;
import org.apache.paimon.options.Options;

import javax.annotation.Nullable;

import java.io.Serializable;
import java.util.Map;

/** Options for reshuffling a table onto an expanded cluster. */
public class ReshuffleOptions implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final ConfigOption<Boolean> VERIFY_CONSISTENCY =
            ConfigOptions.key("reshuffle.verify-consistency")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether to verify that every deleted row really belonged to the "
                                    + "current segment under the old segment count, and that "
                                    + "every destination lies inside the new cluster. A failed "
                                    + "check aborts the reshuffle.");

    public static final ConfigOption<Long> RANDOM_SEED =
            ConfigOptions.key("reshuffle.random-seed")
                    .longType()
                    .noDefaultValue()
                    .withDescription(
                            "Seed of the generator picking new segments for randomly "
                                    + "distributed tables. If not set, an unseeded generator "
                                    + "is used.");

    private final Options options;

    public ReshuffleOptions(Options options) {
        this.options = options;
    }

    public static ReshuffleOptions fromMap(Map<String, String> map) {
        return new ReshuffleOptions(Options.fromMap(map));
    }

    public boolean verifyConsistency() {
        return options.get(VERIFY_CONSISTENCY);
    }

    @Nullable
    public Long randomSeed() {
        return options.get(RANDOM_SEED);
    }

    public Options toOptions() {
        return options;
    }
}
