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


package org.apache.reshuffle.exception;

/**
 * Thrown when an internal invariant of a reshuffle is broken, for example a resolved destination
 * outside of the cluster or a row whose old placement does not match the segment it was read from.
 * This always means a bug in policy or topology setup, so the statement must be aborted and never
 * retried.
 */
public class ReshuffleInvariantException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ReshuffleInvariantException(String msg) {
        super(msg);
    }

    public ReshuffleInvariantException(String msg, Throwable e) {
        super(msg, e);
    }

    public ReshuffleInvariantException(String msg, Object... args) {
        super(String.format(msg, args));
    }
}
