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

import org.apache.paimon.data.GenericRow;

import javax.annotation.Nullable;

import java.io.Closeable;
import java.io.IOException;

/**
 * Pull based source of split rows feeding a {@link ReshuffleOperator}. Every row carries its
 * action as {@link org.apache.paimon.types.RowKind}: {@code DELETE} for the half of a move that
 * removes the row from its current segment, {@code INSERT} for the half that writes it to its new
 * segment. Rows have already passed the filter selecting the rows that need to move.
 */
public interface RowSource extends Closeable {

    /**
     * Returns the next row, or {@code null} if the source is exhausted. The returned row may be
     * modified by the caller.
     */
    @Nullable
    GenericRow next() throws IOException;

    /** Restarts the source from its first row. */
    void rescan() throws IOException;
}
