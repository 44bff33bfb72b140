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

package blockstm.primitives;

import javax.annotation.Nonnull;

import blockstm.utils.Invariants;

/**
 * Position of a record within the version history of one key. Transaction index {@code i} of the block
 * occupies position {@code i + 1}; position zero is reserved for the value the key had before the block,
 * so that storage and transaction 0 are distinct entries of the same ordered map.
 */
public final class PositionKey implements Comparable<PositionKey>
{
    public static final PositionKey STORAGE = new PositionKey(0);

    private static final PositionKey[] CACHE = new PositionKey[1024];
    static
    {
        CACHE[0] = STORAGE;
        for (int i = 1 ; i < CACHE.length ; ++i)
            CACHE[i] = new PositionKey(i);
    }

    private final int position;

    private PositionKey(int position)
    {
        this.position = position;
    }

    public static PositionKey fromReal(int txnIndex)
    {
        Invariants.isNatural(txnIndex);
        Invariants.checkArgument(txnIndex < Integer.MAX_VALUE, "Transaction index out of range");
        int position = txnIndex + 1;
        return position < CACHE.length ? CACHE[position] : new PositionKey(position);
    }

    public boolean isStorageVersion()
    {
        return position == 0;
    }

    /**
     * @return the transaction index this position belongs to
     * @throws blockstm.utils.InvariantViolation if this is the storage position, which has no transaction
     */
    public int toReal()
    {
        Invariants.checkState(position != 0, "The storage position has no transaction index");
        return position - 1;
    }

    /**
     * The version of a record held at this position, given the incarnation that wrote it.
     */
    public Version version(int incarnation)
    {
        return isStorageVersion() ? Version.STORAGE : Version.of(toReal(), incarnation);
    }

    @Override
    public int compareTo(@Nonnull PositionKey that)
    {
        return Integer.compare(this.position, that.position);
    }

    @Override
    public boolean equals(Object that)
    {
        return that instanceof PositionKey && ((PositionKey) that).position == position;
    }

    @Override
    public int hashCode()
    {
        return position;
    }

    @Override
    public String toString()
    {
        return isStorageVersion() ? "Storage" : Integer.toString(position - 1);
    }
}
