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

import blockstm.utils.Invariants;

/**
 * Identifies which write a read observed: either incarnation {@link #incarnation()} of the transaction at
 * {@link #txnIndex()}, or {@link #STORAGE}, the state before the block.
 */
public final class Version
{
    public static final Version STORAGE = new Version(-1, -1);

    private final int txnIndex;
    private final int incarnation;

    private Version(int txnIndex, int incarnation)
    {
        this.txnIndex = txnIndex;
        this.incarnation = incarnation;
    }

    public static Version of(int txnIndex, int incarnation)
    {
        Invariants.isNatural(txnIndex);
        Invariants.isNatural(incarnation);
        return new Version(txnIndex, incarnation);
    }

    public boolean isStorageVersion()
    {
        return this == STORAGE;
    }

    public int txnIndex()
    {
        Invariants.checkState(!isStorageVersion(), "The storage version has no transaction index");
        return txnIndex;
    }

    public int incarnation()
    {
        Invariants.checkState(!isStorageVersion(), "The storage version has no incarnation");
        return incarnation;
    }

    public PositionKey position()
    {
        return isStorageVersion() ? PositionKey.STORAGE : PositionKey.fromReal(txnIndex);
    }

    @Override
    public boolean equals(Object that)
    {
        if (this == that) return true;
        if (!(that instanceof Version)) return false;
        Version version = (Version) that;
        return txnIndex == version.txnIndex && incarnation == version.incarnation;
    }

    @Override
    public int hashCode()
    {
        return txnIndex * 31 + incarnation;
    }

    @Override
    public String toString()
    {
        return isStorageVersion() ? "Storage" : "(" + txnIndex + ',' + incarnation + ')';
    }
}
