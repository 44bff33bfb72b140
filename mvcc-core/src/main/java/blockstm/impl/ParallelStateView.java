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

package blockstm.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import blockstm.api.StateView;
import blockstm.api.StateViewException;
import blockstm.api.TransactionWrite;
import blockstm.local.MultiVersionStore;
import blockstm.local.ReadResult;
import blockstm.utils.Invariants;

/**
 * The state as seen by one speculative execution of the transaction at {@link #txnIndex()}: the writes
 * and deltas of lower transactions in the block, falling back to the pre-block state.
 * <p>
 * When the block has nothing final to offer for a key, the pre-block value is fetched from storage and
 * recorded in the store as the key's base value, then the store is read again. The second read sees any
 * lower write that raced with the storage fetch. A dependency on a stale record is reported immediately;
 * waiting for it is the scheduler's business.
 */
public class ParallelStateView<K, V extends TransactionWrite>
{
    private static final Logger logger = LoggerFactory.getLogger(ParallelStateView.class);

    private final MultiVersionStore<K, V> store;
    private final StateView<K, V> storage;
    private final int txnIndex;

    public ParallelStateView(MultiVersionStore<K, V> store, StateView<K, V> storage, int txnIndex)
    {
        this.store = Invariants.nonNull(store);
        this.storage = Invariants.nonNull(storage);
        this.txnIndex = Invariants.isNatural(txnIndex);
    }

    public int txnIndex()
    {
        return txnIndex;
    }

    public ViewRead<V> read(K key) throws StateViewException
    {
        ReadResult<V> read = store.read(key, txnIndex);
        switch (read.kind())
        {
            default: throw new AssertionError("Unhandled kind: " + read.kind());
            case NotFound:
            case Unresolved:
                break;
            case Versioned:
            case Resolved:
            case Dependency:
            case DeltaApplicationFailure:
                return toViewRead(key, read);
        }

        V base = storage.get(key);
        if (base == null)
        {
            if (read.kind() == ReadResult.Kind.NotFound)
                return ViewRead.absent();

            logger.debug("{}: transaction {} read deltas {} of a key absent from storage", key, txnIndex, read.unresolved());
            return ViewRead.speculativeFailure();
        }

        store.setBaseValue(key, base);
        ReadResult<V> reread = store.read(key, txnIndex);
        Invariants.checkState(reread.kind() != ReadResult.Kind.NotFound && reread.kind() != ReadResult.Kind.Unresolved,
                              "Read of %s found no base value after it was recorded: %s", key, reread);
        return toViewRead(key, reread);
    }

    private ViewRead<V> toViewRead(K key, ReadResult<V> read)
    {
        switch (read.kind())
        {
            default: throw new AssertionError("Unhandled kind: " + read.kind());
            case Versioned: return ViewRead.value(read.version(), read.value());
            case Resolved: return ViewRead.number(read.resolved());
            case Dependency: return ViewRead.dependency(read.dependency());
            case DeltaApplicationFailure:
                logger.debug("{}: deltas visible to transaction {} do not apply", key, txnIndex);
                return ViewRead.speculativeFailure();
        }
    }
}
