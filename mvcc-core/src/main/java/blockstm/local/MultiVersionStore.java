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

package blockstm.local;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import blockstm.api.StoreConfig;
import blockstm.api.TransactionWrite;
import blockstm.primitives.DeltaApplicationException;
import blockstm.primitives.DeltaOp;
import blockstm.primitives.MaterializedDelta;
import blockstm.primitives.PositionKey;
import blockstm.primitives.Version;
import blockstm.utils.InvariantViolation;
import blockstm.utils.Invariants;

/**
 * Multi-version store for the speculative, parallel execution of one block of transactions.
 * <p>
 * For every key it keeps the writes and deltas produced by each transaction of the block, indexed by
 * transaction position, so that a transaction reads exactly what its predecessors in block order have
 * produced so far. Writes are tagged with the incarnation that produced them, and the scheduler marks
 * records stale when it aborts the transaction that wrote them; a reader crossing a stale record is told
 * which transaction it depends on rather than observing a value that may change.
 * <p>
 * Deltas let many transactions modify the same counter without reading one another: a reader composes
 * the deltas below it until it reaches a write, and at commit {@link #materializeDeltas} converts each
 * key's chain of deltas into the concrete value every transaction observed.
 * <p>
 * No operation waits for another transaction. Mutations of a key run inside a single map operation on
 * that key; distinct keys never contend. A store lives for exactly one block.
 */
public class MultiVersionStore<K, V extends TransactionWrite>
{
    private static final Logger logger = LoggerFactory.getLogger(MultiVersionStore.class);

    private final ConcurrentHashMap<K, KeyHistory<V>> tables;
    // keys that have carried a delta at least once; guarded by this
    private List<K> deltaKeys = new ArrayList<>();

    public MultiVersionStore()
    {
        this(StoreConfig.DEFAULT);
    }

    public MultiVersionStore(StoreConfig config)
    {
        this.tables = new ConcurrentHashMap<>(config.initialCapacity(), 0.75f, config.concurrencyLevel());
    }

    /**
     * Record {@code value} as written by the given incarnation of a transaction, replacing whatever that
     * transaction recorded for the key before.
     *
     * @throws InvariantViolation if the transaction already recorded a write with an equal or later incarnation
     */
    public void write(K key, Version version, V value)
    {
        Invariants.nonNull(key, "key");
        Invariants.nonNull(value, "value");
        if (version.isStorageVersion())
            throw violation("Cannot write key " + key + " at the storage version; the pre-block value is recorded by setBaseValue");

        PositionKey position = version.position();
        int incarnation = version.incarnation();
        VersionRecord<V> record = VersionRecord.write(incarnation, value);
        tables.compute(key, (k, history) -> {
            if (history == null)
                history = new KeyHistory<>();

            VersionRecord<V> prev = history.get(position);
            if (prev != null && prev.kind() == VersionRecord.Kind.Write && prev.incarnation() >= incarnation)
                throw violation("Incarnation " + incarnation + " of transaction " + version.txnIndex() + " writing " + k
                                + " does not follow previously recorded incarnation " + prev.incarnation());

            history.put(position, record);
            return history;
        });
        logger.trace("{}: recorded write {} at {}", key, value, version);
    }

    /**
     * Record a delta for the key on behalf of the transaction at {@code txnIndex}, replacing whatever that
     * transaction recorded for the key before. The first delta for a key registers it with {@link #takeDeltaKeys()}.
     */
    public void recordDelta(K key, int txnIndex, DeltaOp delta)
    {
        Invariants.nonNull(key, "key");
        PositionKey position = PositionKey.fromReal(txnIndex);
        VersionRecord<V> record = VersionRecord.delta(delta);
        tables.compute(key, (k, history) -> {
            if (history == null)
                history = new KeyHistory<>();

            history.put(position, record);
            if (history.markHasDelta())
                addDeltaKey(k);
            return history;
        });
        logger.trace("{}: recorded delta {} at {}", key, delta, txnIndex);
    }

    /**
     * Record the value of the key before the block, if no value has been recorded yet. The pre-block value
     * cannot change during the block, so racing callers may safely supply it more than once.
     */
    public void setBaseValue(K key, V value)
    {
        Invariants.nonNull(key, "key");
        VersionRecord<V> record = VersionRecord.write(0, value);
        tables.compute(key, (k, history) -> {
            if (history == null)
                history = new KeyHistory<>();
            history.putIfAbsent(PositionKey.STORAGE, record);
            return history;
        });
    }

    /**
     * Flag the record of the transaction at {@code txnIndex} as stale, so that readers above it report a
     * dependency instead of observing it. Only the record's freshness flag is touched.
     */
    public RecordOutcome markStale(K key, int txnIndex)
    {
        KeyHistory<V> history = tables.get(key);
        if (history == null)
            return RecordOutcome.NotFound;

        VersionRecord<V> record = history.get(PositionKey.fromReal(txnIndex));
        if (record == null)
            return RecordOutcome.NotFound;

        record.markStale();
        logger.trace("{}: marked record of {} stale", key, txnIndex);
        return RecordOutcome.Success;
    }

    /**
     * Remove the record of the transaction at {@code txnIndex}, once its latest incarnation no longer
     * reads or writes the key. Like {@link #markStale}, this touches only the key's history, which is
     * never replaced while the key is present.
     */
    public RecordOutcome delete(K key, int txnIndex)
    {
        KeyHistory<V> history = tables.get(key);
        if (history == null)
            return RecordOutcome.NotFound;

        if (history.remove(PositionKey.fromReal(txnIndex)) == null)
            return RecordOutcome.NotFound;

        logger.trace("{}: removed record of {}", key, txnIndex);
        return RecordOutcome.Success;
    }

    /**
     * What the transaction at {@code txnIndex} observes for the key, given the records of all lower
     * transactions present when the read runs. See {@link ReadResult} for the possible outcomes.
     */
    public ReadResult<V> read(K key, int txnIndex)
    {
        KeyHistory<V> history = tables.get(key);
        if (history == null)
            return ReadResult.notFound();
        return history.read(txnIndex);
    }

    /**
     * Compute, in transaction order, the value each delta produces when the chain is applied to
     * {@code baseValue}, then remove the key from the store. A write in the chain replaces the running
     * value; a base value recorded with {@link #setBaseValue} takes precedence over {@code baseValue}.
     * The key is left in place if the chain cannot be resolved.
     * <p>
     * Must be invoked once per key returned by {@link #takeDeltaKeys()}, after every transaction of the
     * block has been validated.
     *
     * @throws InvariantViolation if the key never carried a delta, or some delta cannot be resolved
     */
    public List<MaterializedDelta> materializeDeltas(K key, @Nullable Long baseValue)
    {
        KeyHistory<V> history = tables.get(key);
        if (history == null || !history.hasDelta())
            throw violation("Cannot materialize deltas of " + key + ", which never recorded a delta");

        ImmutableList.Builder<MaterializedDelta> materialized = ImmutableList.builder();
        Long running = baseValue;
        String source = "no base value";
        for (Map.Entry<PositionKey, VersionRecord<V>> e : history.ascending().entrySet())
        {
            PositionKey position = e.getKey();
            VersionRecord<V> record = e.getValue();
            if (Invariants.isParanoid() && record.isStale())
                throw violation("Stale record of " + position + " remains at commit of " + key);
            switch (record.kind())
            {
                default: throw new AssertionError("Unhandled kind: " + record.kind());
                case Write:
                    running = record.value().asNumber();
                    source = "a non-numeric write at " + position;
                    break;

                case Delta:
                {
                    int txnIndex = position.toReal();
                    if (running == null)
                        throw violation("Delta of transaction " + txnIndex + " on " + key + " follows " + source);
                    try
                    {
                        running = record.delta().applyTo(running);
                    }
                    catch (DeltaApplicationException ex)
                    {
                        throw violation("Delta of transaction " + txnIndex + " on " + key + " failed to apply at commit: " + ex.getMessage(), ex);
                    }
                    materialized.add(new MaterializedDelta(txnIndex, running));
                }
            }
        }

        List<MaterializedDelta> result = materialized.build();
        tables.remove(key, history);
        logger.debug("{}: materialized {} deltas from base {}", key, result.size(), baseValue);
        return result;
    }

    /**
     * Every key that has carried a delta since the last call, each exactly once.
     */
    public synchronized List<K> takeDeltaKeys()
    {
        List<K> taken = deltaKeys;
        deltaKeys = new ArrayList<>();
        logger.debug("Took {} delta keys", taken.size());
        return ImmutableList.copyOf(taken);
    }

    private synchronized void addDeltaKey(K key)
    {
        deltaKeys.add(key);
    }

    public boolean contains(K key)
    {
        return tables.containsKey(key);
    }

    public int keyCount()
    {
        return tables.size();
    }

    @VisibleForTesting
    @Nullable KeyHistory<V> history(K key)
    {
        return tables.get(key);
    }

    private static InvariantViolation violation(String message)
    {
        InvariantViolation violation = Invariants.illegalState(message);
        logger.error("Multi-version store invariant violated", violation);
        return violation;
    }

    private static InvariantViolation violation(String message, Throwable cause)
    {
        InvariantViolation violation = new InvariantViolation(message, cause);
        logger.error("Multi-version store invariant violated", violation);
        return violation;
    }
}
