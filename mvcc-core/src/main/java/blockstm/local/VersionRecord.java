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

import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import javax.annotation.Nullable;

import blockstm.api.TransactionWrite;
import blockstm.primitives.DeltaOp;
import blockstm.utils.Invariants;

/**
 * The single entry a transaction holds in the version history of one key: either a write tagged with the
 * incarnation that produced it, or a delta. The payload is immutable; a re-execution replaces the record.
 * Only the freshness flag changes in place, so that the scheduler can invalidate a record without
 * contending with readers of its payload.
 */
public final class VersionRecord<V extends TransactionWrite>
{
    public enum Kind { Write, Delta }

    private static final int FRESH = 0, STALE = 1;
    @SuppressWarnings("rawtypes")
    private static final AtomicIntegerFieldUpdater<VersionRecord> freshnessUpdater = AtomicIntegerFieldUpdater.newUpdater(VersionRecord.class, "freshness");

    private final Kind kind;
    private final int incarnation;
    @Nullable private final V value;
    @Nullable private final DeltaOp delta;
    private volatile int freshness = FRESH;

    private VersionRecord(Kind kind, int incarnation, @Nullable V value, @Nullable DeltaOp delta)
    {
        this.kind = kind;
        this.incarnation = incarnation;
        this.value = value;
        this.delta = delta;
    }

    public static <V extends TransactionWrite> VersionRecord<V> write(int incarnation, V value)
    {
        return new VersionRecord<>(Kind.Write, Invariants.isNatural(incarnation), Invariants.nonNull(value), null);
    }

    public static <V extends TransactionWrite> VersionRecord<V> delta(DeltaOp delta)
    {
        return new VersionRecord<>(Kind.Delta, -1, null, Invariants.nonNull(delta));
    }

    public Kind kind()
    {
        return kind;
    }

    public int incarnation()
    {
        Invariants.checkState(kind == Kind.Write, "Delta records carry no incarnation");
        return incarnation;
    }

    public V value()
    {
        Invariants.checkState(kind == Kind.Write, "Delta records carry no value");
        return value;
    }

    public DeltaOp delta()
    {
        Invariants.checkState(kind == Kind.Delta, "Write records carry no delta");
        return delta;
    }

    public boolean isStale()
    {
        return freshness == STALE;
    }

    void markStale()
    {
        freshnessUpdater.set(this, STALE);
    }

    @Override
    public String toString()
    {
        String payload;
        switch (kind)
        {
            default: throw new AssertionError("Unhandled kind: " + kind);
            case Write: payload = "Write(" + incarnation + ", " + value + ')'; break;
            case Delta: payload = "Delta(" + delta + ')'; break;
        }
        return isStale() ? payload + "[stale]" : payload;
    }
}
