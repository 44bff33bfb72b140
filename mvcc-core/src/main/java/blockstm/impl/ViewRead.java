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

import java.util.Objects;
import javax.annotation.Nullable;

import blockstm.api.TransactionWrite;
import blockstm.primitives.Version;
import blockstm.utils.Invariants;

/**
 * A read served to an executing transaction once the pre-block state has been consulted.
 */
public final class ViewRead<V extends TransactionWrite>
{
    public enum Kind
    {
        /** a write, by a lower transaction or from storage */
        Value,
        /** a counter resolved from deltas */
        Number,
        /** the key exists neither in the block nor in storage */
        Absent,
        /** the read crossed a stale record; re-execute once {@link #dependency()} does */
        Dependency,
        /** the value cannot be computed in this speculative execution; the transaction should fail */
        SpeculativeFailure
    }

    @SuppressWarnings("rawtypes")
    private static final ViewRead ABSENT = new ViewRead<>(Kind.Absent, null, null, 0, -1);
    @SuppressWarnings("rawtypes")
    private static final ViewRead SPECULATIVE_FAILURE = new ViewRead<>(Kind.SpeculativeFailure, null, null, 0, -1);

    private final Kind kind;
    @Nullable private final Version version;
    @Nullable private final V value;
    private final long number;
    private final int dependency;

    private ViewRead(Kind kind, @Nullable Version version, @Nullable V value, long number, int dependency)
    {
        this.kind = kind;
        this.version = version;
        this.value = value;
        this.number = number;
        this.dependency = dependency;
    }

    static <V extends TransactionWrite> ViewRead<V> value(Version version, V value)
    {
        return new ViewRead<>(Kind.Value, version, value, 0, -1);
    }

    static <V extends TransactionWrite> ViewRead<V> number(long number)
    {
        return new ViewRead<>(Kind.Number, null, null, number, -1);
    }

    static <V extends TransactionWrite> ViewRead<V> dependency(int txnIndex)
    {
        return new ViewRead<>(Kind.Dependency, null, null, 0, txnIndex);
    }

    @SuppressWarnings("unchecked")
    static <V extends TransactionWrite> ViewRead<V> absent()
    {
        return (ViewRead<V>) ABSENT;
    }

    @SuppressWarnings("unchecked")
    static <V extends TransactionWrite> ViewRead<V> speculativeFailure()
    {
        return (ViewRead<V>) SPECULATIVE_FAILURE;
    }

    public Kind kind()
    {
        return kind;
    }

    public Version version()
    {
        Invariants.checkState(kind == Kind.Value, "No version for %s", kind);
        return version;
    }

    public V value()
    {
        Invariants.checkState(kind == Kind.Value, "No value for %s", kind);
        return value;
    }

    public long number()
    {
        Invariants.checkState(kind == Kind.Number, "No number for %s", kind);
        return number;
    }

    public int dependency()
    {
        Invariants.checkState(kind == Kind.Dependency, "No dependency for %s", kind);
        return dependency;
    }

    @Override
    public boolean equals(Object that)
    {
        if (this == that) return true;
        if (!(that instanceof ViewRead)) return false;
        ViewRead<?> read = (ViewRead<?>) that;
        return kind == read.kind && number == read.number && dependency == read.dependency
               && Objects.equals(version, read.version) && Objects.equals(value, read.value);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(kind, version, value, number, dependency);
    }

    @Override
    public String toString()
    {
        switch (kind)
        {
            default: throw new AssertionError("Unhandled kind: " + kind);
            case Value: return "Value(" + version + ", " + value + ')';
            case Number: return "Number(" + number + ')';
            case Dependency: return "Dependency(" + dependency + ')';
            case Absent:
            case SpeculativeFailure:
                return kind.name();
        }
    }
}
