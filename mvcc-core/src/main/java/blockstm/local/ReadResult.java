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

import java.util.Objects;
import javax.annotation.Nullable;

import blockstm.api.TransactionWrite;
import blockstm.primitives.DeltaOp;
import blockstm.primitives.Version;
import blockstm.utils.Invariants;

/**
 * What a transaction observes when reading a key from the multi-version store.
 * <p>
 * Only {@link Kind#Resolved} and {@link Kind#Versioned} carry a value. The remaining kinds are ordinary
 * outcomes of speculative execution that the caller is expected to handle:
 * <ul>
 *     <li>{@link Kind#NotFound}: nothing below the reader; fall back to the pre-block state</li>
 *     <li>{@link Kind#Dependency}: a stale record was encountered; retry once {@link #dependency()} re-executes</li>
 *     <li>{@link Kind#Unresolved}: only deltas were found; apply {@link #unresolved()} to the pre-block value</li>
 *     <li>{@link Kind#DeltaApplicationFailure}: the deltas overflow, underflow or mix domains; fail the transaction</li>
 * </ul>
 */
public final class ReadResult<V extends TransactionWrite>
{
    public enum Kind { Resolved, Versioned, NotFound, Dependency, Unresolved, DeltaApplicationFailure }

    @SuppressWarnings("rawtypes")
    private static final ReadResult NOT_FOUND = new ReadResult<>(Kind.NotFound, 0, null, null, -1, null);
    @SuppressWarnings("rawtypes")
    private static final ReadResult DELTA_APPLICATION_FAILURE = new ReadResult<>(Kind.DeltaApplicationFailure, 0, null, null, -1, null);

    private final Kind kind;
    private final long resolved;
    @Nullable private final Version version;
    @Nullable private final V value;
    private final int dependency;
    @Nullable private final DeltaOp unresolved;

    private ReadResult(Kind kind, long resolved, @Nullable Version version, @Nullable V value, int dependency, @Nullable DeltaOp unresolved)
    {
        this.kind = kind;
        this.resolved = resolved;
        this.version = version;
        this.value = value;
        this.dependency = dependency;
        this.unresolved = unresolved;
    }

    public static <V extends TransactionWrite> ReadResult<V> resolved(long value)
    {
        return new ReadResult<>(Kind.Resolved, value, null, null, -1, null);
    }

    public static <V extends TransactionWrite> ReadResult<V> versioned(Version version, V value)
    {
        return new ReadResult<>(Kind.Versioned, 0, Invariants.nonNull(version), Invariants.nonNull(value), -1, null);
    }

    public static <V extends TransactionWrite> ReadResult<V> dependency(int txnIndex)
    {
        return new ReadResult<>(Kind.Dependency, 0, null, null, Invariants.isNatural(txnIndex), null);
    }

    public static <V extends TransactionWrite> ReadResult<V> unresolved(DeltaOp accumulated)
    {
        return new ReadResult<>(Kind.Unresolved, 0, null, null, -1, Invariants.nonNull(accumulated));
    }

    @SuppressWarnings("unchecked")
    public static <V extends TransactionWrite> ReadResult<V> notFound()
    {
        return (ReadResult<V>) NOT_FOUND;
    }

    @SuppressWarnings("unchecked")
    public static <V extends TransactionWrite> ReadResult<V> deltaApplicationFailure()
    {
        return (ReadResult<V>) DELTA_APPLICATION_FAILURE;
    }

    public Kind kind()
    {
        return kind;
    }

    public long resolved()
    {
        checkKind(Kind.Resolved);
        return resolved;
    }

    public Version version()
    {
        checkKind(Kind.Versioned);
        return version;
    }

    public V value()
    {
        checkKind(Kind.Versioned);
        return value;
    }

    public int dependency()
    {
        checkKind(Kind.Dependency);
        return dependency;
    }

    public DeltaOp unresolved()
    {
        checkKind(Kind.Unresolved);
        return unresolved;
    }

    private void checkKind(Kind expected)
    {
        Invariants.checkState(kind == expected, "Expected a %s read; found %s", expected, kind);
    }

    @Override
    public boolean equals(Object that)
    {
        if (this == that) return true;
        if (!(that instanceof ReadResult)) return false;
        ReadResult<?> read = (ReadResult<?>) that;
        return kind == read.kind && resolved == read.resolved && dependency == read.dependency
               && Objects.equals(version, read.version) && Objects.equals(value, read.value)
               && Objects.equals(unresolved, read.unresolved);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(kind, resolved, version, value, dependency, unresolved);
    }

    @Override
    public String toString()
    {
        switch (kind)
        {
            default: throw new AssertionError("Unhandled kind: " + kind);
            case Resolved: return "Resolved(" + resolved + ')';
            case Versioned: return "Versioned(" + version + ", " + value + ')';
            case Dependency: return "Dependency(" + dependency + ')';
            case Unresolved: return "Unresolved(" + unresolved + ')';
            case NotFound:
            case DeltaApplicationFailure:
                return kind.name();
        }
    }
}
