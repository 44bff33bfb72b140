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

import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import javax.annotation.Nullable;

import blockstm.api.TransactionWrite;
import blockstm.primitives.DeltaApplicationException;
import blockstm.primitives.DeltaOp;
import blockstm.primitives.PositionKey;
import blockstm.primitives.Version;

/**
 * The versions of one key, ordered by the position of the transaction that produced them.
 * <p>
 * Records are added by {@link MultiVersionStore} while it holds the key's map entry, so insertions are
 * serialized per key. Removals and staleness flags go straight to the skip list. Readers scan without
 * the entry lock and see each record as of the moment they visit it.
 */
public class KeyHistory<V extends TransactionWrite>
{
    private final ConcurrentSkipListMap<PositionKey, VersionRecord<V>> versions = new ConcurrentSkipListMap<>();
    private volatile boolean hasDelta;

    @Nullable VersionRecord<V> get(PositionKey position)
    {
        return versions.get(position);
    }

    @Nullable VersionRecord<V> put(PositionKey position, VersionRecord<V> record)
    {
        return versions.put(position, record);
    }

    @Nullable VersionRecord<V> putIfAbsent(PositionKey position, VersionRecord<V> record)
    {
        return versions.putIfAbsent(position, record);
    }

    @Nullable VersionRecord<V> remove(PositionKey position)
    {
        return versions.remove(position);
    }

    /**
     * @return true if this is the first delta recorded for the key
     */
    boolean markHasDelta()
    {
        if (hasDelta)
            return false;
        hasDelta = true;
        return true;
    }

    public boolean hasDelta()
    {
        return hasDelta;
    }

    public int size()
    {
        return versions.size();
    }

    NavigableMap<PositionKey, VersionRecord<V>> ascending()
    {
        return versions;
    }

    /**
     * Resolve what the transaction at {@code txnIndex} observes, considering only records of lower positions.
     * Walks down from the reader, accumulating deltas until a write resolves them. A failure to merge two
     * deltas does not end the walk: if a deletion is found below, the deletion is what the reader sees.
     */
    ReadResult<V> read(int txnIndex)
    {
        DeltaOp accumulator = null;
        boolean mergeFailed = false;

        NavigableMap<PositionKey, VersionRecord<V>> below = versions.headMap(PositionKey.fromReal(txnIndex), false);
        for (Map.Entry<PositionKey, VersionRecord<V>> e : below.descendingMap().entrySet())
        {
            PositionKey position = e.getKey();
            VersionRecord<V> record = e.getValue();
            if (record.isStale())
                return ReadResult.dependency(position.toReal());

            switch (record.kind())
            {
                default: throw new AssertionError("Unhandled kind: " + record.kind());
                case Write:
                {
                    Version version = position.version(record.incarnation());
                    if (accumulator == null)
                        return ReadResult.versioned(version, record.value());

                    Long base = record.value().asNumber();
                    if (base == null)
                        return ReadResult.versioned(version, record.value());

                    if (mergeFailed)
                        return ReadResult.deltaApplicationFailure();

                    try
                    {
                        return ReadResult.resolved(accumulator.applyTo(base));
                    }
                    catch (DeltaApplicationException ignore)
                    {
                        return ReadResult.deltaApplicationFailure();
                    }
                }
                case Delta:
                {
                    if (accumulator == null)
                    {
                        accumulator = record.delta();
                    }
                    else if (!mergeFailed)
                    {
                        try
                        {
                            accumulator = accumulator.mergeWithPrevious(record.delta());
                        }
                        catch (DeltaApplicationException ignore)
                        {
                            mergeFailed = true;
                        }
                    }
                }
            }
        }

        if (accumulator == null)
            return ReadResult.notFound();
        return mergeFailed ? ReadResult.deltaApplicationFailure() : ReadResult.unresolved(accumulator);
    }

    @Override
    public String toString()
    {
        return (hasDelta ? "KeyHistory[delta]" : "KeyHistory") + versions;
    }
}
