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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.junit.jupiter.api.Test;

import blockstm.impl.TestValue;
import blockstm.primitives.DeltaApplicationException;
import blockstm.primitives.DeltaOp;
import blockstm.primitives.Version;
import blockstm.utils.Gen;

import static blockstm.utils.Property.qt;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compares reads against a reference that applies every delta one at a time, in transaction order.
 */
public class MultiVersionStoreModelTest
{
    private static final long LIMIT = 40;
    private static final int TXNS = 12;
    private static final String[] KEYS = { "a", "b", "c" };

    private static class ModelRecord
    {
        final int incarnation;
        final TestValue value;
        final DeltaOp delta;
        boolean stale;

        ModelRecord(int incarnation, TestValue value, DeltaOp delta)
        {
            this.incarnation = incarnation;
            this.value = value;
            this.delta = delta;
        }
    }

    @Test
    public void readsMatchSequentialReference()
    {
        qt().withExamples(300).check(rs -> {
            MultiVersionStore<String, TestValue> store = new MultiVersionStore<>();
            Map<String, TreeMap<Integer, ModelRecord>> model = new HashMap<>();
            Map<String, Integer> incarnations = new HashMap<>();

            int operations = rs.nextInt(1, 60);
            for (int i = 0 ; i < operations ; ++i)
            {
                String key = KEYS[rs.nextInt(KEYS.length)];
                int txnIndex = rs.nextInt(TXNS);
                TreeMap<Integer, ModelRecord> history = model.computeIfAbsent(key, ignore -> new TreeMap<>());
                switch (rs.nextInt(6))
                {
                    default: throw new AssertionError();
                    case 0:
                    {
                        int incarnation = incarnations.merge(key + '/' + txnIndex, 1, Integer::sum);
                        TestValue value = rs.nextInt(4) == 0 ? TestValue.DELETION : TestValue.of(rs.nextLong(0, LIMIT + 1));
                        store.write(key, Version.of(txnIndex, incarnation), value);
                        history.put(txnIndex, new ModelRecord(incarnation, value, null));
                        break;
                    }
                    case 1:
                    case 2:
                    {
                        DeltaOp delta = randomDelta(rs);
                        store.recordDelta(key, txnIndex, delta);
                        history.put(txnIndex, new ModelRecord(-1, null, delta));
                        break;
                    }
                    case 3:
                    {
                        RecordOutcome outcome = store.markStale(key, txnIndex);
                        ModelRecord record = history.get(txnIndex);
                        assertThat(outcome).isEqualTo(record == null ? RecordOutcome.NotFound : RecordOutcome.Success);
                        if (record != null)
                            record.stale = true;
                        break;
                    }
                    case 4:
                    {
                        RecordOutcome outcome = store.delete(key, txnIndex);
                        assertThat(outcome).isEqualTo(history.remove(txnIndex) == null ? RecordOutcome.NotFound : RecordOutcome.Success);
                        break;
                    }
                    case 5:
                        check(store.read(key, txnIndex), history, txnIndex);
                }
            }

            for (String key : KEYS)
                for (int txnIndex = 0 ; txnIndex <= TXNS ; ++txnIndex)
                    check(store.read(key, txnIndex), model.getOrDefault(key, new TreeMap<>()), txnIndex);
        });
    }

    private static DeltaOp randomDelta(Gen.Random rs)
    {
        long amount = rs.nextLong(0, LIMIT / 2);
        return rs.nextBoolean() ? DeltaOp.add(amount, LIMIT) : DeltaOp.sub(amount, LIMIT);
    }

    private static void check(ReadResult<TestValue> actual, TreeMap<Integer, ModelRecord> history, int txnIndex)
    {
        List<DeltaOp> deltas = new ArrayList<>();
        for (Map.Entry<Integer, ModelRecord> e : history.headMap(txnIndex, false).descendingMap().entrySet())
        {
            ModelRecord record = e.getValue();
            if (record.stale)
            {
                assertThat(actual).isEqualTo(ReadResult.dependency(e.getKey()));
                return;
            }
            if (record.delta != null)
            {
                deltas.add(0, record.delta);
                continue;
            }

            Version version = Version.of(e.getKey(), record.incarnation);
            Long base = record.value.asNumber();
            if (deltas.isEmpty() || base == null)
            {
                assertThat(actual).isEqualTo(ReadResult.versioned(version, record.value));
                return;
            }

            Long expected = applySequentially(deltas, base);
            assertThat(actual).isEqualTo(expected == null ? ReadResult.deltaApplicationFailure() : ReadResult.resolved(expected));
            return;
        }

        if (deltas.isEmpty())
        {
            assertThat(actual).isEqualTo(ReadResult.notFound());
            return;
        }

        switch (actual.kind())
        {
            default: throw new AssertionError("Unexpected read " + actual + " over deltas " + deltas);
            case Unresolved:
                for (long base = 0 ; base <= LIMIT ; ++base)
                    assertThat(applyOrNull(actual.unresolved(), base)).isEqualTo(applySequentially(deltas, base));
                break;
            case DeltaApplicationFailure:
                for (long base = 0 ; base <= LIMIT ; ++base)
                    assertThat(applySequentially(deltas, base)).isNull();
        }
    }

    private static Long applyOrNull(DeltaOp delta, long base)
    {
        try
        {
            return delta.applyTo(base);
        }
        catch (DeltaApplicationException e)
        {
            return null;
        }
    }

    private static Long applySequentially(List<DeltaOp> deltas, long base)
    {
        Long value = base;
        for (DeltaOp delta : deltas)
        {
            value = applyOrNull(delta, value);
            if (value == null)
                return null;
        }
        return value;
    }
}
