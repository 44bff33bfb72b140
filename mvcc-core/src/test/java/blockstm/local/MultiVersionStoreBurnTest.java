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
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import blockstm.impl.TestValue;
import blockstm.primitives.DeltaOp;
import blockstm.primitives.MaterializedDelta;
import blockstm.primitives.Version;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Many threads execute and re-execute the transactions of a block against shared keys, in random order.
 */
public class MultiVersionStoreBurnTest
{
    private static final Logger logger = LoggerFactory.getLogger(MultiVersionStoreBurnTest.class);

    private static final int THREADS = 8;
    private static final int TXNS = 2000;
    private static final int KEYS = 16;
    private static final long LIMIT = Long.MAX_VALUE;

    private ExecutorService executor;

    @BeforeEach
    public void setUp()
    {
        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    public void tearDown() throws InterruptedException
    {
        executor.shutdownNow();
        assertThat(executor.awaitTermination(1, TimeUnit.MINUTES)).isTrue();
    }

    private static String key(int i)
    {
        return "key" + i;
    }

    // transactions divisible by 10 overwrite their key; all others increment it
    private static boolean writes(int txnIndex)
    {
        return txnIndex % 10 == 0;
    }

    @Test
    public void concurrentExecution() throws Exception
    {
        long seed = System.nanoTime();
        logger.info("Seed: {}", seed);
        Random random = new Random(seed);

        MultiVersionStore<String, TestValue> store = new MultiVersionStore<>();
        List<Integer> order = new ArrayList<>();
        for (int i = 0 ; i < TXNS ; ++i)
            order.add(i);
        Collections.shuffle(order, random);

        AtomicBoolean done = new AtomicBoolean();
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> readers = new ArrayList<>();
        for (int r = 0 ; r < 2 ; ++r)
        {
            long readerSeed = random.nextLong();
            readers.add(executor.submit(() -> {
                Random rs = new Random(readerSeed);
                start.await();
                while (!done.get())
                {
                    ReadResult<TestValue> read = store.read(key(rs.nextInt(KEYS)), rs.nextInt(TXNS + 1));
                    // increments never approach the limit, so every delta chain applies
                    assertThat(read.kind()).isNotEqualTo(ReadResult.Kind.DeltaApplicationFailure);
                }
                return null;
            }));
        }

        List<Future<?>> writers = new ArrayList<>();
        for (int txnIndex : order)
        {
            writers.add(executor.submit(() -> {
                start.await();
                execute(store, txnIndex, 0);
                // abort and re-execute
                assertThat(store.markStale(key(txnIndex % KEYS), txnIndex)).isEqualTo(RecordOutcome.Success);
                execute(store, txnIndex, 1);
                return null;
            }));
        }

        start.countDown();
        for (Future<?> writer : writers)
            writer.get(1, TimeUnit.MINUTES);
        done.set(true);
        for (Future<?> reader : readers)
            reader.get(1, TimeUnit.MINUTES);

        for (int k = 0 ; k < KEYS ; ++k)
            assertThat(store.read(key(k), TXNS)).isEqualTo(expectedFinalRead(k));

        List<String> deltaKeys = store.takeDeltaKeys();
        assertThat(deltaKeys).hasSize(KEYS).doesNotHaveDuplicates();
        for (String key : deltaKeys)
        {
            int k = Integer.parseInt(key.substring(3));
            List<MaterializedDelta> materialized = store.materializeDeltas(key, 0L);
            assertThat(materialized).isEqualTo(expectedMaterialized(k));
        }
        assertThat(store.keyCount()).isZero();
    }

    private static void execute(MultiVersionStore<String, TestValue> store, int txnIndex, int incarnation)
    {
        String key = key(txnIndex % KEYS);
        if (writes(txnIndex)) store.write(key, Version.of(txnIndex, incarnation), TestValue.of(txnIndex));
        else store.recordDelta(key, txnIndex, DeltaOp.add(incarnation + 1, LIMIT));
    }

    private static ReadResult<TestValue> expectedFinalRead(int k)
    {
        int lastWrite = -1;
        long increments = 0;
        for (int txnIndex = k ; txnIndex < TXNS ; txnIndex += KEYS)
        {
            if (writes(txnIndex)) { lastWrite = txnIndex; increments = 0; }
            else increments += 2;
        }
        if (lastWrite < 0)
            return ReadResult.unresolved(new DeltaOp(increments, LIMIT, increments, 0));
        if (increments == 0)
            return ReadResult.versioned(Version.of(lastWrite, 1), TestValue.of(lastWrite));
        return ReadResult.resolved(lastWrite + increments);
    }

    private static List<MaterializedDelta> expectedMaterialized(int k)
    {
        List<MaterializedDelta> expected = new ArrayList<>();
        long value = 0;
        for (int txnIndex = k ; txnIndex < TXNS ; txnIndex += KEYS)
        {
            if (writes(txnIndex)) value = txnIndex;
            else expected.add(new MaterializedDelta(txnIndex, value += 2));
        }
        return expected;
    }
}
