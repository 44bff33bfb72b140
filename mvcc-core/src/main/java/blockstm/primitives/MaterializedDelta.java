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

/**
 * The concrete counter value a delta-recording transaction observes once its block commits.
 */
public final class MaterializedDelta
{
    public final int txnIndex;
    public final long value;

    public MaterializedDelta(int txnIndex, long value)
    {
        this.txnIndex = txnIndex;
        this.value = value;
    }

    @Override
    public boolean equals(Object that)
    {
        if (this == that) return true;
        if (!(that instanceof MaterializedDelta)) return false;
        MaterializedDelta delta = (MaterializedDelta) that;
        return txnIndex == delta.txnIndex && value == delta.value;
    }

    @Override
    public int hashCode()
    {
        return txnIndex * 31 + Long.hashCode(value);
    }

    @Override
    public String toString()
    {
        return "(" + txnIndex + ", " + value + ')';
    }
}
