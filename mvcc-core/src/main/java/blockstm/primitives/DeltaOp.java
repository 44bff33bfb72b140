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
 * A composable change to a bounded unsigned counter, recorded in place of a concrete value so that
 * transactions incrementing or decrementing the same counter do not have to observe one another.
 * <p>
 * Values live in {@code [0, limit]}. Besides the net {@link #update()} a delta remembers the largest
 * excursion it made above and below its starting point. Applying it to a base validates every
 * intermediate value, so a chain of merged deltas fails exactly when applying its parts one after
 * another would have failed.
 */
public final class DeltaOp
{
    private final long update;
    private final long limit;
    private final long maxPositive;
    private final long maxNegative;

    public DeltaOp(long update, long limit, long maxPositive, long maxNegative)
    {
        Invariants.isNatural(limit);
        Invariants.checkArgument(maxPositive >= 0 && maxPositive <= limit, "Positive history out of range");
        Invariants.checkArgument(maxNegative >= 0 && maxNegative <= limit, "Negative history out of range");
        Invariants.checkArgument(update <= maxPositive && update >= -maxNegative, "Update outside recorded history");
        this.update = update;
        this.limit = limit;
        this.maxPositive = maxPositive;
        this.maxNegative = maxNegative;
    }

    public static DeltaOp add(long value, long limit)
    {
        Invariants.checkArgument(value >= 0 && value <= limit, "Cannot add " + value + " with limit " + limit);
        return new DeltaOp(value, limit, value, 0);
    }

    public static DeltaOp sub(long value, long limit)
    {
        Invariants.checkArgument(value >= 0 && value <= limit, "Cannot subtract " + value + " with limit " + limit);
        return new DeltaOp(-value, limit, 0, value);
    }

    public long update()
    {
        return update;
    }

    public long limit()
    {
        return limit;
    }

    public long maxPositive()
    {
        return maxPositive;
    }

    public long maxNegative()
    {
        return maxNegative;
    }

    /**
     * @return the value after applying this delta to {@code base}
     * @throws DeltaApplicationException if the base is outside the domain, or any intermediate value
     *         would exceed the limit or drop below zero
     */
    public long applyTo(long base) throws DeltaApplicationException
    {
        if (base < 0 || base > limit)
            throw new DeltaApplicationException("Base value " + base + " outside [0, " + limit + ']');
        if (maxPositive > limit - base)
            throw new DeltaApplicationException("Overflow applying " + this + " to " + base);
        if (maxNegative > base)
            throw new DeltaApplicationException("Underflow applying " + this + " to " + base);
        return base + update;
    }

    /**
     * Composes {@code previous} (applied first) with this delta (applied second).
     *
     * @throws DeltaApplicationException if the limits differ, or no base value could satisfy both histories
     */
    public DeltaOp mergeWithPrevious(DeltaOp previous) throws DeltaApplicationException
    {
        if (previous.limit != limit)
            throw new DeltaApplicationException("Cannot merge deltas with limits " + previous.limit + " and " + limit);

        long highest, lowest, merged;
        try
        {
            highest = Math.max(previous.maxPositive, Math.addExact(previous.update, maxPositive));
            lowest = Math.max(previous.maxNegative, Math.subtractExact(maxNegative, previous.update));
            merged = Math.addExact(previous.update, update);
        }
        catch (ArithmeticException e)
        {
            throw new DeltaApplicationException("Overflow merging " + previous + " with " + this);
        }

        if (highest > limit)
            throw new DeltaApplicationException("Overflow merging " + previous + " with " + this);
        if (lowest > limit)
            throw new DeltaApplicationException("Underflow merging " + previous + " with " + this);
        // a base must leave room for the highest excursion while covering the lowest
        if (highest > limit - lowest)
            throw new DeltaApplicationException("No base in [0, " + limit + "] can apply " + previous + " followed by " + this);
        return new DeltaOp(merged, limit, highest, lowest);
    }

    @Override
    public boolean equals(Object that)
    {
        if (this == that) return true;
        if (!(that instanceof DeltaOp)) return false;
        DeltaOp op = (DeltaOp) that;
        return update == op.update && limit == op.limit && maxPositive == op.maxPositive && maxNegative == op.maxNegative;
    }

    @Override
    public int hashCode()
    {
        return Long.hashCode(update) * 31 * 31 * 31 + Long.hashCode(limit) * 31 * 31 + Long.hashCode(maxPositive) * 31 + Long.hashCode(maxNegative);
    }

    @Override
    public String toString()
    {
        return (update >= 0 ? "+" : "") + update + "{limit=" + limit + ", history=[+" + maxPositive + ", -" + maxNegative + "]}";
    }
}
