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

package blockstm.utils;

import net.nicoulaj.compilecommand.annotations.Inline;

import blockstm.api.StoreConfig;

public class Invariants
{
    private static final boolean PARANOID = StoreConfig.Properties.paranoid();

    public static boolean isParanoid()
    {
        return PARANOID;
    }

    public static void checkState(boolean condition)
    {
        if (!condition)
            throw new InvariantViolation("Invariant violated");
    }

    @Inline
    public static void checkState(boolean condition, String msg)
    {
        if (!condition)
            throw new InvariantViolation(msg);
    }

    public static void checkState(boolean condition, String fmt, Object arg)
    {
        if (!condition)
            throw new InvariantViolation(String.format(fmt, arg));
    }

    public static void checkState(boolean condition, String fmt, Object arg1, Object arg2)
    {
        if (!condition)
            throw new InvariantViolation(String.format(fmt, arg1, arg2));
    }

    public static InvariantViolation illegalState(String msg)
    {
        return new InvariantViolation(msg);
    }

    public static <T> T nonNull(T param)
    {
        if (param == null)
            throw new NullPointerException();
        return param;
    }

    public static <T> T nonNull(T param, String msg)
    {
        if (param == null)
            throw new NullPointerException(msg);
        return param;
    }

    @Inline
    public static int isNatural(int input)
    {
        if (input < 0)
            throw new IllegalArgumentException(input + " is negative");
        return input;
    }

    public static long isNatural(long input)
    {
        if (input < 0)
            throw new IllegalArgumentException(input + " is negative");
        return input;
    }

    public static void checkArgument(boolean condition)
    {
        if (!condition)
            throw new IllegalArgumentException();
    }

    public static void checkArgument(boolean condition, String msg)
    {
        if (!condition)
            throw new IllegalArgumentException(msg);
    }
}
