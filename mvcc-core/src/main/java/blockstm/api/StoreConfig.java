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

package blockstm.api;

/**
 * Sizing of a per-block multi-version store. Implementations override only what they need;
 * the defaults may be adjusted process-wide through system properties.
 */
public interface StoreConfig
{
    StoreConfig DEFAULT = new StoreConfig() {};

    // Expected number of distinct keys touched by a block
    default int initialCapacity()
    {
        return Properties.initialCapacity();
    }

    // Estimated number of worker threads mutating the store concurrently
    default int concurrencyLevel()
    {
        return Properties.concurrencyLevel();
    }

    class Properties
    {
        public static final String INITIAL_CAPACITY = "blockstm.store.initialCapacity";
        public static final String CONCURRENCY_LEVEL = "blockstm.store.concurrencyLevel";
        public static final String PARANOID = "blockstm.paranoid";

        private Properties() {}

        static int initialCapacity()
        {
            return positiveInt(INITIAL_CAPACITY, 1024);
        }

        static int concurrencyLevel()
        {
            return positiveInt(CONCURRENCY_LEVEL, Runtime.getRuntime().availableProcessors());
        }

        public static boolean paranoid()
        {
            return Boolean.parseBoolean(System.getProperty(PARANOID, "true"));
        }

        private static int positiveInt(String property, int defaultValue)
        {
            String value = System.getProperty(property);
            if (value == null)
                return defaultValue;

            int parsed;
            try
            {
                parsed = Integer.parseInt(value.trim());
            }
            catch (NumberFormatException e)
            {
                throw new IllegalArgumentException("Invalid value for " + property + ": '" + value + '\'', e);
            }
            if (parsed <= 0)
                throw new IllegalArgumentException(property + " must be positive; found " + parsed);
            return parsed;
        }
    }
}
