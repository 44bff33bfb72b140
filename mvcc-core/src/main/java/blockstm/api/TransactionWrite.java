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

import javax.annotation.Nullable;

/**
 * A value produced by executing a transaction, as recorded in the multi-version store.
 * Instances are shared between every reader that observes the write and must be immutable.
 */
public interface TransactionWrite
{
    /**
     * The numeric interpretation of this write, used as the base that delta operations apply to.
     *
     * @return the value, in the unsigned range [0, Long.MAX_VALUE], or null if the write is a logical deletion
     */
    @Nullable Long asNumber();

    default boolean isDeletion()
    {
        return asNumber() == null;
    }
}
