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
package org.rolegraph.store;

/**
 * Arena id allocation. Sequences are ordinary rows, so an id handed out by a transaction that
 * is later discarded is simply reused by the next one.
 */
public final class Sequences
{
    private Sequences()
    {
    }

    public static long next(Transaction txn, String sequence, long firstValue)
    {
        StoreKey key = StoreKey.of(EntityType.SEQUENCE, sequence);
        Long last = (Long) txn.get(key);
        long next = last == null ? firstValue : last + 1;
        txn.put(key, next);
        return next;
    }
}
