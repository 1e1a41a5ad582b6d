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

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.rolegraph.exceptions.StoreTimeoutException;

/**
 * Keeps the committed state as an immutable sorted map which is swapped in atomically on
 * every commit, so snapshots are free and never block. Writers are serialized by a fair lock;
 * a transaction holds it from {@link #begin()} until it is committed or closed.
 */
public class InMemoryKeyValueStore implements KeyValueStore
{
    private static final Logger logger = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

    private static final Holder EMPTY = new Holder(ImmutableSortedMap.of(), 0);

    private final AtomicReference<Holder> data = new AtomicReference<>(EMPTY);
    private final ReentrantLock writeLock = new ReentrantLock(true);
    private final long lockTimeoutMillis;

    public InMemoryKeyValueStore(long lockTimeoutMillis)
    {
        this.lockTimeoutMillis = lockTimeoutMillis;
    }

    /**
     * @throws IllegalStateException if the calling thread already has a transaction open
     */
    public Transaction begin()
    {
        if (writeLock.isHeldByCurrentThread())
            throw new IllegalStateException("A transaction is already open on this thread; transactions cannot be nested");
        try
        {
            if (!writeLock.tryLock(lockTimeoutMillis, TimeUnit.MILLISECONDS))
                throw new StoreTimeoutException(String.format("Timed out after %dms waiting for write access",
                                                              lockTimeoutMillis));
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw new StoreTimeoutException("Interrupted waiting for write access", e);
        }
        return new InMemoryTransaction(data.get());
    }

    public ReadView snapshot()
    {
        return new SnapshotView(data.get());
    }

    public long generation()
    {
        return data.get().generation;
    }

    @VisibleForTesting
    int size()
    {
        return data.get().rows.size();
    }

    private static SortedMap<StoreKey, Object> prefixRange(SortedMap<StoreKey, ?> rows, StoreKey prefix)
    {
        SortedMap<StoreKey, Object> matching = new TreeMap<>();
        for (Map.Entry<StoreKey, ?> entry : rows.tailMap(prefix).entrySet())
        {
            if (!prefix.isPrefixOf(entry.getKey()))
                break;
            matching.put(entry.getKey(), entry.getValue());
        }
        return matching;
    }

    private static final class SnapshotView implements ReadView
    {
        private final Holder holder;

        private SnapshotView(Holder holder)
        {
            this.holder = holder;
        }

        public Object get(StoreKey key)
        {
            return holder.rows.get(key);
        }

        public SortedMap<StoreKey, Object> scan(StoreKey prefix)
        {
            return prefixRange(holder.rows, prefix);
        }

        public long generation()
        {
            return holder.generation;
        }
    }

    private final class InMemoryTransaction implements Transaction
    {
        private final Holder base;
        // pending writes; a null value is a deletion
        private final TreeMap<StoreKey, Object> writes = new TreeMap<>();
        private boolean done = false;

        private InMemoryTransaction(Holder base)
        {
            this.base = base;
        }

        public Object get(StoreKey key)
        {
            checkOpen();
            if (writes.containsKey(key))
                return writes.get(key);
            return base.rows.get(key);
        }

        public SortedMap<StoreKey, Object> scan(StoreKey prefix)
        {
            checkOpen();
            SortedMap<StoreKey, Object> merged = prefixRange(base.rows, prefix);
            for (Map.Entry<StoreKey, Object> write : prefixRange(writes, prefix).entrySet())
            {
                if (write.getValue() == null)
                    merged.remove(write.getKey());
                else
                    merged.put(write.getKey(), write.getValue());
            }
            return merged;
        }

        public long generation()
        {
            return base.generation;
        }

        public void put(StoreKey key, Object value)
        {
            checkOpen();
            Preconditions.checkNotNull(value, "null values cannot be stored, use delete");
            writes.put(key, value);
        }

        public void delete(StoreKey key)
        {
            checkOpen();
            writes.put(key, null);
        }

        public void commit()
        {
            checkOpen();
            try
            {
                if (!writes.isEmpty())
                {
                    TreeMap<StoreKey, Object> rows = new TreeMap<>(base.rows);
                    for (Map.Entry<StoreKey, Object> write : writes.entrySet())
                    {
                        if (write.getValue() == null)
                            rows.remove(write.getKey());
                        else
                            rows.put(write.getKey(), write.getValue());
                    }
                    Holder committed = new Holder(ImmutableSortedMap.copyOfSorted(rows), base.generation + 1);
                    // writers are serialized, nothing else can have moved the reference
                    if (!data.compareAndSet(base, committed))
                        throw new IllegalStateException("Committed state changed under the write lock");
                    logger.trace("Committed {} writes at generation {}", writes.size(), committed.generation);
                }
            }
            finally
            {
                release();
            }
        }

        public void close()
        {
            if (!done)
            {
                logger.trace("Discarding {} uncommitted writes", writes.size());
                release();
            }
        }

        private void release()
        {
            done = true;
            writes.clear();
            writeLock.unlock();
        }

        private void checkOpen()
        {
            Preconditions.checkState(!done, "transaction already completed");
        }
    }

    private static final class Holder
    {
        final ImmutableSortedMap<StoreKey, Object> rows;
        final long generation;

        Holder(ImmutableSortedMap<StoreKey, Object> rows, long generation)
        {
            this.rows = rows;
            this.generation = generation;
        }
    }
}
