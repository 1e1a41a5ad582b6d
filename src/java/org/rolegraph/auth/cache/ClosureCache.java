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
package org.rolegraph.auth.cache;

import java.util.function.Supplier;

import com.codahale.metrics.Timer;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Objects;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.rolegraph.auth.RoleId;
import org.rolegraph.auth.Scope;
import org.rolegraph.auth.membership.Traversal;
import org.rolegraph.metrics.ClosureCacheMetrics;
import org.rolegraph.store.ReadView;

/**
 * Caches membership closures computed from committed snapshots. Each entry remembers the store
 * generation it was computed from and is only served to readers of that same generation; any
 * commit makes every entry stale, and stale entries are recomputed on their next use.
 *
 * Views of an open transaction must never be passed here, as they include uncommitted writes
 * while reporting the generation they started from.
 */
public class ClosureCache
{
    private static final Logger logger = LoggerFactory.getLogger(ClosureCache.class);

    private final Cache<Key, Entry> cache;
    private final ClosureCacheMetrics metrics;

    public ClosureCache(String identifier, long maxEntries)
    {
        this.cache = CacheBuilder.newBuilder().maximumSize(maxEntries).build();
        this.metrics = new ClosureCacheMetrics(identifier);
    }

    public ImmutableSet<RoleId> get(ReadView snapshot,
                                    RoleId root,
                                    Scope scope,
                                    Traversal traversal,
                                    Supplier<ImmutableSet<RoleId>> loader)
    {
        Key key = new Key(root, scope, traversal);
        long generation = snapshot.generation();
        Entry entry = cache.getIfPresent(key);
        if (entry != null && entry.generation == generation)
        {
            metrics.hits.mark();
            return entry.roles;
        }

        if (entry != null)
            metrics.staleEntries.mark();
        metrics.misses.mark();

        ImmutableSet<RoleId> roles;
        try (Timer.Context ctx = metrics.computeLatency.time())
        {
            roles = loader.get();
        }

        // never replace an entry computed from a newer generation
        Entry current = cache.getIfPresent(key);
        if (current == null || current.generation <= generation)
            cache.put(key, new Entry(generation, roles));
        logger.trace("Computed {} closure of {} in {} at generation {}: {}", traversal, root, scope, generation, roles);
        return roles;
    }

    public void invalidateAll()
    {
        cache.invalidateAll();
    }

    @VisibleForTesting
    long size()
    {
        return cache.size();
    }

    private static final class Entry
    {
        private final long generation;
        private final ImmutableSet<RoleId> roles;

        private Entry(long generation, ImmutableSet<RoleId> roles)
        {
            this.generation = generation;
            this.roles = roles;
        }
    }

    private static final class Key
    {
        private final RoleId root;
        private final Scope scope;
        private final Traversal traversal;

        private Key(RoleId root, Scope scope, Traversal traversal)
        {
            this.root = root;
            this.scope = scope;
            this.traversal = traversal;
        }

        public boolean equals(Object o)
        {
            if (this == o)
                return true;

            if (!(o instanceof Key))
                return false;

            Key k = (Key) o;
            return Objects.equal(root, k.root) && Objects.equal(scope, k.scope) && traversal == k.traversal;
        }

        public int hashCode()
        {
            return Objects.hashCode(root, scope, traversal);
        }
    }
}
