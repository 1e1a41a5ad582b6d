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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maintains a primary table of records keyed by arena id, together with any number of reverse
 * lookup tables pointing back at it.
 *
 * Roles, membership edges and privilege grants are all stored the same way: the record itself
 * lives under (primary type, id) and every way of finding it again (by name, by member, by
 * grantor, by the grant it depends on, ...) is an index row whose key is the lookup columns
 * followed by whatever makes it unique, and whose value is the id. For example membership
 * edges are indexed as
 *
 *   EDGE            [edge id]                              -> edge
 *   EDGE_BY_MEMBER  [member, granted, scope, grantor]      -> edge id
 *   EDGE_BY_PARENT  [parent edge id, edge id]              -> edge id
 *
 * This class keeps those index rows in step with the primary rows, always within the caller's
 * transaction, so a record and its index entries commit or vanish together.
 *
 * @param <T> the type of record held in the primary table
 */
public class LookupTableSupport<T>
{
    private static final Logger logger = LoggerFactory.getLogger(LookupTableSupport.class);

    private final EntityType primaryTable;
    private final Function<T, Long> idOf;
    private final ImmutableMap<EntityType, Function<T, List<String>>> indexes;

    private LookupTableSupport(EntityType primaryTable,
                               Function<T, Long> idOf,
                               ImmutableMap<EntityType, Function<T, List<String>>> indexes)
    {
        this.primaryTable = primaryTable;
        this.idOf = idOf;
        this.indexes = indexes;
    }

    public static <T> Builder<T> builder(EntityType primaryTable, Function<T, Long> idOf)
    {
        return new Builder<>(primaryTable, idOf);
    }

    public T get(ReadView view, long id)
    {
        return cast(view.get(primaryKey(id)));
    }

    public void insert(Transaction txn, T row)
    {
        long id = idOf.apply(row);
        txn.put(primaryKey(id), row);
        for (Map.Entry<EntityType, Function<T, List<String>>> index : indexes.entrySet())
            txn.put(indexKey(index.getKey(), index.getValue(), row), id);
    }

    /**
     * Replaces a row, moving any index entries whose key columns changed.
     */
    public void update(Transaction txn, T previous, T updated)
    {
        long id = idOf.apply(updated);
        assert id == idOf.apply(previous) : "update must not change the row id";
        txn.put(primaryKey(id), updated);
        for (Map.Entry<EntityType, Function<T, List<String>>> index : indexes.entrySet())
        {
            StoreKey before = indexKey(index.getKey(), index.getValue(), previous);
            StoreKey after = indexKey(index.getKey(), index.getValue(), updated);
            if (!before.equals(after))
            {
                txn.delete(before);
                txn.put(after, id);
            }
        }
    }

    public void delete(Transaction txn, T row)
    {
        txn.delete(primaryKey(idOf.apply(row)));
        for (Map.Entry<EntityType, Function<T, List<String>>> index : indexes.entrySet())
            txn.delete(indexKey(index.getKey(), index.getValue(), row));
    }

    /**
     * @return every row reachable through the named index whose lookup columns start with the
     * supplied values, in index order.
     */
    public List<T> lookup(ReadView view, EntityType index, String... prefix)
    {
        return lookup(view, index, Arrays.asList(prefix));
    }

    public List<T> lookup(ReadView view, EntityType index, List<String> prefix)
    {
        assert indexes.containsKey(index) : String.format("%s is not an index of %s", index, primaryTable);
        List<T> rows = new ArrayList<>();
        for (Object id : view.scan(StoreKey.of(index, prefix)).values())
        {
            T row = get(view, (Long) id);
            if (row == null)
            {
                // index entries are only ever written alongside their primary row
                logger.warn("Dangling {} entry for {} id {}", index, primaryTable, id);
                continue;
            }
            rows.add(row);
        }
        return rows;
    }

    public List<T> all(ReadView view)
    {
        ImmutableList.Builder<T> rows = ImmutableList.builder();
        for (Object row : view.scan(StoreKey.of(primaryTable)).values())
            rows.add(cast(row));
        return rows.build();
    }

    private StoreKey primaryKey(long id)
    {
        return StoreKey.of(primaryTable, StoreKey.encode(id));
    }

    private StoreKey indexKey(EntityType index, Function<T, List<String>> columns, T row)
    {
        return StoreKey.of(index, columns.apply(row));
    }

    @SuppressWarnings("unchecked")
    private T cast(Object row)
    {
        return (T) row;
    }

    public static final class Builder<T>
    {
        private final EntityType primaryTable;
        private final Function<T, Long> idOf;
        private final ImmutableMap.Builder<EntityType, Function<T, List<String>>> indexes = ImmutableMap.builder();

        private Builder(EntityType primaryTable, Function<T, Long> idOf)
        {
            this.primaryTable = primaryTable;
            this.idOf = idOf;
        }

        public Builder<T> index(EntityType index, Function<T, List<String>> columns)
        {
            indexes.put(index, columns);
            return this;
        }

        public LookupTableSupport<T> build()
        {
            return new LookupTableSupport<>(primaryTable, idOf, indexes.build());
        }
    }
}
