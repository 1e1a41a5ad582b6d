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

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

/**
 * Key of a row in the backing store: an entity type followed by its text key columns.
 *
 * Keys order by entity type then column by column, so every key sharing a prefix of columns
 * sits in one contiguous range and a prefix key can be used directly as the start of a scan.
 * Numeric ids must therefore be encoded with {@link #encode(long)} to sort numerically.
 */
public final class StoreKey implements Comparable<StoreKey>
{
    private static final Comparator<Iterable<String>> COLUMN_ORDER = Ordering.<String>natural().lexicographical();

    private final EntityType type;
    private final ImmutableList<String> columns;

    private StoreKey(EntityType type, ImmutableList<String> columns)
    {
        this.type = type;
        this.columns = columns;
    }

    public static StoreKey of(EntityType type, String... columns)
    {
        return new StoreKey(type, ImmutableList.copyOf(columns));
    }

    public static StoreKey of(EntityType type, List<String> columns)
    {
        return new StoreKey(type, ImmutableList.copyOf(columns));
    }

    public static String encode(long id)
    {
        assert id >= 0 : "negative ids cannot be encoded";
        return String.format("%019d", id);
    }

    public static long decode(String column)
    {
        return Long.parseLong(column);
    }

    public EntityType getType()
    {
        return type;
    }

    public ImmutableList<String> getColumns()
    {
        return columns;
    }

    public String getColumn(int index)
    {
        return columns.get(index);
    }

    public StoreKey append(String... more)
    {
        return new StoreKey(type, ImmutableList.<String>builder().addAll(columns).addAll(Arrays.asList(more)).build());
    }

    public boolean isPrefixOf(StoreKey other)
    {
        return type == other.type
               && columns.size() <= other.columns.size()
               && columns.equals(other.columns.subList(0, columns.size()));
    }

    public int compareTo(StoreKey other)
    {
        int cmp = type.compareTo(other.type);
        return cmp != 0 ? cmp : COLUMN_ORDER.compare(columns, other.columns);
    }

    public boolean equals(Object o)
    {
        if (this == o)
            return true;

        if (!(o instanceof StoreKey))
            return false;

        StoreKey key = (StoreKey) o;
        return type == key.type && Objects.equal(columns, key.columns);
    }

    public int hashCode()
    {
        return Objects.hashCode(type, columns);
    }

    public String toString()
    {
        return type + columns.toString();
    }
}
