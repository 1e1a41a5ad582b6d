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
package org.rolegraph.auth;

import com.google.common.primitives.Longs;

import org.rolegraph.store.StoreKey;

/**
 * Stable, opaque identifier of a role. Names can change, ids never do, so every membership
 * edge and privilege grant refers to roles by id.
 */
public final class RoleId implements Comparable<RoleId>
{
    /**
     * The bootstrap superuser. Membership grants made by any superuser, and the automatic
     * grant-back to a role's creator, are recorded with this role as grantor.
     */
    public static final RoleId BOOTSTRAP = new RoleId(10);

    private final long id;

    private RoleId(long id)
    {
        this.id = id;
    }

    public static RoleId of(long id)
    {
        return id == BOOTSTRAP.id ? BOOTSTRAP : new RoleId(id);
    }

    public static RoleId fromKey(String column)
    {
        return of(StoreKey.decode(column));
    }

    public long value()
    {
        return id;
    }

    public String toKey()
    {
        return StoreKey.encode(id);
    }

    public int compareTo(RoleId other)
    {
        return Long.compare(id, other.id);
    }

    public boolean equals(Object o)
    {
        return this == o || (o instanceof RoleId && ((RoleId) o).id == id);
    }

    public int hashCode()
    {
        return Longs.hashCode(id);
    }

    public String toString()
    {
        return "#" + id;
    }
}
