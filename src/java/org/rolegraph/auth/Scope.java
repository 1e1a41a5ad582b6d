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

import com.google.common.base.Objects;
import org.apache.commons.lang3.StringUtils;

import org.rolegraph.exceptions.InvalidRequestException;

/**
 * Where a membership edge is effective: cluster-wide, or only in sessions connected to one
 * database. A session's own scope is always the database it is connected to, and it sees the
 * union of the Global edges and the edges of that database.
 */
public final class Scope
{
    public static final Scope GLOBAL = new Scope(null);

    private static final String DATABASE_KEY_PREFIX = "db:";

    private final String database;

    private Scope(String database)
    {
        this.database = database;
    }

    public static Scope database(String database)
    {
        if (StringUtils.isEmpty(database))
            throw new InvalidRequestException("Database name must not be empty");
        return new Scope(database);
    }

    public static Scope fromKey(String column)
    {
        return column.isEmpty() ? GLOBAL : new Scope(column.substring(DATABASE_KEY_PREFIX.length()));
    }

    public boolean isGlobal()
    {
        return database == null;
    }

    public String getDatabase()
    {
        return database;
    }

    /**
     * @return whether an edge with this scope is visible to operations in the supplied scope
     */
    public boolean isVisibleIn(Scope scope)
    {
        return isGlobal() || this.equals(scope);
    }

    public String toKey()
    {
        return database == null ? "" : DATABASE_KEY_PREFIX + database;
    }

    public boolean equals(Object o)
    {
        if (this == o)
            return true;

        if (!(o instanceof Scope))
            return false;

        return Objects.equal(database, ((Scope) o).database);
    }

    public int hashCode()
    {
        return Objects.hashCode(database);
    }

    public String toString()
    {
        return database == null ? "GLOBAL" : "DATABASE " + database;
    }
}
