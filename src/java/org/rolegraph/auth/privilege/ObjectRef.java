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
package org.rolegraph.auth.privilege;

import java.util.Set;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.rolegraph.exceptions.InvalidRequestException;

/**
 * Reference to an object privileges are granted on: its type, its qualified name and, for
 * column privileges, the column.
 */
public final class ObjectRef
{
    private static final String NO_COLUMN = "";

    private final ObjectType type;
    private final String name;
    private final String column;

    private ObjectRef(ObjectType type, String name, String column)
    {
        this.type = Preconditions.checkNotNull(type);
        this.name = Preconditions.checkNotNull(name);
        this.column = column;
    }

    public static ObjectRef of(ObjectType type, String name)
    {
        return new ObjectRef(type, name, null);
    }

    public static ObjectRef table(String name)
    {
        return of(ObjectType.TABLE, name);
    }

    public static ObjectRef column(String table, String column)
    {
        Preconditions.checkArgument(column != null && !column.isEmpty(), "column name must not be empty");
        return new ObjectRef(ObjectType.TABLE, table, column);
    }

    public static ObjectRef database(String name)
    {
        return of(ObjectType.DATABASE, name);
    }

    public ObjectType getType()
    {
        return type;
    }

    public String getName()
    {
        return name;
    }

    public String getColumn()
    {
        return column;
    }

    public boolean isColumn()
    {
        return column != null;
    }

    /**
     * @return the table a column belongs to, or this reference itself
     */
    public ObjectRef withoutColumn()
    {
        return column == null ? this : of(type, name);
    }

    public ObjectRef withColumn(String newColumn)
    {
        return column(name, newColumn);
    }

    public Set<Privilege> applicablePrivileges()
    {
        return isColumn() ? ObjectType.columnPrivileges() : type.applicablePrivileges();
    }

    public void validate(Set<Privilege> privileges)
    {
        for (Privilege privilege : privileges)
            if (!applicablePrivileges().contains(privilege))
                throw new InvalidRequestException(String.format("Invalid privilege type %s for %s", privilege, this));
    }

    /**
     * Key columns of this object in the grant store. A table and all its columns share the
     * leading columns, so a table-level scan also finds the column grants.
     */
    public ImmutableList<String> toKey()
    {
        return ImmutableList.of(type.name(), name, column == null ? NO_COLUMN : column);
    }

    public boolean equals(Object o)
    {
        if (this == o)
            return true;

        if (!(o instanceof ObjectRef))
            return false;

        ObjectRef ref = (ObjectRef) o;
        return type == ref.type && Objects.equal(name, ref.name) && Objects.equal(column, ref.column);
    }

    public int hashCode()
    {
        return Objects.hashCode(type, name, column);
    }

    public String toString()
    {
        return column == null
               ? String.format("%s %s", type.name().toLowerCase(), name)
               : String.format("column %s of table %s", column, name);
    }
}
