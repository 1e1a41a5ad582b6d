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
import com.google.common.base.Preconditions;

/**
 * Recipient of a privilege grant: either a role or PUBLIC, the pseudo-role every role, present
 * and future, implicitly belongs to. PUBLIC is never a node of the membership graph; checks
 * simply add it to whatever set of roles they consider.
 */
public final class Grantee
{
    public static final Grantee PUBLIC = new Grantee(null);

    private static final String PUBLIC_KEY = "public";

    private final RoleId role;

    private Grantee(RoleId role)
    {
        this.role = role;
    }

    public static Grantee role(RoleId role)
    {
        return new Grantee(Preconditions.checkNotNull(role));
    }

    public static Grantee fromKey(String column)
    {
        return PUBLIC_KEY.equals(column) ? PUBLIC : role(RoleId.fromKey(column));
    }

    public boolean isPublic()
    {
        return role == null;
    }

    public RoleId getRole()
    {
        Preconditions.checkState(role != null, "PUBLIC is not a role");
        return role;
    }

    public String toKey()
    {
        return role == null ? PUBLIC_KEY : role.toKey();
    }

    public boolean equals(Object o)
    {
        if (this == o)
            return true;

        if (!(o instanceof Grantee))
            return false;

        return Objects.equal(role, ((Grantee) o).role);
    }

    public int hashCode()
    {
        return Objects.hashCode(role);
    }

    public String toString()
    {
        return role == null ? "PUBLIC" : role.toString();
    }
}
