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
package org.rolegraph.auth.membership;

import com.google.common.base.Objects;

import org.rolegraph.auth.RoleId;
import org.rolegraph.auth.Scope;

/**
 * A single grant of membership in {@code granted} to {@code member}, made by {@code grantor}
 * in a scope. The same pair may be connected by several edges, one per grantor and scope.
 */
public final class MembershipEdge
{
    private final long id;
    private final RoleId granted;
    private final RoleId member;
    private final RoleId grantor;
    private final boolean admin;
    private final boolean inherit;
    private final boolean set;
    private final Scope scope;
    private final Long parent;

    public MembershipEdge(long id,
                          RoleId granted,
                          RoleId member,
                          RoleId grantor,
                          boolean admin,
                          boolean inherit,
                          boolean set,
                          Scope scope,
                          Long parent)
    {
        this.id = id;
        this.granted = granted;
        this.member = member;
        this.grantor = grantor;
        this.admin = admin;
        this.inherit = inherit;
        this.set = set;
        this.scope = scope;
        this.parent = parent;
    }

    public long getId()
    {
        return id;
    }

    public RoleId getGranted()
    {
        return granted;
    }

    public RoleId getMember()
    {
        return member;
    }

    public RoleId getGrantor()
    {
        return grantor;
    }

    public boolean hasAdminOption()
    {
        return admin;
    }

    public boolean hasInheritOption()
    {
        return inherit;
    }

    public boolean hasSetOption()
    {
        return set;
    }

    public Scope getScope()
    {
        return scope;
    }

    /**
     * @return the id of the admin edge which authorised the grantor, or null for grants made
     * with superuser authority
     */
    public Long getParent()
    {
        return parent;
    }

    public MembershipEdge withOptions(boolean newAdmin, boolean newInherit, boolean newSet)
    {
        return new MembershipEdge(id, granted, member, grantor, newAdmin, newInherit, newSet, scope, parent);
    }

    public MembershipEdge withParent(Long newParent)
    {
        return new MembershipEdge(id, granted, member, grantor, admin, inherit, set, scope, newParent);
    }

    public boolean equals(Object o)
    {
        if (this == o)
            return true;

        if (!(o instanceof MembershipEdge))
            return false;

        MembershipEdge e = (MembershipEdge) o;
        return id == e.id
               && Objects.equal(granted, e.granted)
               && Objects.equal(member, e.member)
               && Objects.equal(grantor, e.grantor)
               && admin == e.admin
               && inherit == e.inherit
               && set == e.set
               && Objects.equal(scope, e.scope)
               && Objects.equal(parent, e.parent);
    }

    public int hashCode()
    {
        return Objects.hashCode(id, granted, member, grantor, admin, inherit, set, scope, parent);
    }

    public String toString()
    {
        return String.format("Edge %d: %s -> %s granted by %s in %s (admin=%s, inherit=%s, set=%s)",
                             id, member, granted, grantor, scope, admin, inherit, set);
    }
}
