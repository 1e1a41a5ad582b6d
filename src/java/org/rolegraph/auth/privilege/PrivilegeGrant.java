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

import com.google.common.base.Objects;

import org.rolegraph.auth.Grantee;
import org.rolegraph.auth.RoleId;

/**
 * One grantor's grant of a privilege on an object to a grantee. Grants of the same privilege to
 * the same grantee by different grantors are separate rows, any one of which suffices.
 */
public final class PrivilegeGrant
{
    private final long id;
    private final ObjectRef object;
    private final Privilege privilege;
    private final Grantee grantee;
    private final RoleId grantor;
    private final boolean grantOption;
    private final Long parent;

    public PrivilegeGrant(long id,
                          ObjectRef object,
                          Privilege privilege,
                          Grantee grantee,
                          RoleId grantor,
                          boolean grantOption,
                          Long parent)
    {
        this.id = id;
        this.object = object;
        this.privilege = privilege;
        this.grantee = grantee;
        this.grantor = grantor;
        this.grantOption = grantOption;
        this.parent = parent;
    }

    public long getId()
    {
        return id;
    }

    public ObjectRef getObject()
    {
        return object;
    }

    public Privilege getPrivilege()
    {
        return privilege;
    }

    public Grantee getGrantee()
    {
        return grantee;
    }

    public RoleId getGrantor()
    {
        return grantor;
    }

    public boolean hasGrantOption()
    {
        return grantOption;
    }

    /**
     * @return the id of the grant whose grant option authorised the grantor, or null when the
     * grantor acted as the object's owner
     */
    public Long getParent()
    {
        return parent;
    }

    public PrivilegeGrant withGrantOption(boolean newGrantOption)
    {
        return new PrivilegeGrant(id, object, privilege, grantee, grantor, newGrantOption, parent);
    }

    public PrivilegeGrant withGrantor(RoleId newGrantor)
    {
        return new PrivilegeGrant(id, object, privilege, grantee, newGrantor, grantOption, parent);
    }

    public PrivilegeGrant withParent(Long newParent)
    {
        return new PrivilegeGrant(id, object, privilege, grantee, grantor, grantOption, newParent);
    }

    public boolean equals(Object o)
    {
        if (this == o)
            return true;

        if (!(o instanceof PrivilegeGrant))
            return false;

        PrivilegeGrant g = (PrivilegeGrant) o;
        return id == g.id
               && Objects.equal(object, g.object)
               && privilege == g.privilege
               && Objects.equal(grantee, g.grantee)
               && Objects.equal(grantor, g.grantor)
               && grantOption == g.grantOption
               && Objects.equal(parent, g.parent);
    }

    public int hashCode()
    {
        return Objects.hashCode(id, object, privilege, grantee, grantor, grantOption, parent);
    }

    public String toString()
    {
        return String.format("Grant %d: %s on %s to %s by %s%s",
                             id, privilege, object, grantee, grantor, grantOption ? " with grant option" : "");
    }
}
