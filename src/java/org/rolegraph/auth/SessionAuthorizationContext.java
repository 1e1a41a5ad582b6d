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

import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.rolegraph.auth.privilege.ObjectRef;
import org.rolegraph.auth.privilege.Privilege;
import org.rolegraph.exceptions.NotAuthorizedException;
import org.rolegraph.metrics.AuthMetrics;
import org.rolegraph.store.ReadView;

/**
 * The authorization state of one connection: the role it logged in as, the role it currently
 * acts as and the database it is connected to. Instances are confined to their connection and
 * are never shared between threads.
 *
 * Whether SET ROLE is allowed always depends on the login role, never on the role currently
 * active. Once a role is active, privilege checks use its inherited closure alone.
 */
public class SessionAuthorizationContext
{
    private static final Logger logger = LoggerFactory.getLogger(SessionAuthorizationContext.class);

    private static final String NONE = "none";

    private final AuthorizationService service;
    private final RoleId loginRole;
    private final String database;
    private RoleId activeRole;

    SessionAuthorizationContext(AuthorizationService service, RoleId loginRole, String database)
    {
        this.service = service;
        this.loginRole = loginRole;
        this.database = database;
        this.activeRole = loginRole;
    }

    public RoleId getLoginRole()
    {
        return loginRole;
    }

    public RoleId getActiveRole()
    {
        return activeRole;
    }

    public String getDatabase()
    {
        return database;
    }

    /**
     * @return the scope membership edges are evaluated in: the connected database, or Global
     * for a session not connected to one
     */
    public Scope scope()
    {
        return database == null ? Scope.GLOBAL : Scope.database(database);
    }

    /**
     * Switches to the named role, or back to the login role for {@code NONE}.
     *
     * @throws NotAuthorizedException if the login role may not SET ROLE to the target
     */
    public void setRole(String name)
    {
        if (StringUtils.equalsIgnoreCase(name, NONE))
        {
            resetRole();
            return;
        }
        setRole(service.roles().requireByName(service.store().snapshot(), name).getId());
    }

    public void setRole(RoleId target)
    {
        ReadView snapshot = service.store().snapshot();
        if (!target.equals(loginRole) && !service.graph().memberCanSetRole(snapshot, loginRole, target, scope()))
        {
            AuthMetrics.instance.markSetRoleFailure();
            throw new NotAuthorizedException(String.format("Permission denied to set role \"%s\"",
                                                           service.roles().nameOf(snapshot, target)));
        }
        logger.debug("Session of {} switched active role from {} to {}", loginRole, activeRole, target);
        activeRole = target;
    }

    public void resetRole()
    {
        activeRole = loginRole;
    }

    public boolean hasPrivilege(ObjectRef object, Privilege privilege)
    {
        return service.privileges().effectivePrivilege(service.store().snapshot(), activeRole, object, privilege, scope());
    }

    public Set<Privilege> effectivePrivileges(ObjectRef object)
    {
        return service.privileges().effectivePrivileges(service.store().snapshot(), activeRole, object, scope());
    }

    /**
     * @return whether the active role may use the named role's privileges without SET ROLE
     */
    public boolean hasPrivilegesOfRole(String name)
    {
        ReadView snapshot = service.store().snapshot();
        RoleId role = service.roles().requireByName(snapshot, name).getId();
        return service.graph().hasPrivilegesOfRole(snapshot, activeRole, role, scope());
    }

    public boolean isSuperuser()
    {
        return service.roles().isSuperuser(service.store().snapshot(), activeRole);
    }

    public String toString()
    {
        return String.format("Session(login=%s, active=%s, database=%s)", loginRole, activeRole, database);
    }
}
