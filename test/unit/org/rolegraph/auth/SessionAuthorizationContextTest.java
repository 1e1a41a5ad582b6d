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

import java.util.EnumSet;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;

import org.rolegraph.auth.membership.MembershipOptions;
import org.rolegraph.auth.privilege.ObjectRef;
import org.rolegraph.auth.privilege.Privilege;
import org.rolegraph.exceptions.NotAuthorizedException;
import org.rolegraph.metrics.AuthMetrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SessionAuthorizationContextTest
{
    private static final ObjectRef JOE_TABLE = ObjectRef.table("joe_t");
    private static final ObjectRef ADMIN_TABLE = ObjectRef.table("admin_t");
    private static final ObjectRef WHEEL_TABLE = ObjectRef.table("wheel_t");
    private static final ObjectRef ISLAND_TABLE = ObjectRef.table("island_t");

    private AuthTestSupport support;
    private SessionAuthorizationContext joe;

    @Before
    public void setup()
    {
        support = new AuthTestSupport();
        support.createLogin("joe");
        support.createRole("admin");
        support.createRole("wheel");
        support.createRole("island");

        support.grant("admin", "joe", MembershipOptions.none().inherit(true));
        support.grant("wheel", "admin", MembershipOptions.none().inherit(false));
        support.grant("island", "joe", MembershipOptions.none().inherit(true).set(false));

        grantSelect(JOE_TABLE, "joe");
        grantSelect(ADMIN_TABLE, "admin");
        grantSelect(WHEEL_TABLE, "wheel");
        grantSelect(ISLAND_TABLE, "island");

        joe = support.login("joe");
    }

    @Test
    public void loginRoleInheritsThroughInheritingEdgesOnly()
    {
        assertThat(joe.hasPrivilege(JOE_TABLE, Privilege.SELECT)).isTrue();
        assertThat(joe.hasPrivilege(ADMIN_TABLE, Privilege.SELECT)).isTrue();
        assertThat(joe.hasPrivilege(ISLAND_TABLE, Privilege.SELECT)).isTrue();
        assertThat(joe.hasPrivilege(WHEEL_TABLE, Privilege.SELECT)).isFalse();
    }

    @Test
    public void setRoleReplacesTheWholePrivilegeSet()
    {
        joe.setRole("admin");
        assertThat(joe.getActiveRole()).isEqualTo(support.id("admin"));
        assertThat(joe.hasPrivilege(ADMIN_TABLE, Privilege.SELECT)).isTrue();
        assertThat(joe.hasPrivilege(JOE_TABLE, Privilege.SELECT)).isFalse();
        assertThat(joe.hasPrivilege(ISLAND_TABLE, Privilege.SELECT)).isFalse();
        assertThat(joe.hasPrivilege(WHEEL_TABLE, Privilege.SELECT)).isFalse();
    }

    @Test
    public void setRoleNeedsNoIntermediateStep()
    {
        joe.setRole("wheel");
        assertThat(joe.hasPrivilege(WHEEL_TABLE, Privilege.SELECT)).isTrue();
        assertThat(joe.hasPrivilege(ADMIN_TABLE, Privilege.SELECT)).isFalse();
    }

    @Test
    public void setRoleIsRejectedWithoutSetOption()
    {
        long failures = AuthMetrics.instance.setRoleFailureCount();
        assertThatThrownBy(() -> joe.setRole("island")).isInstanceOf(NotAuthorizedException.class)
                                                      .hasMessageContaining("island");
        assertThat(joe.getActiveRole()).isEqualTo(joe.getLoginRole());
        assertThat(AuthMetrics.instance.setRoleFailureCount()).isEqualTo(failures + 1);
    }

    @Test
    public void eligibilityIsCheckedAgainstTheLoginRole()
    {
        joe.setRole("wheel");
        // wheel is not a member of admin, but joe is
        joe.setRole("admin");
        assertThat(joe.getActiveRole()).isEqualTo(support.id("admin"));
        assertThatThrownBy(() -> joe.setRole("island")).isInstanceOf(NotAuthorizedException.class);
        assertThat(joe.getActiveRole()).isEqualTo(support.id("admin"));
    }

    @Test
    public void resetAndNoneReturnToLoginRole()
    {
        joe.setRole("admin");
        joe.resetRole();
        assertThat(joe.getActiveRole()).isEqualTo(joe.getLoginRole());

        joe.setRole("wheel");
        joe.setRole("NONE");
        assertThat(joe.getActiveRole()).isEqualTo(joe.getLoginRole());
        assertThat(joe.hasPrivilege(ISLAND_TABLE, Privilege.SELECT)).isTrue();
    }

    @Test
    public void superuserMaySetAnyRole()
    {
        support.superuser.setRole("island");
        assertThat(support.superuser.isSuperuser()).isFalse();
        assertThat(support.superuser.hasPrivilege(JOE_TABLE, Privilege.SELECT)).isFalse();
        support.superuser.resetRole();
        assertThat(support.superuser.isSuperuser()).isTrue();
    }

    @Test
    public void membershipChangesAreSeenByOpenSessions()
    {
        assertThat(joe.hasPrivilegesOfRole("admin")).isTrue();
        support.service.revokeMembership(support.superuser, "admin", "joe", null, false, null, null);
        assertThat(joe.hasPrivilegesOfRole("admin")).isFalse();
        assertThat(joe.hasPrivilege(ADMIN_TABLE, Privilege.SELECT)).isFalse();
    }

    @Test
    public void databaseScopedMembershipOnlyAppliesInItsDatabase()
    {
        support.createRole("sales_reader");
        grantSelect(ObjectRef.table("orders"), "sales_reader");
        support.service.grantMembership(support.superuser, "sales_reader", "joe", MembershipOptions.none(),
                                        Scope.database("sales"), null);

        assertThat(support.service.openSession("joe", "sales").hasPrivilege(ObjectRef.table("orders"), Privilege.SELECT)).isTrue();
        assertThat(joe.hasPrivilege(ObjectRef.table("orders"), Privilege.SELECT)).isFalse();
    }

    @Test
    public void loginRequiresLoginAttribute()
    {
        assertThatThrownBy(() -> support.service.openSession("admin", "postgres")).isInstanceOf(NotAuthorizedException.class);
        assertThatThrownBy(() -> support.service.openSession("nobody", "postgres")).isInstanceOf(NotAuthorizedException.class);
    }

    private void grantSelect(ObjectRef table, String grantee)
    {
        support.service.grantPrivilege(support.superuser, EnumSet.of(Privilege.SELECT), table, ImmutableList.of(grantee), false, null);
    }
}
