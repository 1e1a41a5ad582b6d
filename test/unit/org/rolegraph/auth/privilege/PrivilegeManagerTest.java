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

import java.util.EnumSet;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.Before;
import org.junit.Test;

import org.rolegraph.auth.AuthTestSupport;
import org.rolegraph.auth.Grantee;
import org.rolegraph.auth.RoleId;
import org.rolegraph.auth.Scope;
import org.rolegraph.auth.SessionAuthorizationContext;
import org.rolegraph.auth.membership.MembershipOptions;
import org.rolegraph.exceptions.DependencyException;
import org.rolegraph.exceptions.InvalidGranteeException;
import org.rolegraph.exceptions.InvalidRequestException;
import org.rolegraph.exceptions.PermissionDeniedException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.rolegraph.auth.privilege.Privilege.INSERT;
import static org.rolegraph.auth.privilege.Privilege.SELECT;
import static org.rolegraph.auth.privilege.Privilege.UPDATE;

public class PrivilegeManagerTest
{
    private static final ObjectRef TABLE = ObjectRef.table("accounts");
    private static final Scope SCOPE = Scope.database("postgres");

    private AuthTestSupport support;
    private PrivilegeManager privileges;
    private RoleId owner;
    private RoleId b;
    private RoleId c;
    private RoleId d;
    private SessionAuthorizationContext ownerSession;
    private SessionAuthorizationContext bSession;

    @Before
    public void setup()
    {
        support = new AuthTestSupport();
        privileges = support.service.privileges();
        owner = support.createLogin("owner");
        b = support.createLogin("b");
        c = support.createLogin("c");
        d = support.createLogin("d");
        support.ownership.setOwner(TABLE, owner);
        ownerSession = support.login("owner");
        bSession = support.login("b");
    }

    @Test
    public void cascadeRemovesGrantsMadeThroughTheGrantOption()
    {
        grant(ownerSession, SELECT, "b", true);
        grant(bSession, SELECT, "c", false);
        assertThat(holds(c, SELECT)).isTrue();

        assertThatThrownBy(() -> revoke(ownerSession, SELECT, "b", false, false))
            .isInstanceOf(DependencyException.class)
            .satisfies(e -> assertThat(((DependencyException) e).getBlockers())
                                .containsExactly("privilege SELECT on table accounts granted to c by b"));
        assertThat(holds(b, SELECT)).isTrue();
        assertThat(holds(c, SELECT)).isTrue();

        GrantResult result = revoke(ownerSession, SELECT, "b", false, true);
        assertThat(result.getAffected()).extracting(PrivilegeGrant::getGrantee).containsExactly(Grantee.role(b));
        assertThat(result.getCascaded()).extracting(PrivilegeGrant::getGrantee).containsExactly(Grantee.role(c));
        assertThat(holds(b, SELECT)).isFalse();
        assertThat(holds(c, SELECT)).isFalse();
        assertThat(privileges.grantsOn(support.snapshot(), TABLE)).isEmpty();
    }

    @Test
    public void regrantKeepsOneRowAndOrsTheGrantOption()
    {
        grant(ownerSession, SELECT, "b", false);
        grant(ownerSession, SELECT, "b", true);
        grant(ownerSession, SELECT, "b", false);

        List<PrivilegeGrant> rows = privileges.grantsOn(support.snapshot(), TABLE);
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).hasGrantOption()).isTrue();
        assertThat(rows.get(0).getGrantor()).isEqualTo(owner);
    }

    @Test
    public void publicGrantCoversRolesCreatedLater()
    {
        grant(ownerSession, SELECT, "public", false);
        RoleId late = support.createRole("late");
        assertThat(holds(late, SELECT)).isTrue();
        assertThat(holds(late, INSERT)).isFalse();
    }

    @Test
    public void revokingDirectGrantLeavesPublicGrantInEffect()
    {
        grant(ownerSession, SELECT, "public", false);
        grant(ownerSession, SELECT, "b", false);
        revoke(ownerSession, SELECT, "b", false, false);
        assertThat(privileges.find(support.snapshot(), TABLE, SELECT, Grantee.role(b), owner)).isNull();
        assertThat(holds(b, SELECT)).isTrue();
    }

    @Test
    public void grantProceedsForHeldOptionsAndWarnsForTheRest()
    {
        grant(ownerSession, SELECT, "b", true);
        grant(ownerSession, INSERT, "b", false);

        GrantResult result = support.service.grantPrivilege(bSession, EnumSet.of(SELECT, INSERT), TABLE,
                                                           ImmutableList.of("c"), false, null);
        assertThat(result.isPartial()).isTrue();
        assertThat(result.getWarnings()).extracting(PartialGrantWarning::getPrivilege).containsExactly(INSERT);
        assertThat(holds(c, SELECT)).isTrue();
        assertThat(holds(c, INSERT)).isFalse();
    }

    @Test
    public void grantWithoutAnyPrivilegeIsDenied()
    {
        long generation = support.store.generation();
        assertThatThrownBy(() -> grant(bSession, SELECT, "c", false)).isInstanceOf(PermissionDeniedException.class);
        assertThat(support.store.generation()).isEqualTo(generation);
    }

    @Test
    public void grantWithPrivilegeButNoOptionOnlyWarns()
    {
        grant(ownerSession, SELECT, "b", false);
        GrantResult result = grant(bSession, SELECT, "c", false);
        assertThat(result.getAffected()).isEmpty();
        assertThat(result.getWarnings()).hasSize(1);
        assertThat(holds(c, SELECT)).isFalse();
    }

    @Test
    public void grantOptionCannotGoToPublic()
    {
        assertThatThrownBy(() -> grant(ownerSession, SELECT, "public", true)).isInstanceOf(InvalidGranteeException.class);
    }

    @Test
    public void grantOptionCannotGoBackToOwnGrantor()
    {
        grant(ownerSession, SELECT, "b", true);
        assertThatThrownBy(() -> grant(bSession, SELECT, "owner", true)).isInstanceOf(InvalidGranteeException.class);
    }

    @Test
    public void inapplicablePrivilegeIsRejected()
    {
        assertThatThrownBy(() -> grant(ownerSession, Privilege.EXECUTE, "b", false)).isInstanceOf(InvalidRequestException.class);
    }

    @Test
    public void tableRevokeAlsoRevokesColumnGrants()
    {
        ObjectRef column = TABLE.withColumn("balance");
        support.service.grantPrivilege(ownerSession, EnumSet.of(UPDATE), column, ImmutableList.of("b"), false, null);
        grant(ownerSession, UPDATE, "b", false);
        assertThat(privileges.grantsOn(support.snapshot(), TABLE)).hasSize(2);

        revoke(ownerSession, UPDATE, "b", false, false);
        assertThat(privileges.grantsOn(support.snapshot(), TABLE)).isEmpty();
        assertThat(holdsOn(b, column, UPDATE)).isFalse();
    }

    @Test
    public void columnRevokeLeavesTableGrant()
    {
        ObjectRef column = TABLE.withColumn("balance");
        support.service.grantPrivilege(ownerSession, EnumSet.of(SELECT), column, ImmutableList.of("b"), false, null);
        grant(ownerSession, SELECT, "b", false);

        support.service.revokePrivilege(ownerSession, EnumSet.of(SELECT), column, ImmutableList.of("b"), false, false, null);
        assertThat(holds(b, SELECT)).isTrue();
        // the table grant still covers every column
        assertThat(holdsOn(b, column, SELECT)).isTrue();
    }

    @Test
    public void dependentSurvivesThroughAnotherGrantOption()
    {
        grant(ownerSession, SELECT, "b", true);
        grant(ownerSession, SELECT, "d", true);
        grant(support.login("d"), SELECT, "b", true);
        grant(bSession, SELECT, "c", false);

        GrantResult result = revoke(ownerSession, SELECT, "b", false, false);
        assertThat(result.getCascaded()).isEmpty();
        assertThat(holds(c, SELECT)).isTrue();

        PrivilegeGrant fromD = privileges.find(support.snapshot(), TABLE, SELECT, Grantee.role(b), d);
        PrivilegeGrant toC = privileges.find(support.snapshot(), TABLE, SELECT, Grantee.role(c), b);
        assertThat(toC.getParent()).isEqualTo(fromD.getId());
    }

    @Test
    public void revokingGrantOptionOnlyKeepsPrivilege()
    {
        grant(ownerSession, SELECT, "b", true);
        grant(bSession, SELECT, "c", false);

        revoke(ownerSession, SELECT, "b", true, true);
        assertThat(holds(b, SELECT)).isTrue();
        assertThat(privileges.find(support.snapshot(), TABLE, SELECT, Grantee.role(b), owner).hasGrantOption()).isFalse();
        assertThat(holds(c, SELECT)).isFalse();
    }

    @Test
    public void superuserGrantsAsTheOwner()
    {
        grant(support.superuser, SELECT, "b", false);
        assertThat(privileges.find(support.snapshot(), TABLE, SELECT, Grantee.role(b), owner)).isNotNull();

        ObjectRef unowned = ObjectRef.table("unowned");
        support.service.grantPrivilege(support.superuser, EnumSet.of(SELECT), unowned, ImmutableList.of("b"), false, null);
        assertThat(privileges.find(support.snapshot(), unowned, SELECT, Grantee.role(b), RoleId.BOOTSTRAP)).isNotNull();
    }

    @Test
    public void membersOfTheOwnerShareItsPrivileges()
    {
        support.grant("owner", "b");
        assertThat(holds(b, Privilege.TRUNCATE)).isTrue();

        // and may grant as the owner
        grant(bSession, SELECT, "c", false);
        assertThat(privileges.find(support.snapshot(), TABLE, SELECT, Grantee.role(c), owner)).isNotNull();
    }

    @Test
    public void privilegesArriveThroughInheritingMembershipsOnly()
    {
        support.createRole("readers");
        grant(ownerSession, SELECT, "readers", false);
        support.grant("readers", "b", MembershipOptions.none().inherit(false));
        support.grant("readers", "c", MembershipOptions.none().inherit(true));

        assertThat(holds(b, SELECT)).isFalse();
        assertThat(holds(c, SELECT)).isTrue();
    }

    @Test
    public void predefinedRolesImplyDataPrivileges()
    {
        support.grant("pg_read_all_data", "b");
        support.grant("pg_write_all_data", "c");

        assertThat(holds(b, SELECT)).isTrue();
        assertThat(holds(b, INSERT)).isFalse();
        assertThat(holds(c, INSERT)).isTrue();
        assertThat(holds(c, SELECT)).isFalse();
        assertThat(privileges.effectivePrivilege(support.snapshot(), b, ObjectRef.of(ObjectType.SCHEMA, "app"), Privilege.USAGE, SCOPE)).isTrue();
    }

    @Test
    public void grantedByMustBeARoleTheActorInherits()
    {
        grant(ownerSession, SELECT, "d", true);
        assertThatThrownBy(() -> support.service.grantPrivilege(bSession, EnumSet.of(SELECT), TABLE, ImmutableList.of("c"), false, "d"))
            .isInstanceOf(PermissionDeniedException.class);

        support.grant("d", "b");
        support.service.grantPrivilege(bSession, EnumSet.of(SELECT), TABLE, ImmutableList.of("c"), false, "d");
        assertThat(privileges.find(support.snapshot(), TABLE, SELECT, Grantee.role(c), d)).isNotNull();
    }

    @Test
    public void effectivePrivilegesListsEverythingHeld()
    {
        grant(ownerSession, SELECT, "b", false);
        grant(ownerSession, INSERT, "public", false);
        assertThat(privileges.effectivePrivileges(support.snapshot(), b, TABLE, SCOPE)).isEqualTo(ImmutableSet.of(SELECT, INSERT));
    }

    private GrantResult grant(SessionAuthorizationContext session, Privilege privilege, String grantee, boolean withOption)
    {
        return support.service.grantPrivilege(session, EnumSet.of(privilege), TABLE, ImmutableList.of(grantee), withOption, null);
    }

    private GrantResult revoke(SessionAuthorizationContext session, Privilege privilege, String grantee, boolean optionOnly, boolean cascade)
    {
        return support.service.revokePrivilege(session, EnumSet.of(privilege), TABLE, ImmutableList.of(grantee), optionOnly, cascade, null);
    }

    private boolean holds(RoleId role, Privilege privilege)
    {
        return holdsOn(role, TABLE, privilege);
    }

    private boolean holdsOn(RoleId role, ObjectRef object, Privilege privilege)
    {
        return privileges.effectivePrivilege(support.snapshot(), role, object, privilege, SCOPE);
    }
}
