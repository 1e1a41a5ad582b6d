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

import org.rolegraph.auth.membership.MembershipEdge;
import org.rolegraph.auth.membership.MembershipOptions;
import org.rolegraph.auth.membership.OptionKind;
import org.rolegraph.auth.privilege.IObjectOwnership;
import org.rolegraph.auth.privilege.NoOpObjectOwnership;
import org.rolegraph.auth.privilege.ObjectRef;
import org.rolegraph.auth.privilege.Privilege;
import org.rolegraph.auth.privilege.PrivilegeGrant;
import org.rolegraph.config.AuthzConfig;
import org.rolegraph.exceptions.DependencyException;
import org.rolegraph.exceptions.InvalidGranteeException;
import org.rolegraph.exceptions.InvalidNameException;
import org.rolegraph.exceptions.InvalidRequestException;
import org.rolegraph.exceptions.PermissionDeniedException;
import org.rolegraph.store.InMemoryKeyValueStore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class AuthorizationServiceTest
{
    private static final Scope POSTGRES = Scope.database("postgres");

    private AuthTestSupport support;
    private AuthorizationService service;

    @Before
    public void setup()
    {
        support = new AuthTestSupport();
        service = support.service;
        support.createLogin("joe");
        support.createRole("manager", new RoleOptions().setOption(RoleOption.LOGIN, true)
                                                       .setOption(RoleOption.CREATEROLE, true));
    }

    @Test
    public void superuserCreatesRolesWithoutMemberships()
    {
        RoleId app = support.createRole("app");
        assertThat(service.graph().edgesOfRole(support.snapshot(), app)).isEmpty();
    }

    @Test
    public void createroleCreatorAdministersWhatItCreates()
    {
        SessionAuthorizationContext manager = support.login("manager");
        Role app = service.createRole(manager, "app", new RoleOptions());

        MembershipEdge grantBack = service.graph().findEdge(support.snapshot(), app.getId(), support.id("manager"),
                                                            Scope.GLOBAL, RoleId.BOOTSTRAP);
        assertThat(grantBack).isNotNull();
        assertThat(grantBack.hasAdminOption()).isTrue();
        assertThat(grantBack.hasInheritOption()).isFalse();
        assertThat(grantBack.hasSetOption()).isFalse();
        assertThat(service.graph().edgesOfMember(support.snapshot(), support.id("manager"))).hasSize(1);
        assertThat(manager.hasPrivilegesOfRole("app")).isFalse();

        MembershipEdge edge = service.grantMembership(manager, "app", "joe", MembershipOptions.none(), null, null);
        assertThat(edge.getGrantor()).isEqualTo(support.id("manager"));
        assertThat(edge.getParent()).isEqualTo(grantBack.getId());
    }

    @Test
    public void creatorSelfGrantFollowsConfiguration()
    {
        AuthzConfig config = new AuthzConfig();
        config.createrole_self_grant = ImmutableList.of("set", "inherit");
        AuthTestSupport configured = new AuthTestSupport(config);
        configured.createRole("manager", new RoleOptions().setOption(RoleOption.LOGIN, true)
                                                          .setOption(RoleOption.CREATEROLE, true));
        SessionAuthorizationContext manager = configured.login("manager");
        RoleId app = configured.service.createRole(manager, "app", new RoleOptions()).getId();

        RoleId managerId = configured.id("manager");
        MembershipEdge grantBack = configured.service.graph().findEdge(configured.snapshot(), app, managerId, Scope.GLOBAL, RoleId.BOOTSTRAP);
        MembershipEdge selfGrant = configured.service.graph().findEdge(configured.snapshot(), app, managerId, Scope.GLOBAL, managerId);
        assertThat(selfGrant.hasAdminOption()).isFalse();
        assertThat(selfGrant.hasInheritOption()).isTrue();
        assertThat(selfGrant.hasSetOption()).isTrue();
        assertThat(selfGrant.getParent()).isEqualTo(grantBack.getId());
        assertThat(manager.hasPrivilegesOfRole("app")).isTrue();
    }

    @Test
    public void createRoleAuthority()
    {
        SessionAuthorizationContext joe = support.login("joe");
        assertThatThrownBy(() -> service.createRole(joe, "app", new RoleOptions())).isInstanceOf(PermissionDeniedException.class);

        SessionAuthorizationContext manager = support.login("manager");
        assertThatThrownBy(() -> service.createRole(manager, "root", new RoleOptions().setOption(RoleOption.SUPERUSER, true)))
            .isInstanceOf(PermissionDeniedException.class);
        assertThatThrownBy(() -> service.createRole(manager, "dba", new RoleOptions().setOption(RoleOption.CREATEDB, true)))
            .isInstanceOf(PermissionDeniedException.class)
            .hasMessageContaining("CREATEDB");
        assertThat(service.roles().byName(support.snapshot(), "root")).isEmpty();
    }

    @Test
    public void createRoleRejectsReservedNames()
    {
        assertThatThrownBy(() -> support.createRole("pg_custom")).isInstanceOf(InvalidNameException.class);
        assertThatThrownBy(() -> support.createRole("public")).isInstanceOf(InvalidNameException.class);
        assertThatThrownBy(() -> support.createRole("joe")).isInstanceOf(InvalidRequestException.class);
    }

    @Test
    public void anyRoleMayChangeItsOwnPassword()
    {
        SessionAuthorizationContext joe = support.login("joe");
        Role altered = service.alterRole(joe, "current_user", new RoleOptions().setOption(RoleOption.PASSWORD, "s3cret"));
        assertThat(Passwords.matches(altered.getPasswordHash(), "s3cret")).isTrue();

        assertThatThrownBy(() -> service.alterRole(joe, "joe", new RoleOptions().setOption(RoleOption.CONNECTION_LIMIT, 5)))
            .isInstanceOf(PermissionDeniedException.class);
    }

    @Test
    public void alterNeedsAdminOptionAndCannotTouchSuperusers()
    {
        SessionAuthorizationContext manager = support.login("manager");
        service.createRole(manager, "app", new RoleOptions());

        Role altered = service.alterRole(manager, "app", new RoleOptions().setOption(RoleOption.CONNECTION_LIMIT, 3));
        assertThat(altered.getConnectionLimit()).isEqualTo(3);
        assertThatThrownBy(() -> service.alterRole(manager, "joe", new RoleOptions().setOption(RoleOption.LOGIN, false)))
            .isInstanceOf(PermissionDeniedException.class);
        assertThatThrownBy(() -> service.alterRole(manager, "postgres", new RoleOptions().setOption(RoleOption.LOGIN, false)))
            .isInstanceOf(PermissionDeniedException.class)
            .hasMessageContaining("SUPERUSER");
    }

    @Test
    public void bootstrapSuperuserKeepsSuperuser()
    {
        assertThatThrownBy(() -> service.alterRole(support.superuser, "postgres", new RoleOptions().setOption(RoleOption.SUPERUSER, false)))
            .isInstanceOf(InvalidRequestException.class);
        assertThat(service.roles().isSuperuser(support.snapshot(), RoleId.BOOTSTRAP)).isTrue();
    }

    @Test
    public void renameRules()
    {
        assertThatThrownBy(() -> service.renameRole(support.superuser, "postgres", "root"))
            .isInstanceOf(InvalidRequestException.class)
            .hasMessageContaining("Session user");
        assertThatThrownBy(() -> service.renameRole(support.superuser, "pg_read_all_data", "reader"))
            .isInstanceOf(InvalidNameException.class);
        assertThatThrownBy(() -> service.renameRole(support.superuser, "joe", "manager"))
            .isInstanceOf(InvalidRequestException.class);

        RoleId joe = support.id("joe");
        service.renameRole(support.superuser, "joe", "jane");
        assertThat(support.id("jane")).isEqualTo(joe);
        assertThat(service.roles().byName(support.snapshot(), "joe")).isEmpty();
    }

    @Test
    public void dropRoleIfExists()
    {
        assertThat(service.dropRole(support.superuser, "nobody", true)).isFalse();
        assertThatThrownBy(() -> service.dropRole(support.superuser, "nobody", false)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.dropRole(support.superuser, "postgres", false)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.dropRole(support.superuser, "pg_read_all_data", false)).isInstanceOf(InvalidRequestException.class);
    }

    @Test
    public void dropRoleRefusedWhileObjectsDependOnIt()
    {
        support.ownership.setOwner(ObjectRef.table("ledger"), support.id("joe"));
        service.grantPrivilege(support.superuser, EnumSet.of(Privilege.SELECT), ObjectRef.table("accounts"),
                               ImmutableList.of("joe"), false, null);

        assertThatThrownBy(() -> service.dropRole(support.superuser, "joe", false))
            .isInstanceOf(DependencyException.class)
            .satisfies(e -> assertThat(((DependencyException) e).getBlockers())
                            .containsExactlyInAnyOrder("owner of table ledger",
                                                       "privilege SELECT on table accounts granted to joe by postgres"));
        assertThat(service.roles().byName(support.snapshot(), "joe")).isPresent();

        service.dropOwned(support.superuser, ImmutableList.of("joe"));
        assertThat(service.dropRole(support.superuser, "joe", false)).isTrue();
        assertThat(service.roles().byName(support.snapshot(), "joe")).isEmpty();
    }

    @Test
    public void droppedRoleLeavesNoMemberships()
    {
        support.createRole("app");
        support.grant("app", "joe");
        RoleId app = support.id("app");

        assertThat(service.dropRole(support.superuser, "joe", false)).isTrue();
        assertThat(service.graph().edgesOfRole(support.snapshot(), app)).isEmpty();
    }

    @Test
    public void managerDropsWhatItCreated()
    {
        SessionAuthorizationContext manager = support.login("manager");
        service.createRole(manager, "app", new RoleOptions());
        assertThatThrownBy(() -> service.dropRole(manager, "joe", false)).isInstanceOf(PermissionDeniedException.class);

        assertThat(service.dropRole(manager, "app", false)).isTrue();
        assertThat(service.graph().edgesOfMember(support.snapshot(), support.id("manager"))).isEmpty();
    }

    @Test
    public void settingsPrecedence()
    {
        service.setRoleConfig(support.superuser, null, null, "search_path", "everyone");
        assertThat(service.effectiveSettings(support.login("joe"))).containsEntry("search_path", "everyone");

        service.setRoleConfig(support.superuser, null, "sales", "search_path", "sales_db");
        service.setRoleConfig(support.superuser, "joe", null, "search_path", "joe");
        assertThat(service.effectiveSettings(support.login("joe"))).containsEntry("search_path", "joe");

        service.setRoleConfig(support.superuser, "joe", "sales", "search_path", "joe_in_sales");
        assertThat(service.effectiveSettings(service.openSession("joe", "sales"))).containsEntry("search_path", "joe_in_sales");
        assertThat(service.effectiveSettings(service.openSession("manager", "sales"))).containsEntry("search_path", "sales_db");

        service.resetRoleConfig(support.superuser, "joe", "sales", null);
        assertThat(service.effectiveSettings(service.openSession("joe", "sales"))).containsEntry("search_path", "joe");
        service.resetRoleConfig(support.superuser, "joe", null, "search_path");
        assertThat(service.effectiveSettings(service.openSession("joe", "sales"))).containsEntry("search_path", "sales_db");
    }

    @Test
    public void settingsAuthority()
    {
        SessionAuthorizationContext joe = support.login("joe");
        assertThatThrownBy(() -> service.setRoleConfig(joe, null, null, "work_mem", "64MB")).isInstanceOf(PermissionDeniedException.class);
        assertThatThrownBy(() -> service.setRoleConfig(joe, "manager", null, "work_mem", "64MB")).isInstanceOf(PermissionDeniedException.class);

        service.setRoleConfig(joe, "joe", null, "WORK_MEM", "64MB");
        assertThat(service.effectiveSettings(joe)).containsEntry("work_mem", "64MB");
    }

    @Test
    public void membershipOptionDefaults()
    {
        support.createRole("app");
        support.createRole("noinherit", new RoleOptions().setOption(RoleOption.INHERIT, false));

        MembershipEdge toJoe = support.grant("app", "joe");
        assertThat(toJoe.hasAdminOption()).isFalse();
        assertThat(toJoe.hasInheritOption()).isTrue();
        assertThat(toJoe.hasSetOption()).isTrue();
        assertThat(toJoe.getScope()).isEqualTo(Scope.GLOBAL);

        assertThat(support.grant("app", "noinherit").hasInheritOption()).isFalse();
    }

    @Test
    public void regrantKeepsOptionsItDoesNotName()
    {
        support.createRole("app");
        MembershipEdge first = support.grant("app", "joe", MembershipOptions.none().inherit(false));
        MembershipEdge second = support.grant("app", "joe", MembershipOptions.none().admin(true));

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(second.hasAdminOption()).isTrue();
        assertThat(second.hasInheritOption()).isFalse();
        assertThat(service.graph().edgesOfMember(support.snapshot(), support.id("joe"))).hasSize(1);
    }

    @Test
    public void membershipCannotGoToPublic()
    {
        support.createRole("app");
        assertThatThrownBy(() -> support.grant("app", "public")).isInstanceOf(InvalidGranteeException.class);
    }

    @Test
    public void grantingMembershipNeedsAdminOption()
    {
        support.createRole("app");
        support.createRole("x");
        SessionAuthorizationContext joe = support.login("joe");
        assertThatThrownBy(() -> service.grantMembership(joe, "app", "x", MembershipOptions.none(), null, null))
            .isInstanceOf(PermissionDeniedException.class)
            .hasMessageContaining("ADMIN");

        support.grant("app", "joe", MembershipOptions.none().admin(true));
        MembershipEdge edge = service.grantMembership(joe, "app", "x", MembershipOptions.none(), null, null);
        assertThat(edge.getGrantor()).isEqualTo(support.id("joe"));
    }

    @Test
    public void adminOptionCannotGoBackToItsGrantor()
    {
        support.createRole("app");
        support.grant("app", "joe", MembershipOptions.none().admin(true));
        SessionAuthorizationContext joe = support.login("joe");
        service.grantMembership(joe, "app", "manager", MembershipOptions.none().admin(true), null, null);

        SessionAuthorizationContext manager = support.login("manager");
        assertThatThrownBy(() -> service.grantMembership(manager, "app", "joe", MembershipOptions.none().admin(true), null, "manager"))
            .isInstanceOf(InvalidGranteeException.class);
    }

    @Test
    public void databaseAdminOptionOnlyCountsWhileConnectedToIt()
    {
        support.createRole("app");
        service.grantMembership(support.superuser, "app", "manager", MembershipOptions.none().admin(true), Scope.database("sales"), null);

        SessionAuthorizationContext inSales = service.openSession("manager", "sales");
        MembershipEdge edge = service.grantMembership(inSales, "app", "joe", MembershipOptions.none(), Scope.database("sales"), null);
        assertThat(edge.getScope()).isEqualTo(Scope.database("sales"));

        assertThatThrownBy(() -> service.grantMembership(inSales, "app", "joe", MembershipOptions.none(), Scope.GLOBAL, null))
            .isInstanceOf(PermissionDeniedException.class);
        SessionAuthorizationContext elsewhere = support.login("manager");
        assertThatThrownBy(() -> service.grantMembership(elsewhere, "app", "joe", MembershipOptions.none(), Scope.database("sales"), null))
            .isInstanceOf(PermissionDeniedException.class);
    }

    @Test
    public void superuserRevokeRemovesEveryGrantorsEdge()
    {
        support.createRole("app");
        support.grant("app", "manager", MembershipOptions.none().admin(true));
        service.grantMembership(support.login("manager"), "app", "joe", MembershipOptions.none(), null, null);
        support.grant("app", "joe");
        RoleId app = support.id("app");
        RoleId joe = support.id("joe");
        assertThat(service.graph().matchingEdges(support.snapshot(), app, joe, Scope.GLOBAL, null)).hasSize(2);

        service.revokeMembership(support.superuser, "app", "joe", null, false, null, null);
        assertThat(service.graph().matchingEdges(support.snapshot(), app, joe, Scope.GLOBAL, null)).isEmpty();
    }

    @Test
    public void revokingAdminOptionRestrictsOrCascades()
    {
        support.createRole("app");
        support.grant("app", "manager", MembershipOptions.none().admin(true));
        service.grantMembership(support.login("manager"), "app", "joe", MembershipOptions.none(), null, null);

        assertThatThrownBy(() -> service.revokeMembership(support.superuser, "app", "manager", OptionKind.ADMIN, false, null, null))
            .isInstanceOf(DependencyException.class)
            .satisfies(e -> assertThat(((DependencyException) e).getBlockers()).containsExactly("membership of joe in app granted by manager"));
        assertThat(support.login("joe").hasPrivilegesOfRole("app")).isTrue();

        service.revokeMembership(support.superuser, "app", "manager", OptionKind.ADMIN, true, null, null);
        RoleId app = support.id("app");
        assertThat(service.graph().matchingEdges(support.snapshot(), app, support.id("joe"), Scope.GLOBAL, null)).isEmpty();
        MembershipEdge kept = service.graph().findEdge(support.snapshot(), app, support.id("manager"), Scope.GLOBAL, RoleId.BOOTSTRAP);
        assertThat(kept).isNotNull();
        assertThat(kept.hasAdminOption()).isFalse();
    }

    @Test
    public void revokingInheritOptionKeepsMembership()
    {
        support.createRole("app");
        support.grant("app", "joe");
        service.revokeMembership(support.superuser, "app", "joe", OptionKind.INHERIT, false, null, null);

        SessionAuthorizationContext joe = support.login("joe");
        assertThat(joe.hasPrivilegesOfRole("app")).isFalse();
        joe.setRole("app");
        assertThat(joe.getActiveRole()).isEqualTo(support.id("app"));
    }

    @Test
    public void grantedByMustBeInherited()
    {
        support.createRole("app");
        support.grant("app", "manager", MembershipOptions.none().admin(true));
        SessionAuthorizationContext joe = support.login("joe");
        assertThatThrownBy(() -> service.grantMembership(joe, "app", "joe", MembershipOptions.none(), null, "manager"))
            .isInstanceOf(PermissionDeniedException.class)
            .hasMessageContaining("must inherit privileges");
    }

    @Test
    public void specifiersResolveToSessionRoles()
    {
        SessionAuthorizationContext joe = support.login("joe");
        assertThat(service.resolveRole(support.snapshot(), joe, "CURRENT_USER")).isEqualTo(support.id("joe"));
        assertThat(service.resolveRole(support.snapshot(), joe, "session_user")).isEqualTo(support.id("joe"));
        assertThat(service.resolveGrantee(support.snapshot(), joe, "PUBLIC").isPublic()).isTrue();
        assertThatThrownBy(() -> service.resolveRole(support.snapshot(), joe, "public")).isInstanceOf(InvalidRequestException.class);
    }

    @Test
    public void reassignAndDropOwnedDelegateToOwnership()
    {
        IObjectOwnership ownership = mock(IObjectOwnership.class);
        AuthorizationService mocked = new AuthorizationService(new InMemoryKeyValueStore(1000), new AuthzConfig(), ownership);
        mocked.setup();
        SessionAuthorizationContext superuser = mocked.openSession("postgres", "postgres");
        RoleId old = mocked.createRole(superuser, "old_owner", new RoleOptions().setOption(RoleOption.LOGIN, true)).getId();
        RoleId heir = mocked.createRole(superuser, "heir", new RoleOptions()).getId();

        SessionAuthorizationContext oldSession = mocked.openSession("old_owner", "postgres");
        assertThatThrownBy(() -> mocked.reassignOwned(oldSession, ImmutableList.of("old_owner"), "heir"))
            .isInstanceOf(PermissionDeniedException.class);
        verify(ownership, never()).reassignOwnership(any(), any(), any());

        mocked.reassignOwned(superuser, ImmutableList.of("old_owner"), "heir");
        verify(ownership).reassignOwnership(old, heir, POSTGRES);

        mocked.dropOwned(oldSession, ImmutableList.of("current_user"));
        verify(ownership).dropOwnedObjects(old, POSTGRES);
    }

    @Test
    public void dropOwnedRevokesGrantsAndGrantedMemberships()
    {
        support.createRole("app");
        support.createRole("x");
        support.grant("app", "joe", MembershipOptions.none().admin(true));
        SessionAuthorizationContext joe = support.login("joe");
        service.grantMembership(joe, "app", "x", MembershipOptions.none(), null, null);
        service.grantPrivilege(support.superuser, EnumSet.of(Privilege.SELECT), ObjectRef.table("accounts"),
                               ImmutableList.of("joe"), false, null);
        support.ownership.setOwner(ObjectRef.table("ledger"), support.id("joe"));

        service.dropOwned(support.superuser, ImmutableList.of("joe"));

        assertThat(service.privileges().grantsTo(support.snapshot(), Grantee.role(support.id("joe")))).isEmpty();
        assertThat(service.graph().edgesGrantedBy(support.snapshot(), support.id("joe"))).isEmpty();
        assertThat(support.ownership.objectsOwnedBy(support.id("joe"))).isEmpty();
        // memberships of joe itself stay
        assertThat(joe.hasPrivilegesOfRole("app")).isTrue();
    }

    @Test
    public void withoutOwnershipTrackingNothingBlocksDrop()
    {
        AuthorizationService plain = new AuthorizationService(new InMemoryKeyValueStore(1000), new AuthzConfig());
        plain.setup();
        SessionAuthorizationContext superuser = plain.openSession("postgres", null);
        plain.createRole(superuser, "app", new RoleOptions());

        assertThat(superuser.scope()).isEqualTo(Scope.GLOBAL);
        assertThat(plain.dropRole(superuser, "app", false)).isTrue();
    }

    @Test
    public void inMemoryServiceUsesBundledConfiguration()
    {
        AuthorizationService configured = AuthorizationService.inMemory(new NoOpObjectOwnership());
        configured.setup();
        SessionAuthorizationContext superuser = configured.openSession("postgres", "postgres");
        assertThat(superuser.isSuperuser()).isTrue();
        assertThatThrownBy(() -> configured.createRole(superuser, "pg_mine", new RoleOptions()))
            .isInstanceOf(InvalidNameException.class);
    }

    @Test
    public void onlySuperusersChangeReservedAttributesEitherWay()
    {
        SessionAuthorizationContext manager = support.login("manager");
        service.createRole(manager, "app", new RoleOptions());

        assertThatThrownBy(() -> service.alterRole(manager, "app", new RoleOptions().setOption(RoleOption.REPLICATION, false)))
            .isInstanceOf(PermissionDeniedException.class)
            .hasMessageContaining("REPLICATION");
        assertThatThrownBy(() -> service.alterRole(manager, "app", new RoleOptions().setOption(RoleOption.BYPASSRLS, false)))
            .isInstanceOf(PermissionDeniedException.class);
        assertThatThrownBy(() -> service.alterRole(manager, "app", new RoleOptions().setOption(RoleOption.CREATEDB, false)))
            .isInstanceOf(PermissionDeniedException.class)
            .hasMessageContaining("CREATEDB");

        Role altered = service.alterRole(support.superuser, "app", new RoleOptions().setOption(RoleOption.REPLICATION, false));
        assertThat(altered.canInitiateReplication()).isFalse();
    }

    @Test
    public void reassignAndDropOwnedClearOwnerGrants()
    {
        support.createLogin("r");
        support.createRole("u");
        ObjectRef table = ObjectRef.table("t");
        support.ownership.setOwner(table, support.id("r"));
        service.grantPrivilege(support.login("r"), EnumSet.of(Privilege.SELECT), table, ImmutableList.of("u"), false, null);

        service.reassignOwned(support.superuser, ImmutableList.of("r"), "postgres");
        assertThat(service.privileges().grantsBy(support.snapshot(), support.id("r"))).isEmpty();
        assertThat(service.privileges().grantsOn(support.snapshot(), table))
            .extracting(PrivilegeGrant::getGrantor)
            .containsExactly(RoleId.BOOTSTRAP);

        service.dropOwned(support.superuser, ImmutableList.of("r"));
        assertThat(service.dropRole(support.superuser, "r", false)).isTrue();
        RoleId u = support.id("u");
        assertThat(service.privileges().effectivePrivilege(support.snapshot(), u, table, Privilege.SELECT, POSTGRES)).isTrue();

        // the new owner's authority now reaches the moved grant
        service.revokePrivilege(support.superuser, EnumSet.of(Privilege.SELECT), table, ImmutableList.of("u"), false, false, null);
        assertThat(service.privileges().grantsOn(support.snapshot(), table)).isEmpty();
    }

    @Test
    public void reassignMergesWithNewOwnersGrants()
    {
        support.createLogin("r");
        support.createLogin("heir");
        support.createLogin("u");
        support.createRole("w");
        ObjectRef table = ObjectRef.table("t");

        support.ownership.setOwner(table, support.id("heir"));
        service.grantPrivilege(support.login("heir"), EnumSet.of(Privilege.SELECT), table, ImmutableList.of("u"), false, null);
        support.ownership.setOwner(table, support.id("r"));
        service.grantPrivilege(support.login("r"), EnumSet.of(Privilege.SELECT), table, ImmutableList.of("u"), true, null);
        service.grantPrivilege(support.login("u"), EnumSet.of(Privilege.SELECT), table, ImmutableList.of("w"), false, null);

        service.reassignOwned(support.superuser, ImmutableList.of("r"), "heir");

        RoleId heir = support.id("heir");
        PrivilegeGrant kept = service.privileges().find(support.snapshot(), table, Privilege.SELECT, Grantee.role(support.id("u")), heir);
        assertThat(kept.hasGrantOption()).isTrue();
        assertThat(service.privileges().grantsBy(support.snapshot(), support.id("r"))).isEmpty();
        PrivilegeGrant toW = service.privileges().find(support.snapshot(), table, Privilege.SELECT, Grantee.role(support.id("w")), support.id("u"));
        assertThat(toW.getParent()).isEqualTo(kept.getId());

        service.revokePrivilege(support.login("heir"), EnumSet.of(Privilege.SELECT), table, ImmutableList.of("u"), false, true, null);
        assertThat(service.privileges().grantsOn(support.snapshot(), table)).isEmpty();
    }

    @Test
    public void dropOwnedRemovesGrantsOnOwnedObjects()
    {
        support.createLogin("r");
        support.createRole("u");
        ObjectRef ledger = ObjectRef.table("ledger");
        support.ownership.setOwner(ledger, support.id("r"));
        service.grantPrivilege(support.login("r"), EnumSet.of(Privilege.SELECT, Privilege.UPDATE), ledger, ImmutableList.of("u"), false, null);
        service.grantPrivilege(support.login("r"), EnumSet.of(Privilege.SELECT), ledger.withColumn("balance"), ImmutableList.of("public"), false, null);

        service.dropOwned(support.superuser, ImmutableList.of("r"));

        assertThat(service.privileges().grantsOn(support.snapshot(), ledger)).isEmpty();
        assertThat(support.ownership.objectsOwnedBy(support.id("r"))).isEmpty();
        assertThat(service.dropRole(support.superuser, "r", false)).isTrue();
    }
}
