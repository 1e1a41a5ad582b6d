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

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.rolegraph.auth.cache.ClosureCache;
import org.rolegraph.auth.membership.MembershipEdge;
import org.rolegraph.auth.membership.MembershipGraph;
import org.rolegraph.auth.membership.MembershipOptions;
import org.rolegraph.auth.membership.OptionKind;
import org.rolegraph.auth.privilege.GrantResult;
import org.rolegraph.auth.privilege.IObjectOwnership;
import org.rolegraph.auth.privilege.NoOpObjectOwnership;
import org.rolegraph.auth.privilege.ObjectRef;
import org.rolegraph.auth.privilege.Privilege;
import org.rolegraph.auth.privilege.PrivilegeGrant;
import org.rolegraph.auth.privilege.PrivilegeManager;
import org.rolegraph.auth.revocation.RevocationPlan;
import org.rolegraph.config.AuthzConfig;
import org.rolegraph.config.YamlConfigurationLoader;
import org.rolegraph.exceptions.DependencyException;
import org.rolegraph.exceptions.InvalidNameException;
import org.rolegraph.exceptions.InvalidRequestException;
import org.rolegraph.exceptions.NotAuthorizedException;
import org.rolegraph.exceptions.PermissionDeniedException;
import org.rolegraph.store.InMemoryKeyValueStore;
import org.rolegraph.store.KeyValueStore;
import org.rolegraph.store.ReadView;
import org.rolegraph.store.Transaction;

/**
 * The administrative commands. Each command checks the authority of the session's active role
 * and then runs in a single store transaction, so that it either takes full effect or, on any
 * exception, none at all.
 *
 * Wherever a command takes a role name, the specifiers CURRENT_USER and CURRENT_ROLE (the
 * active role) and SESSION_USER (the login role) are accepted as well; PUBLIC is only accepted
 * as a privilege grantee.
 */
public class AuthorizationService
{
    private static final Logger logger = LoggerFactory.getLogger(AuthorizationService.class);

    private static final String PUBLIC = "public";
    private static final String CURRENT_USER = "current_user";
    private static final String CURRENT_ROLE = "current_role";
    private static final String SESSION_USER = "session_user";

    private static final String SELF_GRANT_SET = "set";
    private static final String SELF_GRANT_INHERIT = "inherit";

    private final KeyValueStore store;
    private final AuthzConfig config;
    private final IObjectOwnership ownership;
    private final RoleDirectory roles;
    private final MembershipGraph graph;
    private final PrivilegeManager privileges;

    public AuthorizationService(KeyValueStore store, AuthzConfig config, IObjectOwnership ownership)
    {
        this.store = store;
        this.config = config;
        this.ownership = ownership;
        this.roles = new RoleDirectory(config);
        this.graph = new MembershipGraph(roles, new ClosureCache("roles", config.closure_cache_max_entries));
        this.privileges = new PrivilegeManager(roles, graph, ownership);
    }

    public AuthorizationService(KeyValueStore store, AuthzConfig config)
    {
        this(store, config, new NoOpObjectOwnership());
    }

    /**
     * Builds a service over a new in-memory store, configured from the YAML located by
     * {@link YamlConfigurationLoader}.
     */
    public static AuthorizationService inMemory(IObjectOwnership ownership)
    {
        AuthzConfig config = new YamlConfigurationLoader().loadConfig();
        logger.info("Starting authorization service with {}", config);
        return new AuthorizationService(new InMemoryKeyValueStore(config.write_lock_timeout_ms), config, ownership);
    }

    /**
     * Creates the bootstrap superuser and the predefined roles if the store does not hold them
     * yet.
     */
    public void setup()
    {
        try (Transaction txn = store.begin())
        {
            roles.bootstrap(txn);
            txn.commit();
        }
    }

    /**
     * @throws NotAuthorizedException if the role does not exist or may not log in
     */
    public SessionAuthorizationContext openSession(String loginName, String database)
    {
        Optional<Role> role = roles.byName(store.snapshot(), loginName);
        if (!role.isPresent())
            throw new NotAuthorizedException(String.format("Role \"%s\" does not exist", loginName));
        if (!role.get().canLogin())
            throw new NotAuthorizedException(String.format("Role \"%s\" is not permitted to log in", loginName));
        logger.debug("Opened session for {} on database {}", role.get(), database);
        return new SessionAuthorizationContext(this, role.get().getId(), database);
    }

    public Role createRole(SessionAuthorizationContext session, String name, RoleOptions options)
    {
        try (Transaction txn = store.begin())
        {
            RoleId actor = session.getActiveRole();
            Role creator = roles.require(txn, actor);
            if (!creator.isSuperuser())
            {
                if (!creator.canCreateRole())
                    throw new PermissionDeniedException("Permission denied to create role: only roles with the CREATEROLE attribute may create roles");
                checkPrivilegedOptions(creator, options, "create");
            }

            Role role = roles.create(txn, name, options);
            if (!creator.isSuperuser())
            {
                // the creator administers what it created, without using its privileges
                MembershipEdge grantBack = graph.addEdge(txn, role.getId(), Grantee.role(actor), RoleId.BOOTSTRAP,
                                                         true, false, false, Scope.GLOBAL, null);
                if (!config.createrole_self_grant.isEmpty())
                    graph.addEdge(txn, role.getId(), Grantee.role(actor), actor, false,
                                  config.createrole_self_grant.contains(SELF_GRANT_INHERIT),
                                  config.createrole_self_grant.contains(SELF_GRANT_SET),
                                  Scope.GLOBAL, grantBack.getId());
            }
            txn.commit();
            logger.info("{} created {}", creator, role);
            return role;
        }
    }

    public Role alterRole(SessionAuthorizationContext session, String name, RoleOptions options)
    {
        try (Transaction txn = store.begin())
        {
            Role target = roles.require(txn, resolveRole(txn, session, name));
            RoleId actor = session.getActiveRole();
            boolean ownPassword = target.getId().equals(actor)
                                  && options.getOptions().keySet().equals(EnumSet.of(RoleOption.PASSWORD));
            if (!ownPassword)
            {
                checkAdministers(txn, actor, target, "alter");
                if (!roles.isSuperuser(txn, actor))
                    checkPrivilegedOptions(roles.require(txn, actor), options, "alter");
            }
            if (target.getId().equals(RoleId.BOOTSTRAP) && !options.getBoolean(RoleOption.SUPERUSER).orElse(true))
                throw new InvalidRequestException("The bootstrap user must have the SUPERUSER attribute");

            Role altered = roles.alter(txn, target, options);
            txn.commit();
            return altered;
        }
    }

    public Role renameRole(SessionAuthorizationContext session, String oldName, String newName)
    {
        try (Transaction txn = store.begin())
        {
            Role target = roles.require(txn, resolveRole(txn, session, oldName));
            if (target.getId().equals(session.getLoginRole()))
                throw new InvalidRequestException("Session user cannot be renamed");
            if (target.getId().equals(session.getActiveRole()))
                throw new InvalidRequestException("Current user cannot be renamed");
            if (isSystemRole(target))
                throw new InvalidNameException(String.format("Role name \"%s\" is reserved", target.getName()));
            checkAdministers(txn, session.getActiveRole(), target, "rename");

            Role renamed = roles.rename(txn, target, newName);
            txn.commit();
            return renamed;
        }
    }

    /**
     * Drops a role along with every membership edge it takes part in. Refused while the role
     * owns objects, is the grantee or grantor of a privilege grant, or granted a membership to
     * another role.
     *
     * @return whether the role existed
     */
    public boolean dropRole(SessionAuthorizationContext session, String name, boolean ifExists)
    {
        try (Transaction txn = store.begin())
        {
            Optional<Role> found = roles.byName(txn, name);
            if (!found.isPresent())
            {
                if (ifExists)
                {
                    logger.info("Role {} does not exist, skipping", name);
                    return false;
                }
                throw new InvalidRequestException(String.format("Role %s does not exist", name));
            }

            Role target = found.get();
            if (target.getId().equals(session.getLoginRole()))
                throw new InvalidRequestException("Session user cannot be dropped");
            if (target.getId().equals(session.getActiveRole()))
                throw new InvalidRequestException("Current user cannot be dropped");
            if (isSystemRole(target))
                throw new InvalidRequestException(String.format("Cannot drop role %s because it is required by the database system",
                                                                target.getName()));
            checkAdministers(txn, session.getActiveRole(), target, "drop");

            List<String> blockers = dropBlockers(txn, target.getId());
            if (!blockers.isEmpty())
                throw new DependencyException(String.format("Role \"%s\" cannot be dropped because some objects depend on it",
                                                            target.getName()),
                                              blockers);

            RevocationPlan<MembershipEdge> plan = graph.removeEdgesOf(txn, target.getId());
            roles.delete(txn, target);
            txn.commit();
            logger.info("Dropped {} and {} membership edges", target, plan.getRoots().size() + plan.getDependents().size());
            return true;
        }
    }

    /**
     * Sets a configuration override for a role, or for all roles when the role is null, in one
     * database or, when it is null, in every database.
     */
    public void setRoleConfig(SessionAuthorizationContext session, String role, String database, String setting, String value)
    {
        try (Transaction txn = store.begin())
        {
            RoleId target = checkConfigAuthority(txn, session, role);
            roles.setConfig(txn, target, database, setting, value);
            txn.commit();
        }
    }

    /**
     * Removes one configuration override, or all of them when the setting is null.
     */
    public void resetRoleConfig(SessionAuthorizationContext session, String role, String database, String setting)
    {
        try (Transaction txn = store.begin())
        {
            RoleId target = checkConfigAuthority(txn, session, role);
            if (setting == null)
                roles.resetAllConfig(txn, target, database);
            else
                roles.setConfig(txn, target, database, setting, null);
            txn.commit();
        }
    }

    /**
     * @return the overrides the session's login role starts with in its database
     */
    public Map<String, String> effectiveSettings(SessionAuthorizationContext session)
    {
        return roles.effectiveSettings(store.snapshot(), session.getLoginRole(), session.getDatabase());
    }

    public GrantResult grantPrivilege(SessionAuthorizationContext session,
                                      Set<Privilege> kinds,
                                      ObjectRef object,
                                      List<String> grantees,
                                      boolean withOption,
                                      String grantedBy)
    {
        try (Transaction txn = store.begin())
        {
            GrantResult result = privileges.grant(txn,
                                                  session.getActiveRole(),
                                                  kinds,
                                                  object,
                                                  resolveGrantees(txn, session, grantees),
                                                  withOption,
                                                  grantedBy == null ? null : resolveRole(txn, session, grantedBy),
                                                  session.scope());
            txn.commit();
            return result;
        }
    }

    public GrantResult revokePrivilege(SessionAuthorizationContext session,
                                       Set<Privilege> kinds,
                                       ObjectRef object,
                                       List<String> grantees,
                                       boolean optionOnly,
                                       boolean cascade,
                                       String grantedBy)
    {
        try (Transaction txn = store.begin())
        {
            GrantResult result = privileges.revoke(txn,
                                                   session.getActiveRole(),
                                                   kinds,
                                                   object,
                                                   resolveGrantees(txn, session, grantees),
                                                   optionOnly,
                                                   cascade,
                                                   grantedBy == null ? null : resolveRole(txn, session, grantedBy),
                                                   session.scope());
            txn.commit();
            return result;
        }
    }

    /**
     * Grants membership in a role. Options the command leaves unset keep the values of the
     * grantor's existing edge; on a new edge admin defaults to false, inherit to the member's
     * INHERIT attribute and set to true.
     *
     * @param scope Global, or the database the membership applies in; null means Global
     */
    public MembershipEdge grantMembership(SessionAuthorizationContext session,
                                          String role,
                                          String member,
                                          MembershipOptions options,
                                          Scope scope,
                                          String grantedBy)
    {
        Scope edgeScope = scope == null ? Scope.GLOBAL : scope;
        try (Transaction txn = store.begin())
        {
            RoleId granted = resolveRole(txn, session, role);
            Grantee grantee = resolveGrantee(txn, session, member);
            MembershipEdge authorising = membershipGrantor(txn, session, granted, edgeScope, grantedBy, "grant");
            RoleId grantor = authorising == null ? RoleId.BOOTSTRAP : authorising.getMember();

            MembershipEdge existing = grantee.isPublic() ? null : graph.findEdge(txn, granted, grantee.getRole(), edgeScope, grantor);
            boolean defaultInherit = grantee.isPublic() || roles.require(txn, grantee.getRole()).inheritsByDefault();
            boolean admin = pick(options.getAdmin(), existing == null ? null : existing.hasAdminOption(), false);
            boolean inherit = pick(options.getInherit(), existing == null ? null : existing.hasInheritOption(), defaultInherit);
            boolean set = pick(options.getSet(), existing == null ? null : existing.hasSetOption(), true);

            if (admin && authorising != null && !grantee.isPublic())
                graph.checkAdminCircularity(txn, authorising, grantee.getRole());

            MembershipEdge edge = graph.addEdge(txn, granted, grantee, grantor, admin, inherit, set, edgeScope,
                                                authorising == null ? null : authorising.getId());
            txn.commit();
            return edge;
        }
    }

    /**
     * Revokes a membership, or only one of its options when {@code option} is not null. A
     * superuser revoking without naming a grantor removes the membership whoever granted it.
     */
    public RevocationPlan<MembershipEdge> revokeMembership(SessionAuthorizationContext session,
                                                           String role,
                                                           String member,
                                                           OptionKind option,
                                                           boolean cascade,
                                                           Scope scope,
                                                           String grantedBy)
    {
        Scope edgeScope = scope == null ? Scope.GLOBAL : scope;
        try (Transaction txn = store.begin())
        {
            RoleId granted = resolveRole(txn, session, role);
            RoleId memberId = resolveRole(txn, session, member);
            MembershipEdge authorising = membershipGrantor(txn, session, granted, edgeScope, grantedBy, "revoke");
            RoleId grantor;
            if (authorising != null)
                grantor = authorising.getMember();
            else if (grantedBy == null)
                grantor = null;
            else
                grantor = RoleId.BOOTSTRAP;

            if (graph.matchingEdges(txn, granted, memberId, edgeScope, grantor).isEmpty())
                logger.warn("Role \"{}\" has not been granted membership in role \"{}\"{}",
                            roles.nameOf(txn, memberId), roles.nameOf(txn, granted),
                            grantor == null ? "" : " by role \"" + roles.nameOf(txn, grantor) + '"');

            RevocationPlan<MembershipEdge> plan = option == null
                                                  ? graph.removeEdge(txn, granted, memberId, edgeScope, grantor, cascade)
                                                  : graph.revokeOption(txn, granted, memberId, edgeScope, grantor, option, cascade);
            txn.commit();
            return plan;
        }
    }

    /**
     * Hands every object the old roles own to the new owner. The grants the old roles made on
     * those objects are re-recorded as made by the new owner.
     */
    public void reassignOwned(SessionAuthorizationContext session, List<String> oldRoles, String newRole)
    {
        try (Transaction txn = store.begin())
        {
            RoleId target = resolveRole(txn, session, newRole);
            checkHasPrivilegesOf(txn, session, target, "reassign objects");
            List<RoleId> sources = new ArrayList<>(oldRoles.size());
            for (String name : oldRoles)
            {
                RoleId old = resolveRole(txn, session, name);
                checkHasPrivilegesOf(txn, session, old, "reassign objects");
                sources.add(old);
            }

            for (RoleId old : sources)
            {
                int moved = 0;
                for (ObjectRef object : ImmutableSet.copyOf(ownership.objectsOwnedBy(old)))
                    moved += privileges.transferGrants(txn, object, old, target);
                ownership.reassignOwnership(old, target, session.scope());
                logger.info("Reassigned objects owned by {} to {} along with {} grants on them", old, target, moved);
            }
            txn.commit();
        }
    }

    /**
     * Drops every object the roles own along with every grant on those objects, and revokes
     * every privilege granted to the roles and every membership they granted to other roles.
     */
    public void dropOwned(SessionAuthorizationContext session, List<String> names)
    {
        List<RoleId> targets = new ArrayList<>(names.size());
        try (Transaction txn = store.begin())
        {
            for (String name : names)
            {
                RoleId role = resolveRole(txn, session, name);
                checkHasPrivilegesOf(txn, session, role, "drop objects");
                targets.add(role);
            }
            for (RoleId role : targets)
            {
                for (ObjectRef object : ImmutableSet.copyOf(ownership.objectsOwnedBy(role)))
                    privileges.revokeAllOn(txn, object);
                List<PrivilegeGrant> revoked = privileges.revokeAllFrom(txn, role);
                for (MembershipEdge edge : graph.edgesGrantedBy(txn, role))
                    if (!edge.getMember().equals(role))
                        graph.removeEdge(txn, edge.getGranted(), edge.getMember(), edge.getScope(), role, true);
                logger.info("Revoked {} privilege grants from {}", revoked.size(), role);
            }
            txn.commit();
        }
        for (RoleId role : targets)
            ownership.dropOwnedObjects(role, session.scope());
    }

    public boolean effectivePrivilege(SessionAuthorizationContext session, ObjectRef object, Privilege privilege)
    {
        return session.hasPrivilege(object, privilege);
    }

    /**
     * Resolves a role name or one of the CURRENT_USER, CURRENT_ROLE and SESSION_USER specifiers.
     */
    public RoleId resolveRole(ReadView view, SessionAuthorizationContext session, String name)
    {
        String specifier = name.toLowerCase(Locale.US);
        if (CURRENT_USER.equals(specifier) || CURRENT_ROLE.equals(specifier))
            return session.getActiveRole();
        if (SESSION_USER.equals(specifier))
            return session.getLoginRole();
        if (PUBLIC.equals(specifier))
            throw new InvalidRequestException("Role \"public\" does not exist");
        return roles.requireByName(view, name).getId();
    }

    public Grantee resolveGrantee(ReadView view, SessionAuthorizationContext session, String name)
    {
        return PUBLIC.equals(name.toLowerCase(Locale.US)) ? Grantee.PUBLIC : Grantee.role(resolveRole(view, session, name));
    }

    public RoleDirectory roles()
    {
        return roles;
    }

    public MembershipGraph graph()
    {
        return graph;
    }

    public PrivilegeManager privileges()
    {
        return privileges;
    }

    @VisibleForTesting
    public KeyValueStore store()
    {
        return store;
    }

    private List<Grantee> resolveGrantees(ReadView view, SessionAuthorizationContext session, List<String> names)
    {
        if (names.isEmpty())
            throw new InvalidRequestException("At least one grantee is required");
        ImmutableList.Builder<Grantee> grantees = ImmutableList.builder();
        for (String name : names)
            grantees.add(resolveGrantee(view, session, name));
        return grantees.build();
    }

    /**
     * Finds the admin edge a membership grant or revoke is made through. Null means the command
     * is made with superuser authority and recorded as granted by the bootstrap superuser.
     */
    private MembershipEdge membershipGrantor(ReadView view,
                                             SessionAuthorizationContext session,
                                             RoleId granted,
                                             Scope scope,
                                             String grantedBy,
                                             String verb)
    {
        RoleId actor = session.getActiveRole();
        Scope adminScope = MembershipGraph.adminScope(scope, session.getDatabase());
        if (grantedBy != null)
        {
            RoleId named = resolveRole(view, session, grantedBy);
            if (!graph.hasPrivilegesOfRole(view, actor, named, session.scope()))
                throw new PermissionDeniedException(String.format("Permission denied to %s role \"%s\": must inherit privileges of role \"%s\"",
                                                                  verb, roles.nameOf(view, granted), roles.nameOf(view, named)));
            if (roles.isSuperuser(view, named))
                return null;
            MembershipEdge edge = graph.findAdminEdge(view, named, granted, adminScope);
            if (edge == null)
                throw new PermissionDeniedException(String.format("Permission denied to %s role \"%s\": grantor must have ADMIN OPTION",
                                                                  verb, roles.nameOf(view, granted)));
            return edge;
        }

        if (roles.isSuperuser(view, actor))
            return null;
        return graph.selectBestAdmin(view, actor, granted, adminScope)
                    .orElseThrow(() -> new PermissionDeniedException(String.format("Permission denied to %s role \"%s\": only roles with the ADMIN option on role \"%s\" in %s may %s this role",
                                                                                   verb, roles.nameOf(view, granted), roles.nameOf(view, granted), adminScope, verb)));
    }

    /**
     * Superusers administer every role; anyone else needs CREATEROLE and the admin option on a
     * role which is not a superuser.
     */
    private void checkAdministers(ReadView view, RoleId actor, Role target, String verb)
    {
        if (roles.isSuperuser(view, actor))
            return;
        if (target.isSuperuser())
            throw new PermissionDeniedException(String.format("Permission denied to %s role \"%s\": only roles with the SUPERUSER attribute may %s roles with the SUPERUSER attribute",
                                                              verb, target.getName(), verb));
        Role role = roles.require(view, actor);
        if (!role.canCreateRole() || !graph.selectBestAdmin(view, actor, target.getId(), Scope.GLOBAL).isPresent())
            throw new PermissionDeniedException(String.format("Permission denied to %s role \"%s\": only roles with the CREATEROLE attribute and the ADMIN option on role \"%s\" may %s this role",
                                                              verb, target.getName(), target.getName(), verb));
    }

    private void checkPrivilegedOptions(Role actor, RoleOptions options, String verb)
    {
        for (RoleOption option : RoleOption.values())
        {
            if (option.requiresSuperuser() && options.has(option))
                throw new PermissionDeniedException(String.format("Permission denied to %s role: only roles with the SUPERUSER attribute may change the %s attribute",
                                                                  verb, option));
        }
        if (options.has(RoleOption.CREATEDB) && !actor.canCreateDb())
            throw new PermissionDeniedException(String.format("Permission denied to %s role: only roles with the CREATEDB attribute may change the CREATEDB attribute",
                                                              verb));
    }

    private RoleId checkConfigAuthority(ReadView view, SessionAuthorizationContext session, String role)
    {
        RoleId actor = session.getActiveRole();
        if (role == null)
        {
            if (!roles.isSuperuser(view, actor))
                throw new PermissionDeniedException("Permission denied to alter setting: only roles with the SUPERUSER attribute may alter settings globally");
            return null;
        }

        Role target = roles.require(view, resolveRole(view, session, role));
        if (!target.getId().equals(actor))
            checkAdministers(view, actor, target, "alter");
        else if (target.isSuperuser() && !roles.isSuperuser(view, actor))
            throw new PermissionDeniedException("Permission denied to alter role");
        return target.getId();
    }

    private void checkHasPrivilegesOf(ReadView view, SessionAuthorizationContext session, RoleId role, String verb)
    {
        if (!graph.hasPrivilegesOfRole(view, session.getActiveRole(), role, session.scope()))
            throw new PermissionDeniedException(String.format("Permission denied to %s: only roles with privileges of role \"%s\" may %s owned by it",
                                                              verb, roles.nameOf(view, role), verb));
    }

    private List<String> dropBlockers(ReadView view, RoleId role)
    {
        List<String> blockers = new ArrayList<>();
        for (ObjectRef object : ownership.objectsOwnedBy(role))
            blockers.add("owner of " + object);
        for (PrivilegeGrant grant : privileges.grantsTo(view, Grantee.role(role)))
            blockers.add(privileges.describe(view, grant));
        for (PrivilegeGrant grant : privileges.grantsBy(view, role))
            blockers.add(privileges.describe(view, grant));
        for (MembershipEdge edge : graph.edgesGrantedBy(view, role))
            if (!edge.getMember().equals(role) && !edge.getGranted().equals(role))
                blockers.add(graph.describe(view, edge));
        return blockers;
    }

    private boolean isSystemRole(Role role)
    {
        return role.getId().equals(RoleId.BOOTSTRAP) || PredefinedRoles.NAMES.containsKey(role.getId());
    }

    private static boolean pick(Boolean requested, Boolean existing, boolean fallback)
    {
        if (requested != null)
            return requested;
        return existing != null ? existing : fallback;
    }
}
