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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.rolegraph.auth.Grantee;
import org.rolegraph.auth.PredefinedRoles;
import org.rolegraph.auth.RoleDirectory;
import org.rolegraph.auth.RoleId;
import org.rolegraph.auth.Scope;
import org.rolegraph.auth.membership.MembershipGraph;
import org.rolegraph.auth.revocation.DependencyEngine;
import org.rolegraph.auth.revocation.DependencyModel;
import org.rolegraph.auth.revocation.RevocationPlan;
import org.rolegraph.exceptions.InvalidGranteeException;
import org.rolegraph.exceptions.PermissionDeniedException;
import org.rolegraph.metrics.AuthMetrics;
import org.rolegraph.store.EntityType;
import org.rolegraph.store.LookupTableSupport;
import org.rolegraph.store.ReadView;
import org.rolegraph.store.Sequences;
import org.rolegraph.store.StoreKey;
import org.rolegraph.store.Transaction;

/**
 * Stores privilege grants and answers privilege checks.
 *
 * A grant is made on behalf of exactly one grantor. Superusers, and roles holding the
 * privileges of an object's owner, grant as the owner (or as the bootstrap superuser for
 * objects nobody owns) and their grants depend on nothing. Anyone else grants through grant
 * options held directly by themselves or by a role whose privileges they inherit; the role
 * holding the most of the requested options is chosen, preferring the acting role itself and
 * then the lowest role id. Every such grant records the grant it was authorised by, which is
 * what revocation follows.
 */
public class PrivilegeManager
{
    private static final Logger logger = LoggerFactory.getLogger(PrivilegeManager.class);

    private static final String NO_PARENT = "";

    private final LookupTableSupport<PrivilegeGrant> grants =
        LookupTableSupport.<PrivilegeGrant>builder(EntityType.GRANT, PrivilegeGrant::getId)
                          .index(EntityType.GRANT_BY_OBJECT, g -> ImmutableList.<String>builder()
                                                                               .addAll(g.getObject().toKey())
                                                                               .add(g.getPrivilege().name())
                                                                               .add(g.getGrantee().toKey())
                                                                               .add(g.getGrantor().toKey())
                                                                               .build())
                          .index(EntityType.GRANT_BY_GRANTEE, g -> ImmutableList.of(g.getGrantee().toKey(),
                                                                                    StoreKey.encode(g.getId())))
                          .index(EntityType.GRANT_BY_GRANTOR, g -> ImmutableList.of(g.getGrantor().toKey(),
                                                                                    StoreKey.encode(g.getId())))
                          .index(EntityType.GRANT_BY_PARENT, g -> ImmutableList.of(g.getParent() == null
                                                                                   ? NO_PARENT
                                                                                   : StoreKey.encode(g.getParent()),
                                                                                   StoreKey.encode(g.getId())))
                          .build();

    private final RoleDirectory roles;
    private final MembershipGraph graph;
    private final IObjectOwnership ownership;
    private final DependencyEngine<PrivilegeGrant> dependencies = new DependencyEngine<>(new GrantDependencies());

    public PrivilegeManager(RoleDirectory roles, MembershipGraph graph, IObjectOwnership ownership)
    {
        this.roles = roles;
        this.graph = graph;
        this.ownership = ownership;
    }

    /**
     * Grants the privileges on the object to each grantee. Privileges the chosen grantor holds
     * no grant option for are skipped with a warning.
     *
     * @param grantedBy the role to grant as, which must be one whose privileges the actor
     *                  holds; null to choose one
     * @throws PermissionDeniedException if the actor holds no privilege at all on the object
     * @throws InvalidGranteeException if a grant option is given to PUBLIC, or back to a role
     * the grantor's own option derives from
     */
    public GrantResult grant(Transaction txn,
                             RoleId actor,
                             Set<Privilege> privileges,
                             ObjectRef object,
                             List<Grantee> grantees,
                             boolean withOption,
                             RoleId grantedBy,
                             Scope scope)
    {
        object.validate(privileges);
        if (withOption && grantees.contains(Grantee.PUBLIC))
            throw new InvalidGranteeException("Grant options can only be granted to roles");

        Grantor grantor = chooseGrantor(txn, actor, privileges, object, grantedBy, scope);
        List<PartialGrantWarning> warnings = new ArrayList<>();
        checkHeld(txn, actor, object, privileges, grantor, scope, warnings);

        List<PrivilegeGrant> affected = new ArrayList<>();
        for (Grantee grantee : grantees)
        {
            for (Privilege privilege : sorted(grantor.held))
            {
                Long parent = grantor.asOwner ? null : chooseParent(txn, grantor.role, grantee, object, privilege, withOption);
                PrivilegeGrant row = upsert(txn, object, privilege, grantee, grantor.role, withOption, parent);
                if (row != null)
                    affected.add(row);
            }
        }
        logger.debug("{} granted {} on {} to {} as {}{}", actor, grantor.held, object, grantees, grantor.role,
                     withOption ? " with grant option" : "");
        return new GrantResult(affected, ImmutableList.of(), warnings);
    }

    /**
     * Revokes the privileges, or only their grant option, that the revoking grantor gave each
     * grantee. Revoking a table privilege also revokes the same grantor's grants of it on the
     * table's columns. Grants made through the revoked ones are removed too when cascade is
     * set, unless their grantor still holds the option through some other grant.
     *
     * @throws org.rolegraph.exceptions.DependencyException if dependent grants exist and
     * cascade is not set
     */
    public GrantResult revoke(Transaction txn,
                              RoleId actor,
                              Set<Privilege> privileges,
                              ObjectRef object,
                              List<Grantee> grantees,
                              boolean optionOnly,
                              boolean cascade,
                              RoleId grantedBy,
                              Scope scope)
    {
        object.validate(privileges);
        RoleId revoker = chooseRevoker(txn, actor, privileges, object, grantees, grantedBy, scope);

        List<PrivilegeGrant> targets = new ArrayList<>();
        List<PartialGrantWarning> warnings = new ArrayList<>();
        for (Grantee grantee : grantees)
        {
            for (Privilege privilege : sorted(privileges))
            {
                List<PrivilegeGrant> found = revocable(txn, object, privilege, grantee, revoker);
                if (found.isEmpty())
                {
                    String message = String.format("No privileges could be revoked for %s on %s from %s",
                                                   privilege, object, grantee);
                    logger.warn(message);
                    warnings.add(new PartialGrantWarning(object, privilege, message));
                }
                targets.addAll(found);
            }
        }

        RevocationPlan<PrivilegeGrant> plan;
        if (optionOnly)
        {
            List<PrivilegeGrant> stripped = new ArrayList<>();
            for (PrivilegeGrant target : targets)
                if (target.hasGrantOption())
                    stripped.add(target);
            plan = dependencies.plan(txn, ImmutableList.of(), stripped);
        }
        else
        {
            plan = dependencies.plan(txn, targets, ImmutableList.of());
        }

        if (!cascade)
            dependencies.checkRestrict(txn, plan, "revoke");
        dependencies.apply(txn, plan);

        logger.debug("{} revoked {}{} on {} from {} as {}", actor, optionOnly ? "grant option for " : "",
                     privileges, object, grantees, revoker);
        List<PrivilegeGrant> affected = new ArrayList<>(plan.getRoots());
        affected.addAll(plan.getStripped());
        return new GrantResult(affected, plan.getDependents(), warnings);
    }

    /**
     * Removes every grant made to the role, along with the grants which depended on them.
     */
    public List<PrivilegeGrant> revokeAllFrom(Transaction txn, RoleId role)
    {
        RevocationPlan<PrivilegeGrant> plan = dependencies.plan(txn, grantsTo(txn, Grantee.role(role)), ImmutableList.of());
        dependencies.apply(txn, plan);
        List<PrivilegeGrant> removed = new ArrayList<>(plan.getRoots());
        removed.addAll(plan.getDependents());
        return removed;
    }

    /**
     * Removes every grant on the object and, for a table, on its columns, whoever made them.
     */
    public List<PrivilegeGrant> revokeAllOn(Transaction txn, ObjectRef object)
    {
        RevocationPlan<PrivilegeGrant> plan = dependencies.plan(txn, grantsOn(txn, object), ImmutableList.of());
        dependencies.apply(txn, plan);
        List<PrivilegeGrant> removed = new ArrayList<>(plan.getRoots());
        removed.addAll(plan.getDependents());
        return removed;
    }

    /**
     * Re-records the grants the previous owner made on the object as made by the new owner.
     * Where the new owner already granted the same privilege to the same grantee the two rows
     * are merged, keeping the grant option if either had it, and grants made through the
     * dropped row move onto the kept one.
     *
     * @return the number of grants moved or merged
     */
    public int transferGrants(Transaction txn, ObjectRef object, RoleId from, RoleId to)
    {
        int moved = 0;
        for (PrivilegeGrant listed : grantsOn(txn, object))
        {
            PrivilegeGrant grant = grants.get(txn, listed.getId());
            if (grant == null || !grant.getGrantor().equals(from))
                continue;

            PrivilegeGrant existing = find(txn, grant.getObject(), grant.getPrivilege(), grant.getGrantee(), to);
            if (existing == null)
            {
                grants.update(txn, grant, grant.withGrantor(to).withParent(null));
            }
            else
            {
                if (grant.hasGrantOption() && !existing.hasGrantOption())
                    grants.update(txn, existing, existing.withGrantOption(true));
                for (PrivilegeGrant dependent : grants.lookup(txn, EntityType.GRANT_BY_PARENT, StoreKey.encode(grant.getId())))
                    grants.update(txn, dependent, dependent.withParent(existing.getId()));
                grants.delete(txn, grant);
            }
            moved++;
        }
        if (moved > 0)
            logger.debug("Moved {} grants on {} from {} to {}", moved, object, from, to);
        return moved;
    }

    /**
     * The check every guarded operation makes: whether the role, or any role whose privileges it
     * inherits in the scope, or PUBLIC, holds the privilege on the object. Superusers, roles
     * holding the owner's privileges and members of the predefined data roles pass without a
     * grant. A column privilege is also held through the same privilege on its table.
     */
    public boolean effectivePrivilege(ReadView view, RoleId actor, ObjectRef object, Privilege privilege, Scope scope)
    {
        long start = System.nanoTime();
        boolean granted = hasPrivilege(view, actor, object, privilege, scope);
        AuthMetrics.instance.markCheck(granted, System.nanoTime() - start);
        if (!granted)
            logger.trace("{} does not hold {} on {} in {}", actor, privilege, object, scope);
        return granted;
    }

    public Set<Privilege> effectivePrivileges(ReadView view, RoleId actor, ObjectRef object, Scope scope)
    {
        Set<Privilege> held = EnumSet.noneOf(Privilege.class);
        for (Privilege privilege : object.applicablePrivileges())
            if (hasPrivilege(view, actor, object, privilege, scope))
                held.add(privilege);
        return held;
    }

    public List<PrivilegeGrant> grantsTo(ReadView view, Grantee grantee)
    {
        return grants.lookup(view, EntityType.GRANT_BY_GRANTEE, grantee.toKey());
    }

    public List<PrivilegeGrant> grantsBy(ReadView view, RoleId grantor)
    {
        return grants.lookup(view, EntityType.GRANT_BY_GRANTOR, grantor.toKey());
    }

    /**
     * @return the grants on the object and, for a table, on its columns
     */
    public List<PrivilegeGrant> grantsOn(ReadView view, ObjectRef object)
    {
        List<String> key = object.toKey();
        return object.isColumn()
               ? grants.lookup(view, EntityType.GRANT_BY_OBJECT, key.get(0), key.get(1), key.get(2))
               : grants.lookup(view, EntityType.GRANT_BY_OBJECT, key.get(0), key.get(1));
    }

    public PrivilegeGrant find(ReadView view, ObjectRef object, Privilege privilege, Grantee grantee, RoleId grantor)
    {
        List<PrivilegeGrant> found = grants.lookup(view, EntityType.GRANT_BY_OBJECT,
                                                   objectKey(object, privilege, grantee.toKey(), grantor.toKey()));
        return found.isEmpty() ? null : found.get(0);
    }

    public String describe(ReadView view, PrivilegeGrant grant)
    {
        return String.format("privilege %s on %s granted to %s by %s",
                             grant.getPrivilege(), grant.getObject(),
                             grant.getGrantee().isPublic() ? "PUBLIC" : roles.nameOf(view, grant.getGrantee().getRole()),
                             roles.nameOf(view, grant.getGrantor()));
    }

    private boolean hasPrivilege(ReadView view, RoleId actor, ObjectRef object, Privilege privilege, Scope scope)
    {
        if (roles.isSuperuser(view, actor))
            return true;

        Set<RoleId> closure = graph.inheritedClosure(view, actor, scope);
        Optional<RoleId> owner = ownership.ownerOf(object.withoutColumn());
        if (owner.isPresent() && closure.contains(owner.get()))
            return true;

        if (PredefinedRoles.impliesPrivilege(closure, object, privilege))
            return true;

        if (grantedToAny(view, closure, object, privilege))
            return true;

        return object.isColumn() && grantedToAny(view, closure, object.withoutColumn(), privilege);
    }

    private boolean grantedToAny(ReadView view, Set<RoleId> closure, ObjectRef object, Privilege privilege)
    {
        for (PrivilegeGrant grant : grants.lookup(view, EntityType.GRANT_BY_OBJECT, objectKey(object, privilege)))
        {
            Grantee grantee = grant.getGrantee();
            if (grantee.isPublic() || closure.contains(grantee.getRole()))
                return true;
        }
        return false;
    }

    private Grantor chooseGrantor(ReadView view,
                                  RoleId actor,
                                  Set<Privilege> privileges,
                                  ObjectRef object,
                                  RoleId grantedBy,
                                  Scope scope)
    {
        RoleId subject = grantedBy == null ? actor : checkGrantedBy(view, actor, grantedBy, scope);
        Optional<RoleId> owner = ownerAuthority(view, subject, object, scope);
        if (owner.isPresent())
            return new Grantor(owner.get(), privileges, true);

        List<RoleId> candidates = grantedBy == null ? candidates(view, actor, scope) : ImmutableList.of(grantedBy);
        Grantor best = null;
        for (RoleId candidate : candidates)
        {
            Set<Privilege> held = EnumSet.noneOf(Privilege.class);
            for (Privilege privilege : privileges)
                if (!optionGrants(view, candidate, object, privilege).isEmpty())
                    held.add(privilege);
            if (best == null || held.size() > best.held.size())
                best = new Grantor(candidate, held, false);
        }
        return best;
    }

    private RoleId chooseRevoker(ReadView view,
                                 RoleId actor,
                                 Set<Privilege> privileges,
                                 ObjectRef object,
                                 List<Grantee> grantees,
                                 RoleId grantedBy,
                                 Scope scope)
    {
        RoleId subject = grantedBy == null ? actor : checkGrantedBy(view, actor, grantedBy, scope);
        Optional<RoleId> owner = ownerAuthority(view, subject, object, scope);
        if (owner.isPresent())
            return owner.get();
        if (grantedBy != null)
            return grantedBy;

        for (RoleId candidate : candidates(view, actor, scope))
            for (Grantee grantee : grantees)
                for (Privilege privilege : privileges)
                    if (!revocable(view, object, privilege, grantee, candidate).isEmpty())
                        return candidate;

        if (effectivePrivileges(view, actor, object, scope).isEmpty())
            throw new PermissionDeniedException(String.format("Permission denied for %s", object));
        return actor;
    }

    private RoleId checkGrantedBy(ReadView view, RoleId actor, RoleId grantedBy, Scope scope)
    {
        if (!roles.isSuperuser(view, actor) && !graph.inheritedClosure(view, actor, scope).contains(grantedBy))
            throw new PermissionDeniedException(String.format("Must inherit privileges of role \"%s\"",
                                                              roles.nameOf(view, grantedBy)));
        return grantedBy;
    }

    /**
     * @return the owner, or the bootstrap superuser for unowned objects, if the role may act
     * with the owner's authority
     */
    private Optional<RoleId> ownerAuthority(ReadView view, RoleId role, ObjectRef object, Scope scope)
    {
        Optional<RoleId> owner = ownership.ownerOf(object.withoutColumn());
        if (roles.isSuperuser(view, role))
            return Optional.of(owner.orElse(RoleId.BOOTSTRAP));
        if (owner.isPresent() && graph.inheritedClosure(view, role, scope).contains(owner.get()))
            return owner;
        return Optional.empty();
    }

    /**
     * @return the actor followed by the other roles whose privileges it inherits, lowest id first
     */
    private List<RoleId> candidates(ReadView view, RoleId actor, Scope scope)
    {
        List<RoleId> others = new ArrayList<>(graph.inheritedClosure(view, actor, scope));
        others.remove(actor);
        others.sort(Comparator.naturalOrder());
        return ImmutableList.<RoleId>builder().add(actor).addAll(others).build();
    }

    private void checkHeld(ReadView view,
                           RoleId actor,
                           ObjectRef object,
                           Set<Privilege> requested,
                           Grantor grantor,
                           Scope scope,
                           List<PartialGrantWarning> warnings)
    {
        if (grantor.held.isEmpty() && effectivePrivileges(view, actor, object, scope).isEmpty())
            throw new PermissionDeniedException(String.format("Permission denied for %s", object));

        Set<Privilege> missing = Sets.difference(requested, grantor.held);
        if (missing.isEmpty())
            return;

        AuthMetrics.instance.markPartialGrant();
        for (Privilege privilege : sorted(missing))
        {
            String message = String.format("No privileges were granted for %s on %s", privilege, object);
            logger.warn(message);
            warnings.add(new PartialGrantWarning(object, privilege, message));
        }
    }

    /**
     * Picks the lowest id grant option held by the grantor that does not itself derive from the
     * grantee. Only a grant carrying the grant option can close a loop, so without one any of
     * the grantor's options will do.
     */
    private Long chooseParent(ReadView view,
                              RoleId grantor,
                              Grantee grantee,
                              ObjectRef object,
                              Privilege privilege,
                              boolean withOption)
    {
        List<PrivilegeGrant> options = optionGrants(view, grantor, object, privilege);
        assert !options.isEmpty() : "grantor was chosen for holding this option";
        for (PrivilegeGrant option : options)
            if (!withOption || !chainContains(view, option, grantee))
                return option.getId();

        throw new InvalidGranteeException("Grant options cannot be granted back to your own grantor");
    }

    private boolean chainContains(ReadView view, PrivilegeGrant start, Grantee grantee)
    {
        Set<Long> seen = new HashSet<>();
        PrivilegeGrant grant = start;
        while (grant != null && seen.add(grant.getId()))
        {
            if (grant.getGrantee().equals(grantee) || Grantee.role(grant.getGrantor()).equals(grantee))
                return true;
            grant = grant.getParent() == null ? null : grants.get(view, grant.getParent());
        }
        return false;
    }

    /**
     * @return the grants giving the role itself the privilege with grant option, on the object
     * or, for a column, on its table, lowest id first
     */
    private List<PrivilegeGrant> optionGrants(ReadView view, RoleId role, ObjectRef object, Privilege privilege)
    {
        List<PrivilegeGrant> options = new ArrayList<>();
        addOptionGrants(view, role, object, privilege, options);
        if (object.isColumn())
            addOptionGrants(view, role, object.withoutColumn(), privilege, options);
        options.sort(Comparator.comparingLong(PrivilegeGrant::getId));
        return options;
    }

    private void addOptionGrants(ReadView view, RoleId role, ObjectRef object, Privilege privilege, List<PrivilegeGrant> into)
    {
        for (PrivilegeGrant grant : grants.lookup(view, EntityType.GRANT_BY_OBJECT,
                                                  objectKey(object, privilege, Grantee.role(role).toKey())))
        {
            if (grant.hasGrantOption())
                into.add(grant);
        }
    }

    /**
     * @return the grantor's grant of the privilege to the grantee and, when the object is a
     * table, its grants of the privilege on the table's columns
     */
    private List<PrivilegeGrant> revocable(ReadView view, ObjectRef object, Privilege privilege, Grantee grantee, RoleId grantor)
    {
        List<PrivilegeGrant> found = new ArrayList<>();
        PrivilegeGrant exact = find(view, object, privilege, grantee, grantor);
        if (exact != null)
            found.add(exact);
        if (!object.isColumn() && object.getType() == ObjectType.TABLE)
        {
            for (PrivilegeGrant grant : grantsOn(view, object))
            {
                if (grant.getObject().isColumn()
                    && grant.getPrivilege() == privilege
                    && grant.getGrantee().equals(grantee)
                    && grant.getGrantor().equals(grantor))
                    found.add(grant);
            }
        }
        return found;
    }

    private PrivilegeGrant upsert(Transaction txn,
                                  ObjectRef object,
                                  Privilege privilege,
                                  Grantee grantee,
                                  RoleId grantor,
                                  boolean withOption,
                                  Long parent)
    {
        PrivilegeGrant existing = find(txn, object, privilege, grantee, grantor);
        if (existing == null)
        {
            PrivilegeGrant grant = new PrivilegeGrant(Sequences.next(txn, "grant_id", 1),
                                                      object, privilege, grantee, grantor, withOption, parent);
            grants.insert(txn, grant);
            return grant;
        }

        if (withOption && !existing.hasGrantOption())
        {
            PrivilegeGrant updated = existing.withGrantOption(true).withParent(parent);
            grants.update(txn, existing, updated);
            return updated;
        }
        return null;
    }

    private static List<String> objectKey(ObjectRef object, Privilege privilege, String... more)
    {
        return ImmutableList.<String>builder().addAll(object.toKey()).add(privilege.name()).add(more).build();
    }

    private static List<Privilege> sorted(Set<Privilege> privileges)
    {
        List<Privilege> list = new ArrayList<>(privileges);
        list.sort(Comparator.naturalOrder());
        return list;
    }

    private static final class Grantor
    {
        private final RoleId role;
        private final Set<Privilege> held;
        private final boolean asOwner;

        private Grantor(RoleId role, Set<Privilege> held, boolean asOwner)
        {
            this.role = role;
            this.held = held;
            this.asOwner = asOwner;
        }
    }

    private final class GrantDependencies implements DependencyModel<PrivilegeGrant>
    {
        public long idOf(PrivilegeGrant grant)
        {
            return grant.getId();
        }

        public Long parentOf(PrivilegeGrant grant)
        {
            return grant.getParent();
        }

        public PrivilegeGrant byId(ReadView view, long id)
        {
            return grants.get(view, id);
        }

        public List<PrivilegeGrant> dependentsOf(ReadView view, PrivilegeGrant grant)
        {
            return grants.lookup(view, EntityType.GRANT_BY_PARENT, StoreKey.encode(grant.getId()));
        }

        public List<PrivilegeGrant> alternativeParents(ReadView view, PrivilegeGrant dependent)
        {
            return optionGrants(view, dependent.getGrantor(), dependent.getObject(), dependent.getPrivilege());
        }

        public void remove(Transaction txn, PrivilegeGrant grant)
        {
            PrivilegeGrant current = grants.get(txn, grant.getId());
            if (current != null)
            {
                grants.delete(txn, current);
                logger.debug("Removed {}", current);
            }
        }

        public void strip(Transaction txn, PrivilegeGrant grant)
        {
            PrivilegeGrant current = grants.get(txn, grant.getId());
            if (current != null)
                grants.update(txn, current, current.withGrantOption(false));
        }

        public void reparent(Transaction txn, PrivilegeGrant grant, PrivilegeGrant newParent)
        {
            PrivilegeGrant current = grants.get(txn, grant.getId());
            if (current != null)
            {
                grants.update(txn, current, current.withParent(newParent.getId()));
                logger.debug("Re-parented {} onto grant {}", current, newParent.getId());
            }
        }

        public String describe(ReadView view, PrivilegeGrant grant)
        {
            return PrivilegeManager.this.describe(view, grant);
        }
    }
}
