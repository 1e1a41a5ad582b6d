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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.rolegraph.auth.Grantee;
import org.rolegraph.auth.RoleDirectory;
import org.rolegraph.auth.RoleId;
import org.rolegraph.auth.Scope;
import org.rolegraph.auth.cache.ClosureCache;
import org.rolegraph.auth.revocation.DependencyEngine;
import org.rolegraph.auth.revocation.DependencyModel;
import org.rolegraph.auth.revocation.RevocationPlan;
import org.rolegraph.exceptions.CycleException;
import org.rolegraph.exceptions.InvalidGranteeException;
import org.rolegraph.store.EntityType;
import org.rolegraph.store.LookupTableSupport;
import org.rolegraph.store.ReadView;
import org.rolegraph.store.Sequences;
import org.rolegraph.store.StoreKey;
import org.rolegraph.store.Transaction;

/**
 * The membership edges between roles, stored as rows keyed by edge id with indexes by granted
 * role, by member, by grantor and by parent edge. Traversals always start from a role id and
 * read edges through the indexes; nothing holds on to edges between calls.
 *
 * Edges are directed from member to granted role. Global edges are visible in every scope,
 * database edges only in their own database, and no role may reach itself through the Global
 * edges together with the edges of any single database.
 */
public class MembershipGraph
{
    private static final Logger logger = LoggerFactory.getLogger(MembershipGraph.class);

    private static final String NO_PARENT = "";

    private final LookupTableSupport<MembershipEdge> edges =
        LookupTableSupport.<MembershipEdge>builder(EntityType.EDGE, MembershipEdge::getId)
                          .index(EntityType.EDGE_BY_ROLE, e -> ImmutableList.of(e.getGranted().toKey(),
                                                                                e.getMember().toKey(),
                                                                                e.getScope().toKey(),
                                                                                e.getGrantor().toKey()))
                          .index(EntityType.EDGE_BY_MEMBER, e -> ImmutableList.of(e.getMember().toKey(),
                                                                                  e.getGranted().toKey(),
                                                                                  e.getScope().toKey(),
                                                                                  e.getGrantor().toKey()))
                          .index(EntityType.EDGE_BY_GRANTOR, e -> ImmutableList.of(e.getGrantor().toKey(),
                                                                                   StoreKey.encode(e.getId())))
                          .index(EntityType.EDGE_BY_PARENT, e -> ImmutableList.of(parentKey(e.getParent()),
                                                                                  StoreKey.encode(e.getId())))
                          .build();

    private final RoleDirectory roles;
    private final ClosureCache cache;
    private final DependencyEngine<MembershipEdge> dependencies = new DependencyEngine<>(new EdgeDependencies());

    public MembershipGraph(RoleDirectory roles, ClosureCache cache)
    {
        this.roles = roles;
        this.cache = cache;
    }

    /**
     * Inserts an edge, or replaces the options of the edge with the same granted role, member,
     * scope and grantor.
     *
     * @throws InvalidGranteeException if the member is PUBLIC or the granted role itself
     * @throws CycleException if the granted role can already reach the member
     */
    public MembershipEdge addEdge(Transaction txn,
                                  RoleId granted,
                                  Grantee member,
                                  RoleId grantor,
                                  boolean admin,
                                  boolean inherit,
                                  boolean set,
                                  Scope scope,
                                  Long parent)
    {
        if (member.isPublic())
            throw new InvalidGranteeException("Role membership cannot be granted to PUBLIC");
        RoleId memberId = member.getRole();
        if (granted.equals(memberId))
            throw new InvalidGranteeException(String.format("Role %s cannot be granted to itself",
                                                            roles.nameOf(txn, granted)));

        MembershipEdge existing = findEdge(txn, granted, memberId, scope, grantor);
        if (existing == null)
        {
            if (reaches(txn, granted, memberId, scope))
                throw new CycleException(String.format("Role %s is a member of role %s",
                                                       roles.nameOf(txn, granted), roles.nameOf(txn, memberId)));
            MembershipEdge edge = new MembershipEdge(Sequences.next(txn, "edge_id", 1),
                                                     granted, memberId, grantor, admin, inherit, set, scope, parent);
            edges.insert(txn, edge);
            logger.debug("Added {}", edge);
            return edge;
        }

        MembershipEdge updated = existing.withOptions(admin, inherit, set);
        if (existing.getParent() == null && parent != null && !grantor.equals(RoleId.BOOTSTRAP))
            updated = updated.withParent(parent);
        if (!updated.equals(existing))
        {
            edges.update(txn, existing, updated);
            logger.debug("Updated {}", updated);
        }
        return updated;
    }

    /**
     * Removes the edges for (granted, member, scope) made by the grantor, or by every grantor
     * when it is null, along with the edges which depend on them.
     *
     * @throws org.rolegraph.exceptions.DependencyException if dependent edges exist and
     * cascade is not set
     */
    public RevocationPlan<MembershipEdge> removeEdge(Transaction txn,
                                                     RoleId granted,
                                                     RoleId member,
                                                     Scope scope,
                                                     RoleId grantor,
                                                     boolean cascade)
    {
        List<MembershipEdge> matching = matchingEdges(txn, granted, member, scope, grantor);
        RevocationPlan<MembershipEdge> plan = dependencies.plan(txn, matching, ImmutableList.of());
        if (!cascade)
            dependencies.checkRestrict(txn, plan, "revoke membership");
        dependencies.apply(txn, plan);
        return plan;
    }

    /**
     * Clears one option of the matching edges. Clearing the admin option affects the edges made
     * through it exactly as removing the edge would.
     */
    public RevocationPlan<MembershipEdge> revokeOption(Transaction txn,
                                                       RoleId granted,
                                                       RoleId member,
                                                       Scope scope,
                                                       RoleId grantor,
                                                       OptionKind option,
                                                       boolean cascade)
    {
        List<MembershipEdge> matching = matchingEdges(txn, granted, member, scope, grantor);
        if (option == OptionKind.ADMIN)
        {
            List<MembershipEdge> stripped = new ArrayList<>();
            for (MembershipEdge edge : matching)
                if (edge.hasAdminOption())
                    stripped.add(edge);
            RevocationPlan<MembershipEdge> plan = dependencies.plan(txn, ImmutableList.of(), stripped);
            if (!cascade)
                dependencies.checkRestrict(txn, plan, "revoke admin option");
            dependencies.apply(txn, plan);
            return plan;
        }

        for (MembershipEdge edge : matching)
        {
            MembershipEdge updated = option == OptionKind.INHERIT
                                     ? edge.withOptions(edge.hasAdminOption(), false, edge.hasSetOption())
                                     : edge.withOptions(edge.hasAdminOption(), edge.hasInheritOption(), false);
            edges.update(txn, edge, updated);
            logger.debug("Cleared {} option of {}", option, edge);
        }
        return dependencies.plan(txn, ImmutableList.of(), ImmutableList.of());
    }

    /**
     * Removes every edge in which the role is the granted role or the member, cascading to
     * their dependents.
     */
    public RevocationPlan<MembershipEdge> removeEdgesOf(Transaction txn, RoleId role)
    {
        Set<MembershipEdge> doomed = new LinkedHashSet<>();
        doomed.addAll(edges.lookup(txn, EntityType.EDGE_BY_ROLE, role.toKey()));
        doomed.addAll(edges.lookup(txn, EntityType.EDGE_BY_MEMBER, role.toKey()));
        RevocationPlan<MembershipEdge> plan = dependencies.plan(txn, doomed, ImmutableList.of());
        dependencies.apply(txn, plan);
        return plan;
    }

    /**
     * Removes every edge the role granted, cascading to their dependents.
     */
    public RevocationPlan<MembershipEdge> removeEdgesGrantedBy(Transaction txn, RoleId grantor)
    {
        RevocationPlan<MembershipEdge> plan = dependencies.plan(txn, edgesGrantedBy(txn, grantor), ImmutableList.of());
        dependencies.apply(txn, plan);
        return plan;
    }

    public MembershipEdge findEdge(ReadView view, RoleId granted, RoleId member, Scope scope, RoleId grantor)
    {
        List<MembershipEdge> found = edges.lookup(view, EntityType.EDGE_BY_ROLE,
                                                  granted.toKey(), member.toKey(), scope.toKey(), grantor.toKey());
        return found.isEmpty() ? null : found.get(0);
    }

    public MembershipEdge getEdge(ReadView view, long id)
    {
        return edges.get(view, id);
    }

    /**
     * @return the edges for (granted, member, scope) made by the grantor, or by any grantor
     * when it is null
     */
    public List<MembershipEdge> matchingEdges(ReadView view, RoleId granted, RoleId member, Scope scope, RoleId grantor)
    {
        if (grantor != null)
        {
            MembershipEdge edge = findEdge(view, granted, member, scope, grantor);
            return edge == null ? ImmutableList.of() : ImmutableList.of(edge);
        }
        return edges.lookup(view, EntityType.EDGE_BY_ROLE, granted.toKey(), member.toKey(), scope.toKey());
    }

    public List<MembershipEdge> edgesGrantedBy(ReadView view, RoleId grantor)
    {
        return edges.lookup(view, EntityType.EDGE_BY_GRANTOR, grantor.toKey());
    }

    /**
     * @return the edges whose member is the role
     */
    public List<MembershipEdge> edgesOfMember(ReadView view, RoleId member)
    {
        return edges.lookup(view, EntityType.EDGE_BY_MEMBER, member.toKey());
    }

    /**
     * @return the edges whose granted role is the role
     */
    public List<MembershipEdge> edgesOfRole(ReadView view, RoleId granted)
    {
        return edges.lookup(view, EntityType.EDGE_BY_ROLE, granted.toKey());
    }

    public List<MembershipEdge> allEdges(ReadView view)
    {
        return edges.all(view);
    }

    /**
     * @return the root and every role whose privileges it holds without SET ROLE, following
     * only edges with the inherit option
     */
    public ImmutableSet<RoleId> inheritedClosure(ReadView view, RoleId root, Scope scope)
    {
        return closure(view, root, scope, Traversal.INHERIT);
    }

    /**
     * @return the root and every role it may SET ROLE to, following only edges with the set
     * option
     */
    public ImmutableSet<RoleId> setEligibleClosure(ReadView view, RoleId root, Scope scope)
    {
        return closure(view, root, scope, Traversal.SET);
    }

    /**
     * @return the root and every role it is a member of through any edge
     */
    public ImmutableSet<RoleId> memberClosure(ReadView view, RoleId root, Scope scope)
    {
        return closure(view, root, scope, Traversal.ANY);
    }

    public ImmutableSet<RoleId> closure(ReadView view, RoleId root, Scope scope, Traversal traversal)
    {
        if (cache == null || view instanceof Transaction)
            return computeClosure(view, root, scope, traversal);
        return cache.get(view, root, scope, traversal, () -> computeClosure(view, root, scope, traversal));
    }

    /**
     * @return whether the member may use the role's privileges without SET ROLE
     */
    public boolean hasPrivilegesOfRole(ReadView view, RoleId member, RoleId role, Scope scope)
    {
        return roles.isSuperuser(view, member) || inheritedClosure(view, member, scope).contains(role);
    }

    /**
     * @return whether the member belongs to the role through any chain of edges, whatever
     * their options
     */
    public boolean isMemberOfRole(ReadView view, RoleId member, RoleId role, Scope scope)
    {
        return roles.isSuperuser(view, member) || memberClosure(view, member, scope).contains(role);
    }

    public boolean memberCanSetRole(ReadView view, RoleId member, RoleId role, Scope scope)
    {
        return roles.isSuperuser(view, member) || setEligibleClosure(view, member, scope).contains(role);
    }

    /**
     * @return whether the actor is a superuser, or holds the admin option on the target through
     * an edge of its own visible in the scope
     */
    public boolean hasAdminOption(ReadView view, RoleId actor, RoleId target, Scope scope)
    {
        return roles.isSuperuser(view, actor) || findAdminEdge(view, actor, target, scope) != null;
    }

    /**
     * Finds the admin edge authorising the actor to administer membership in the target: the
     * actor's own edge if it has one, otherwise that of the lowest id role in its inherited
     * closure which has one. Among several edges of the chosen role the lowest id wins.
     */
    public Optional<MembershipEdge> selectBestAdmin(ReadView view, RoleId actor, RoleId target, Scope scope)
    {
        MembershipEdge own = findAdminEdge(view, actor, target, scope);
        if (own != null)
            return Optional.of(own);

        List<RoleId> candidates = new ArrayList<>(inheritedClosure(view, actor, scope));
        candidates.sort(Comparator.naturalOrder());
        for (RoleId candidate : candidates)
        {
            if (candidate.equals(actor))
                continue;
            MembershipEdge edge = findAdminEdge(view, candidate, target, scope);
            if (edge != null)
                return Optional.of(edge);
        }
        return Optional.empty();
    }

    /**
     * Resolves the scope whose admin edges may authorise an operation. A database scoped admin
     * option only counts for operations on that database made while connected to it; anything
     * else needs a Global admin option.
     */
    public static Scope adminScope(Scope operation, String connectedDatabase)
    {
        if (!operation.isGlobal() && operation.getDatabase().equals(connectedDatabase))
            return operation;
        return Scope.GLOBAL;
    }

    /**
     * Rejects granting the admin option to a role which the grantor's own admin option was
     * derived from.
     */
    public void checkAdminCircularity(ReadView view, MembershipEdge authorising, RoleId member)
    {
        Set<Long> seen = new HashSet<>();
        MembershipEdge edge = authorising;
        while (edge != null && seen.add(edge.getId()))
        {
            if (edge.getMember().equals(member))
                throw new InvalidGranteeException(String.format("Admin option cannot be granted back to your own grantor %s",
                                                                roles.nameOf(view, member)));
            edge = edge.getParent() == null ? null : getEdge(view, edge.getParent());
        }
    }

    public String describe(ReadView view, MembershipEdge edge)
    {
        return String.format("membership of %s in %s granted by %s%s",
                             roles.nameOf(view, edge.getMember()),
                             roles.nameOf(view, edge.getGranted()),
                             roles.nameOf(view, edge.getGrantor()),
                             edge.getScope().isGlobal() ? "" : " in database " + edge.getScope().getDatabase());
    }

    /**
     * @return the lowest id edge giving the holder itself the admin option on the target in
     * the scope, or null
     */
    public MembershipEdge findAdminEdge(ReadView view, RoleId holder, RoleId target, Scope scope)
    {
        MembershipEdge best = null;
        for (MembershipEdge edge : edges.lookup(view, EntityType.EDGE_BY_ROLE, target.toKey(), holder.toKey()))
        {
            if (edge.hasAdminOption() && edge.getScope().isVisibleIn(scope) && (best == null || edge.getId() < best.getId()))
                best = edge;
        }
        return best;
    }

    private ImmutableSet<RoleId> computeClosure(ReadView view, RoleId root, Scope scope, Traversal traversal)
    {
        Set<RoleId> seen = new LinkedHashSet<>();
        Deque<RoleId> pending = new ArrayDeque<>();
        seen.add(root);
        pending.add(root);
        while (!pending.isEmpty())
        {
            RoleId current = pending.poll();
            for (MembershipEdge edge : edgesOfMember(view, current))
            {
                if (edge.getScope().isVisibleIn(scope) && traversal.follows(edge) && seen.add(edge.getGranted()))
                    pending.add(edge.getGranted());
            }
        }
        return ImmutableSet.copyOf(seen);
    }

    /**
     * Searches upwards from {@code from} for {@code to} over the projections a new edge in the
     * scope would take part in. A Global edge takes part in the projection of every database, so
     * a path may use the Global edges plus the edges of any one database, but never two.
     */
    private boolean reaches(ReadView view, RoleId from, RoleId to, Scope scope)
    {
        Set<Walk> seen = new HashSet<>();
        Deque<Walk> pending = new ArrayDeque<>();
        Walk start = new Walk(from, scope.isGlobal() ? null : scope.getDatabase());
        seen.add(start);
        pending.add(start);
        while (!pending.isEmpty())
        {
            Walk current = pending.poll();
            if (current.role.equals(to))
                return true;

            for (MembershipEdge edge : edgesOfMember(view, current.role))
            {
                String database = current.database;
                if (!edge.getScope().isGlobal())
                {
                    if (database != null && !database.equals(edge.getScope().getDatabase()))
                        continue;
                    database = edge.getScope().getDatabase();
                }
                Walk next = new Walk(edge.getGranted(), database);
                if (seen.add(next))
                    pending.add(next);
            }
        }
        return false;
    }

    private static String parentKey(Long parent)
    {
        return parent == null ? NO_PARENT : StoreKey.encode(parent);
    }

    private static final class Walk
    {
        private final RoleId role;
        // the database whose edges the path has used, if any
        private final String database;

        private Walk(RoleId role, String database)
        {
            this.role = role;
            this.database = database;
        }

        public boolean equals(Object o)
        {
            if (this == o)
                return true;

            if (!(o instanceof Walk))
                return false;

            Walk w = (Walk) o;
            return role.equals(w.role) && Objects.equal(database, w.database);
        }

        public int hashCode()
        {
            return Objects.hashCode(role, database);
        }
    }

    private final class EdgeDependencies implements DependencyModel<MembershipEdge>
    {
        public long idOf(MembershipEdge edge)
        {
            return edge.getId();
        }

        public Long parentOf(MembershipEdge edge)
        {
            return edge.getParent();
        }

        public MembershipEdge byId(ReadView view, long id)
        {
            return edges.get(view, id);
        }

        public List<MembershipEdge> dependentsOf(ReadView view, MembershipEdge edge)
        {
            return edges.lookup(view, EntityType.EDGE_BY_PARENT, StoreKey.encode(edge.getId()));
        }

        public List<MembershipEdge> alternativeParents(ReadView view, MembershipEdge dependent)
        {
            List<MembershipEdge> candidates = new ArrayList<>();
            for (MembershipEdge edge : edges.lookup(view, EntityType.EDGE_BY_ROLE,
                                                    dependent.getGranted().toKey(), dependent.getGrantor().toKey()))
            {
                if (edge.hasAdminOption() && edge.getScope().isVisibleIn(dependent.getScope()))
                    candidates.add(edge);
            }
            return candidates;
        }

        public void remove(Transaction txn, MembershipEdge edge)
        {
            MembershipEdge current = edges.get(txn, edge.getId());
            if (current != null)
            {
                edges.delete(txn, current);
                logger.debug("Removed {}", current);
            }
        }

        public void strip(Transaction txn, MembershipEdge edge)
        {
            MembershipEdge current = edges.get(txn, edge.getId());
            if (current != null)
                edges.update(txn, current, current.withOptions(false, current.hasInheritOption(), current.hasSetOption()));
        }

        public void reparent(Transaction txn, MembershipEdge edge, MembershipEdge newParent)
        {
            MembershipEdge current = edges.get(txn, edge.getId());
            if (current != null)
            {
                edges.update(txn, current, current.withParent(newParent.getId()));
                logger.debug("Re-parented {} onto edge {}", current, newParent.getId());
            }
        }

        public String describe(ReadView view, MembershipEdge edge)
        {
            return MembershipGraph.this.describe(view, edge);
        }
    }
}
