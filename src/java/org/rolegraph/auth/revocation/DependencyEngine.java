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
package org.rolegraph.auth.revocation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.rolegraph.exceptions.DependencyException;
import org.rolegraph.store.ReadView;
import org.rolegraph.store.Transaction;

/**
 * Computes and applies the consequences of removing rows, or of stripping their option, over
 * any kind of row described by a {@link DependencyModel}.
 *
 * A dependent whose parent goes away survives when its grantor still holds the option through
 * another row that is not itself going away; it is then re-parented onto the surviving row with
 * the smallest id, provided that row's own chain does not pass back through the dependent. All
 * other dependents are removed, recursively. Decisions are revisited until nothing changes, as
 * a row chosen as a new parent may itself turn out to be removed later in the walk.
 */
public class DependencyEngine<T>
{
    private static final Logger logger = LoggerFactory.getLogger(DependencyEngine.class);

    private final DependencyModel<T> model;

    public DependencyEngine(DependencyModel<T> model)
    {
        this.model = model;
    }

    public RevocationPlan<T> plan(ReadView view, Collection<T> removed, Collection<T> stripped)
    {
        Map<Long, T> roots = byId(removed);
        Map<Long, T> strippedRows = byId(stripped);
        strippedRows.keySet().removeAll(roots.keySet());

        // rows which can no longer authorise anything
        Set<Long> unusable = new HashSet<>(roots.keySet());
        unusable.addAll(strippedRows.keySet());

        Map<Long, T> doomed = new LinkedHashMap<>();
        Map<Long, T> reparented = new HashMap<>();

        Deque<T> pending = new ArrayDeque<>();
        for (T row : roots.values())
            pending.addAll(model.dependentsOf(view, row));
        for (T row : strippedRows.values())
            pending.addAll(model.dependentsOf(view, row));

        while (!pending.isEmpty())
        {
            T dependent = pending.poll();
            long id = model.idOf(dependent);
            if (roots.containsKey(id) || doomed.containsKey(id))
                continue;

            T parent = findParent(view, dependent, unusable, reparented);
            if (parent != null)
            {
                logger.trace("{} keeps its authorisation through {}", dependent, parent);
                reparented.put(id, parent);
                continue;
            }

            logger.trace("{} loses its authorisation", dependent);
            reparented.remove(id);
            doomed.put(id, dependent);
            unusable.add(id);
            pending.addAll(model.dependentsOf(view, dependent));

            // anything re-parented onto this row has to find yet another parent
            for (Map.Entry<Long, T> entry : new ArrayList<>(reparented.entrySet()))
            {
                if (model.idOf(entry.getValue()) == id)
                {
                    reparented.remove(entry.getKey());
                    pending.add(model.byId(view, entry.getKey()));
                }
            }
        }

        Map<T, T> moves = new LinkedHashMap<>();
        for (Map.Entry<Long, T> entry : reparented.entrySet())
        {
            T row = model.byId(view, entry.getKey());
            Long currentParent = model.parentOf(row);
            if (currentParent == null || currentParent != model.idOf(entry.getValue()))
                moves.put(row, entry.getValue());
        }
        return new RevocationPlan<>(new ArrayList<>(roots.values()),
                                    new ArrayList<>(strippedRows.values()),
                                    new ArrayList<>(doomed.values()),
                                    moves);
    }

    /**
     * Rejects the plan if it would remove anything beyond what was asked for.
     */
    public void checkRestrict(ReadView view, RevocationPlan<T> plan, String operation)
    {
        if (!plan.hasDependents())
            return;

        List<String> blockers = new ArrayList<>(plan.getDependents().size());
        for (T row : plan.getDependents())
            blockers.add(model.describe(view, row));
        throw new DependencyException(String.format("Cannot %s because dependent grants exist; use CASCADE", operation),
                                      blockers);
    }

    public void apply(Transaction txn, RevocationPlan<T> plan)
    {
        for (Map.Entry<T, T> move : plan.getReparented().entrySet())
            model.reparent(txn, move.getKey(), move.getValue());
        for (T row : plan.getStripped())
            model.strip(txn, row);
        for (T row : plan.getDependents())
            model.remove(txn, row);
        for (T row : plan.getRoots())
            model.remove(txn, row);

        logger.debug("Revoked {} rows, stripped {}, cascaded to {}, re-parented {}",
                     plan.getRoots().size(), plan.getStripped().size(),
                     plan.getDependents().size(), plan.getReparented().size());
    }

    private T findParent(ReadView view, T dependent, Set<Long> unusable, Map<Long, T> reparented)
    {
        long id = model.idOf(dependent);
        List<T> candidates = new ArrayList<>();
        Long current = model.parentOf(dependent);
        if (current != null && !unusable.contains(current))
        {
            T row = model.byId(view, current);
            if (row != null)
                candidates.add(row);
        }
        candidates.addAll(model.alternativeParents(view, dependent));
        candidates.sort(Comparator.comparingLong(model::idOf));

        for (T candidate : candidates)
        {
            long candidateId = model.idOf(candidate);
            if (candidateId == id || unusable.contains(candidateId))
                continue;
            if (!chainPassesThrough(view, candidate, id, reparented))
                return candidate;
        }
        return null;
    }

    private boolean chainPassesThrough(ReadView view, T start, long target, Map<Long, T> reparented)
    {
        Set<Long> seen = new LinkedHashSet<>();
        T row = start;
        while (row != null)
        {
            long id = model.idOf(row);
            if (id == target || !seen.add(id))
                return true;
            T moved = reparented.get(id);
            if (moved != null)
            {
                row = moved;
                continue;
            }
            Long parent = model.parentOf(row);
            row = parent == null ? null : model.byId(view, parent);
        }
        return false;
    }

    private Map<Long, T> byId(Collection<T> rows)
    {
        Map<Long, T> map = new LinkedHashMap<>();
        for (T row : rows)
            map.put(model.idOf(row), row);
        return map;
    }
}
