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

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The complete set of changes a revoke implies, computed before anything is written so that a
 * RESTRICT revoke can be rejected without side effects.
 */
public final class RevocationPlan<T>
{
    private final ImmutableList<T> roots;
    private final ImmutableList<T> stripped;
    private final ImmutableList<T> dependents;
    private final ImmutableMap<T, T> reparented;

    RevocationPlan(List<T> roots, List<T> stripped, List<T> dependents, Map<T, T> reparented)
    {
        this.roots = ImmutableList.copyOf(roots);
        this.stripped = ImmutableList.copyOf(stripped);
        this.dependents = ImmutableList.copyOf(dependents);
        this.reparented = ImmutableMap.copyOf(reparented);
    }

    /**
     * @return the rows the caller asked to remove
     */
    public ImmutableList<T> getRoots()
    {
        return roots;
    }

    /**
     * @return the rows losing only their option
     */
    public ImmutableList<T> getStripped()
    {
        return stripped;
    }

    /**
     * @return rows which lose their authorisation and are removed as a consequence, in the
     * order they were found
     */
    public ImmutableList<T> getDependents()
    {
        return dependents;
    }

    /**
     * @return dependents which survive because another row authorises them, mapped to that row
     */
    public ImmutableMap<T, T> getReparented()
    {
        return reparented;
    }

    public boolean hasDependents()
    {
        return !dependents.isEmpty();
    }

    public boolean isEmpty()
    {
        return roots.isEmpty() && stripped.isEmpty();
    }
}
