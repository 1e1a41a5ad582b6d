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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Outcome of a grant or revoke: the rows written or removed and any warnings for privileges
 * which were skipped.
 */
public final class GrantResult
{
    private final ImmutableList<PrivilegeGrant> affected;
    private final ImmutableList<PrivilegeGrant> cascaded;
    private final ImmutableList<PartialGrantWarning> warnings;

    GrantResult(List<PrivilegeGrant> affected, List<PrivilegeGrant> cascaded, List<PartialGrantWarning> warnings)
    {
        this.affected = ImmutableList.copyOf(affected);
        this.cascaded = ImmutableList.copyOf(cascaded);
        this.warnings = ImmutableList.copyOf(warnings);
    }

    /**
     * @return the grants inserted or updated by a grant, or removed or stripped by a revoke
     */
    public ImmutableList<PrivilegeGrant> getAffected()
    {
        return affected;
    }

    /**
     * @return the dependent grants a cascading revoke removed
     */
    public ImmutableList<PrivilegeGrant> getCascaded()
    {
        return cascaded;
    }

    public ImmutableList<PartialGrantWarning> getWarnings()
    {
        return warnings;
    }

    public boolean isPartial()
    {
        return !warnings.isEmpty();
    }
}
