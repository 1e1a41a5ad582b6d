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
package org.rolegraph.exceptions;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A revoke or drop was refused because other grants, memberships or objects depend on what
 * would have been removed. {@link #getBlockers()} describes each of them.
 */
public class DependencyException extends AuthzException
{
    private final ImmutableList<String> blockers;

    public DependencyException(String msg, List<String> blockers)
    {
        super(ExceptionCode.DEPENDENCY, String.format("%s: %s", msg, String.join("; ", blockers)));
        this.blockers = ImmutableList.copyOf(blockers);
    }

    public ImmutableList<String> getBlockers()
    {
        return blockers;
    }
}
