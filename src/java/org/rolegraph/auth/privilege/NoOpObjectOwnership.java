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

import java.util.Collections;
import java.util.Optional;
import java.util.Set;

import org.rolegraph.auth.RoleId;
import org.rolegraph.auth.Scope;

/**
 * Used when nothing tracks ownership; no object has an owner and no role owns anything.
 */
public class NoOpObjectOwnership implements IObjectOwnership
{
    public Optional<RoleId> ownerOf(ObjectRef object)
    {
        return Optional.empty();
    }

    public Set<ObjectRef> objectsOwnedBy(RoleId role)
    {
        return Collections.emptySet();
    }

    public void reassignOwnership(RoleId from, RoleId to, Scope scope)
    {
    }

    public void dropOwnedObjects(RoleId role, Scope scope)
    {
    }
}
