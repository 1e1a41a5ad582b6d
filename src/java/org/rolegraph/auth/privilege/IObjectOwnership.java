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

import java.util.Optional;
import java.util.Set;

import org.rolegraph.auth.RoleId;
import org.rolegraph.auth.Scope;

/**
 * Bookkeeping of which role owns each object, kept outside this library by whatever manages
 * the objects themselves. Owners hold every privilege on their objects, with grant option.
 */
public interface IObjectOwnership
{
    /**
     * @return the owner of a table, schema, database or other object; columns are owned by
     * their table's owner
     */
    Optional<RoleId> ownerOf(ObjectRef object);

    Set<ObjectRef> objectsOwnedBy(RoleId role);

    void reassignOwnership(RoleId from, RoleId to, Scope scope);

    void dropOwnedObjects(RoleId role, Scope scope);
}
