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

import java.util.Set;

import com.google.common.collect.ImmutableMap;

import org.rolegraph.auth.privilege.ObjectRef;
import org.rolegraph.auth.privilege.ObjectType;
import org.rolegraph.auth.privilege.Privilege;

/**
 * Roles created at bootstrap whose members hold privileges no grant records. Their names use
 * the reserved prefix, so they can neither be created nor renamed to by users.
 */
public final class PredefinedRoles
{
    public static final RoleId READ_ALL_STATS = RoleId.of(3375);
    public static final RoleId READ_ALL_DATA = RoleId.of(6181);
    public static final RoleId WRITE_ALL_DATA = RoleId.of(6182);

    static final ImmutableMap<RoleId, String> NAMES = ImmutableMap.of(READ_ALL_STATS, "pg_read_all_stats",
                                                                      READ_ALL_DATA, "pg_read_all_data",
                                                                      WRITE_ALL_DATA, "pg_write_all_data");

    private PredefinedRoles()
    {
    }

    /**
     * @return whether holding the privileges of the supplied roles implies the privilege on the
     * object without any grant
     */
    public static boolean impliesPrivilege(Set<RoleId> roles, ObjectRef object, Privilege privilege)
    {
        ObjectType type = object.getType();
        if (roles.contains(READ_ALL_DATA))
        {
            if ((type == ObjectType.TABLE || type == ObjectType.SEQUENCE) && privilege == Privilege.SELECT)
                return true;
            if (type == ObjectType.SCHEMA && privilege == Privilege.USAGE)
                return true;
        }
        if (roles.contains(WRITE_ALL_DATA))
        {
            if (type == ObjectType.TABLE
                && (privilege == Privilege.INSERT || privilege == Privilege.UPDATE || privilege == Privilege.DELETE))
                return true;
            if (type == ObjectType.SCHEMA && privilege == Privilege.USAGE)
                return true;
        }
        return false;
    }
}
