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

import java.util.EnumSet;
import java.util.Set;

import com.google.common.collect.Sets;

import static org.rolegraph.auth.privilege.Privilege.*;

/**
 * Types of object privileges can be granted on, each with the privileges applicable to it.
 */
public enum ObjectType
{
    TABLE(EnumSet.of(SELECT, INSERT, UPDATE, DELETE, TRUNCATE, REFERENCES, TRIGGER, MAINTAIN)),
    SEQUENCE(EnumSet.of(USAGE, SELECT, UPDATE)),
    DATABASE(EnumSet.of(CREATE, CONNECT, TEMPORARY)),
    SCHEMA(EnumSet.of(USAGE, CREATE)),
    FUNCTION(EnumSet.of(EXECUTE)),
    TABLESPACE(EnumSet.of(CREATE)),
    TYPE(EnumSet.of(USAGE)),
    LANGUAGE(EnumSet.of(USAGE)),
    FOREIGN_SERVER(EnumSet.of(USAGE)),
    PARAMETER(EnumSet.of(SET, ALTER_SYSTEM));

    private static final Set<Privilege> COLUMN_PRIVILEGES = Sets.immutableEnumSet(SELECT, INSERT, UPDATE, REFERENCES);

    private final Set<Privilege> applicable;

    ObjectType(EnumSet<Privilege> applicable)
    {
        this.applicable = Sets.immutableEnumSet(applicable);
    }

    public Set<Privilege> applicablePrivileges()
    {
        return applicable;
    }

    /**
     * Only tables have columns with privileges of their own.
     */
    public static Set<Privilege> columnPrivileges()
    {
        return COLUMN_PRIVILEGES;
    }
}
