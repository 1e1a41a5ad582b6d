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
package org.rolegraph.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the authorization engine. Field names are the keys of authz.yaml.
 */
public class AuthzConfig
{
    // role names starting with this are reserved for the predefined roles
    public String reserved_role_prefix = "pg_";

    // name given to the bootstrap superuser, the role every sentinel grant is recorded against
    public String bootstrap_superuser = "postgres";

    // extra options ("set", "inherit") a CREATEROLE user is granted on roles it creates
    public List<String> createrole_self_grant = new ArrayList<>();

    public int closure_cache_max_entries = 10000;

    // upper bound on how long a command waits for write access to the store
    public long write_lock_timeout_ms = 10000;

    public String toString()
    {
        return String.format("{ reserved_role_prefix: %s, bootstrap_superuser: %s, createrole_self_grant: %s, " +
                             "closure_cache_max_entries: %d, write_lock_timeout_ms: %d }",
                             reserved_role_prefix, bootstrap_superuser, createrole_self_grant,
                             closure_cache_max_entries, write_lock_timeout_ms);
    }
}
