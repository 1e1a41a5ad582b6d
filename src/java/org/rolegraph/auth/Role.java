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

import java.util.Map;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableMap;

/**
 * Immutable record of a role and its static attributes. Every change produces a new instance
 * which the {@link RoleDirectory} writes back in the caller's transaction.
 */
public final class Role
{
    private final RoleId id;
    private final String name;
    private final boolean superuser;
    private final boolean login;
    private final boolean createDb;
    private final boolean createRole;
    private final boolean replication;
    private final boolean bypassRls;
    private final boolean inherit;
    private final int connectionLimit;
    private final String passwordHash;
    private final ImmutableMap<String, String> config;

    private Role(Builder builder)
    {
        this.id = builder.id;
        this.name = builder.name;
        this.superuser = builder.superuser;
        this.login = builder.login;
        this.createDb = builder.createDb;
        this.createRole = builder.createRole;
        this.replication = builder.replication;
        this.bypassRls = builder.bypassRls;
        this.inherit = builder.inherit;
        this.connectionLimit = builder.connectionLimit;
        this.passwordHash = builder.passwordHash;
        this.config = ImmutableMap.copyOf(builder.config);
    }

    public static Builder builder(RoleId id, String name)
    {
        return new Builder(id, name);
    }

    public Builder toBuilder()
    {
        Builder builder = new Builder(id, name);
        builder.superuser = superuser;
        builder.login = login;
        builder.createDb = createDb;
        builder.createRole = createRole;
        builder.replication = replication;
        builder.bypassRls = bypassRls;
        builder.inherit = inherit;
        builder.connectionLimit = connectionLimit;
        builder.passwordHash = passwordHash;
        builder.config = config;
        return builder;
    }

    /**
     * @return a copy of this role with the explicitly set attributes of the supplied options
     */
    public Role withOptions(RoleOptions options)
    {
        Builder builder = toBuilder();
        options.getBoolean(RoleOption.SUPERUSER).ifPresent(v -> builder.superuser = v);
        options.getBoolean(RoleOption.LOGIN).ifPresent(v -> builder.login = v);
        options.getBoolean(RoleOption.CREATEDB).ifPresent(v -> builder.createDb = v);
        options.getBoolean(RoleOption.CREATEROLE).ifPresent(v -> builder.createRole = v);
        options.getBoolean(RoleOption.REPLICATION).ifPresent(v -> builder.replication = v);
        options.getBoolean(RoleOption.BYPASSRLS).ifPresent(v -> builder.bypassRls = v);
        options.getBoolean(RoleOption.INHERIT).ifPresent(v -> builder.inherit = v);
        options.getConnectionLimit().ifPresent(v -> builder.connectionLimit = v);
        if (options.has(RoleOption.PASSWORD))
            builder.passwordHash = options.getPassword() == null ? null : Passwords.hash(options.getPassword());
        return builder.build();
    }

    public Role withName(String newName)
    {
        Builder builder = toBuilder();
        builder.name = newName;
        return builder.build();
    }

    public Role withConfig(Map<String, String> newConfig)
    {
        Builder builder = toBuilder();
        builder.config = newConfig;
        return builder.build();
    }

    public RoleId getId()
    {
        return id;
    }

    public String getName()
    {
        return name;
    }

    public boolean isSuperuser()
    {
        return superuser;
    }

    public boolean canLogin()
    {
        return login;
    }

    public boolean canCreateDb()
    {
        return createDb;
    }

    public boolean canCreateRole()
    {
        return createRole;
    }

    public boolean canInitiateReplication()
    {
        return replication;
    }

    public boolean canBypassRls()
    {
        return bypassRls;
    }

    /**
     * @return the inherit option given to new memberships of this role when the grant does not
     * name one
     */
    public boolean inheritsByDefault()
    {
        return inherit;
    }

    public int getConnectionLimit()
    {
        return connectionLimit;
    }

    public String getPasswordHash()
    {
        return passwordHash;
    }

    public ImmutableMap<String, String> getConfig()
    {
        return config;
    }

    public boolean equals(Object o)
    {
        if (this == o)
            return true;

        if (!(o instanceof Role))
            return false;

        Role r = (Role) o;
        return Objects.equal(id, r.id)
               && Objects.equal(name, r.name)
               && superuser == r.superuser
               && login == r.login
               && createDb == r.createDb
               && createRole == r.createRole
               && replication == r.replication
               && bypassRls == r.bypassRls
               && inherit == r.inherit
               && connectionLimit == r.connectionLimit
               && Objects.equal(passwordHash, r.passwordHash)
               && Objects.equal(config, r.config);
    }

    public int hashCode()
    {
        return Objects.hashCode(id, name, superuser, login, createDb, createRole, replication, bypassRls,
                                inherit, connectionLimit, passwordHash, config);
    }

    public String toString()
    {
        return String.format("Role %s (%s)", name, id);
    }

    public static final class Builder
    {
        private final RoleId id;
        private String name;
        private boolean superuser = false;
        private boolean login = false;
        private boolean createDb = false;
        private boolean createRole = false;
        private boolean replication = false;
        private boolean bypassRls = false;
        private boolean inherit = true;
        private int connectionLimit = -1;
        private String passwordHash;
        private Map<String, String> config = ImmutableMap.of();

        private Builder(RoleId id, String name)
        {
            this.id = id;
            this.name = name;
        }

        public Builder superuser(boolean superuser)
        {
            this.superuser = superuser;
            return this;
        }

        public Builder login(boolean login)
        {
            this.login = login;
            return this;
        }

        public Role build()
        {
            return new Role(this);
        }
    }
}
