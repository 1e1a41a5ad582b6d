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

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.rolegraph.config.AuthzConfig;
import org.rolegraph.exceptions.InvalidNameException;
import org.rolegraph.exceptions.InvalidRequestException;
import org.rolegraph.store.EntityType;
import org.rolegraph.store.LookupTableSupport;
import org.rolegraph.store.ReadView;
import org.rolegraph.store.Sequences;
import org.rolegraph.store.StoreKey;
import org.rolegraph.store.Transaction;

/**
 * Canonical store of role identities and their attributes. Every other component refers to
 * roles by {@link RoleId} only and comes here to resolve names.
 *
 * Authority checks are made by the caller; this class enforces naming rules and uniqueness.
 */
public class RoleDirectory
{
    private static final Logger logger = LoggerFactory.getLogger(RoleDirectory.class);

    // lowest id given to a role created after bootstrap
    static final long FIRST_USER_ROLE_ID = 16384;

    /**
     * Names which are role specifiers in commands and therefore can never name a role
     */
    public static final ImmutableSet<String> RESERVED_NAMES = ImmutableSet.of("public", "none", "current_user",
                                                                               "current_role", "session_user");

    private static final String ALL = "";

    private final LookupTableSupport<Role> roles =
        LookupTableSupport.<Role>builder(EntityType.ROLE, role -> role.getId().value())
                          .index(EntityType.ROLE_BY_NAME, role -> ImmutableList.of(role.getName()))
                          .build();

    private final AuthzConfig config;

    public RoleDirectory(AuthzConfig config)
    {
        this.config = config;
    }

    /**
     * Creates the bootstrap superuser and the predefined roles, unless they already exist.
     */
    public void bootstrap(Transaction txn)
    {
        if (get(txn, RoleId.BOOTSTRAP) == null)
        {
            validateName(config.bootstrap_superuser, false);
            insert(txn, Role.builder(RoleId.BOOTSTRAP, config.bootstrap_superuser).superuser(true).login(true).build());
            logger.info("Created bootstrap superuser {}", config.bootstrap_superuser);
        }
        for (Map.Entry<RoleId, String> predefined : PredefinedRoles.NAMES.entrySet())
        {
            if (get(txn, predefined.getKey()) == null)
            {
                insert(txn, Role.builder(predefined.getKey(), predefined.getValue()).build());
                logger.debug("Created predefined role {}", predefined.getValue());
            }
        }
    }

    public Role create(Transaction txn, String name, RoleOptions options)
    {
        validateName(name, false);
        RoleId id = RoleId.of(Sequences.next(txn, "role_id", FIRST_USER_ROLE_ID));
        Role role = Role.builder(id, name).build().withOptions(options);
        insert(txn, role);
        logger.debug("Created {} with options {}", role, options);
        return role;
    }

    public Role alter(Transaction txn, Role role, RoleOptions options)
    {
        Role altered = role.withOptions(options);
        roles.update(txn, role, altered);
        logger.debug("Altered {} with options {}", role, options);
        return altered;
    }

    public Role rename(Transaction txn, Role role, String newName)
    {
        validateName(newName, false);
        if (byName(txn, newName).isPresent())
            throw new InvalidRequestException(String.format("Role %s already exists", newName));
        Role renamed = role.withName(newName);
        roles.update(txn, role, renamed);
        logger.debug("Renamed {} to {}", role, newName);
        return renamed;
    }

    public void delete(Transaction txn, Role role)
    {
        roles.delete(txn, role);
        for (StoreKey key : txn.scan(StoreKey.of(EntityType.ROLE_DB_SETTING)).keySet())
            if (key.getColumn(1).equals(role.getId().toKey()))
                txn.delete(key);
        logger.debug("Dropped {}", role);
    }

    public Role get(ReadView view, RoleId id)
    {
        return roles.get(view, id.value());
    }

    public Role require(ReadView view, RoleId id)
    {
        Role role = get(view, id);
        if (role == null)
            throw new InvalidRequestException(String.format("Role %s does not exist", id));
        return role;
    }

    public Optional<Role> byName(ReadView view, String name)
    {
        List<Role> found = roles.lookup(view, EntityType.ROLE_BY_NAME, name);
        assert found.size() <= 1 : "role names must be unique";
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public Role requireByName(ReadView view, String name)
    {
        return byName(view, name).orElseThrow(() -> new InvalidRequestException(String.format("Role %s does not exist", name)));
    }

    public List<Role> all(ReadView view)
    {
        return roles.all(view);
    }

    public boolean isSuperuser(ReadView view, RoleId id)
    {
        Role role = get(view, id);
        return role != null && role.isSuperuser();
    }

    public String nameOf(ReadView view, RoleId id)
    {
        Role role = get(view, id);
        return role == null ? id.toString() : role.getName();
    }

    /**
     * Sets or, with a null value, removes a configuration override. A null role applies the
     * override to all roles, a null database to every database.
     */
    public void setConfig(Transaction txn, RoleId role, String database, String setting, String value)
    {
        String name = normalizeSetting(setting);
        if (role != null && database == null)
        {
            Role current = require(txn, role);
            Map<String, String> updated = new HashMap<>(current.getConfig());
            if (value == null)
                updated.remove(name);
            else
                updated.put(name, value);
            roles.update(txn, current, current.withConfig(updated));
        }
        else
        {
            StoreKey key = settingsKey(role, database);
            Map<String, String> updated = new HashMap<>(settingsAt(txn, key));
            if (value == null)
                updated.remove(name);
            else
                updated.put(name, value);
            if (updated.isEmpty())
                txn.delete(key);
            else
                txn.put(key, ImmutableMap.copyOf(updated));
        }
        logger.debug("{} {} for role {} in database {}", value == null ? "Reset" : "Set", name,
                     role == null ? "ALL" : role, database == null ? "ALL" : database);
    }

    /**
     * Removes every override for the role (or all roles) in the database (or every database).
     */
    public void resetAllConfig(Transaction txn, RoleId role, String database)
    {
        if (role != null && database == null)
        {
            Role current = require(txn, role);
            roles.update(txn, current, current.withConfig(ImmutableMap.of()));
        }
        else
        {
            txn.delete(settingsKey(role, database));
        }
    }

    /**
     * @return the overrides a session of the role connected to the database starts with; the
     * most specific override wins: role in database, then role, then database, then everyone.
     */
    public ImmutableMap<String, String> effectiveSettings(ReadView view, RoleId role, String database)
    {
        Map<String, String> settings = new HashMap<>(settingsAt(view, settingsKey(null, null)));
        settings.putAll(settingsAt(view, settingsKey(null, database)));
        settings.putAll(require(view, role).getConfig());
        settings.putAll(settingsAt(view, settingsKey(role, database)));
        return ImmutableMap.copyOf(settings);
    }

    /**
     * Names must be non-empty, must not be one of the role specifiers and, unless the caller
     * is bootstrapping, must not start with the reserved prefix.
     */
    public void validateName(String name, boolean allowReserved)
    {
        if (StringUtils.isEmpty(name))
            throw new InvalidNameException("Role name must not be empty");
        if (RESERVED_NAMES.contains(name.toLowerCase(Locale.US)))
            throw new InvalidNameException(String.format("Role name \"%s\" is reserved", name));
        if (!allowReserved && !config.reserved_role_prefix.isEmpty() && name.startsWith(config.reserved_role_prefix))
            throw new InvalidNameException(String.format("Role name \"%s\" is reserved. Role names starting with \"%s\" are reserved.",
                                                         name, config.reserved_role_prefix));
    }

    private void insert(Transaction txn, Role role)
    {
        if (byName(txn, role.getName()).isPresent())
            throw new InvalidRequestException(String.format("Role %s already exists", role.getName()));
        roles.insert(txn, role);
    }

    private static String normalizeSetting(String setting)
    {
        if (StringUtils.isBlank(setting))
            throw new InvalidRequestException("Setting name must not be empty");
        return setting.trim().toLowerCase(Locale.US);
    }

    private static StoreKey settingsKey(RoleId role, String database)
    {
        return StoreKey.of(EntityType.ROLE_DB_SETTING,
                           database == null ? ALL : database,
                           role == null ? ALL : role.toKey());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> settingsAt(ReadView view, StoreKey key)
    {
        Object settings = view.get(key);
        return settings == null ? ImmutableMap.of() : (Map<String, String>) settings;
    }
}
