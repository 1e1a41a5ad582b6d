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

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

import org.rolegraph.exceptions.InvalidRequestException;

/**
 * The attributes named by a create-role or alter-role command. Only attributes explicitly set
 * are present, so the same class serves as a full set of initial values (unset attributes take
 * their defaults) and as a delta.
 */
public class RoleOptions
{
    private final Map<RoleOption, Object> options = new EnumMap<>(RoleOption.class);

    public RoleOptions setOption(RoleOption option, Object value)
    {
        if (options.containsKey(option))
            throw new InvalidRequestException(String.format("%s option provided multiple times", option));
        if (value != null && !option.valueType.isInstance(value))
            throw new InvalidRequestException(String.format("Invalid value for %s: expected %s",
                                                            option, option.valueType.getSimpleName()));
        if (option == RoleOption.CONNECTION_LIMIT && value != null && (Integer) value < -1)
            throw new InvalidRequestException(String.format("Invalid connection limit: %s", value));
        options.put(option, value);
        return this;
    }

    public boolean isEmpty()
    {
        return options.isEmpty();
    }

    public boolean has(RoleOption option)
    {
        return options.containsKey(option);
    }

    public Map<RoleOption, Object> getOptions()
    {
        return ImmutableMap.copyOf(options);
    }

    public Optional<Boolean> getBoolean(RoleOption option)
    {
        return Optional.ofNullable((Boolean) options.get(option));
    }

    public Optional<Integer> getConnectionLimit()
    {
        return Optional.ofNullable((Integer) options.get(RoleOption.CONNECTION_LIMIT));
    }

    /**
     * A null password clears the credential, so presence is reported separately from the value.
     */
    public String getPassword()
    {
        return (String) options.get(RoleOption.PASSWORD);
    }

    public String toString()
    {
        StringBuilder builder = new StringBuilder("{");
        for (Map.Entry<RoleOption, Object> option : options.entrySet())
        {
            if (builder.length() > 1)
                builder.append(", ");
            builder.append(option.getKey()).append(": ");
            // never echo credentials
            builder.append(option.getKey() == RoleOption.PASSWORD ? "<redacted>" : option.getValue());
        }
        return builder.append('}').toString();
    }
}
