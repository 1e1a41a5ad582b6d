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

import java.io.IOException;
import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Locale;

import com.google.common.annotations.VisibleForTesting;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import org.rolegraph.exceptions.InvalidRequestException;

/**
 * Loads {@link AuthzConfig} from YAML. The location is taken from the {@code rolegraph.config}
 * system property (a URL or a file path), falling back to authz.yaml on the classpath. Any
 * individual setting can then be overridden with a {@code rolegraph.<key>} system property.
 */
public class YamlConfigurationLoader
{
    private static final Logger logger = LoggerFactory.getLogger(YamlConfigurationLoader.class);

    public static final String CONFIG_PROPERTY = "rolegraph.config";
    private static final String DEFAULT_CONFIGURATION = "authz.yaml";
    private static final String OVERRIDE_PREFIX = "rolegraph.";

    public AuthzConfig loadConfig()
    {
        String location = System.getProperty(CONFIG_PROPERTY);
        AuthzConfig config;
        if (StringUtils.isBlank(location))
        {
            InputStream resource = YamlConfigurationLoader.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIGURATION);
            if (resource == null)
            {
                logger.info("No {} found on the classpath, using defaults", DEFAULT_CONFIGURATION);
                config = new AuthzConfig();
            }
            else
            {
                config = load(resource, DEFAULT_CONFIGURATION);
            }
        }
        else
        {
            config = load(open(location), location);
        }
        applySystemPropertyOverrides(config);
        logger.debug("Loaded configuration {}", config);
        return config;
    }

    @VisibleForTesting
    AuthzConfig load(InputStream input, String source)
    {
        try (InputStream in = input)
        {
            Yaml yaml = new Yaml(new Constructor(AuthzConfig.class, new LoaderOptions()));
            AuthzConfig config = yaml.loadAs(in, AuthzConfig.class);
            // an empty document yields null
            return config == null ? new AuthzConfig() : validate(config);
        }
        catch (YAMLException | IOException e)
        {
            throw new InvalidRequestException(String.format("Invalid configuration in %s: %s", source, e.getMessage()));
        }
    }

    @VisibleForTesting
    void applySystemPropertyOverrides(AuthzConfig config)
    {
        config.reserved_role_prefix = System.getProperty(OVERRIDE_PREFIX + "reserved_role_prefix", config.reserved_role_prefix);
        config.bootstrap_superuser = System.getProperty(OVERRIDE_PREFIX + "bootstrap_superuser", config.bootstrap_superuser);
        config.closure_cache_max_entries = Integer.getInteger(OVERRIDE_PREFIX + "closure_cache_max_entries", config.closure_cache_max_entries);
        config.write_lock_timeout_ms = Long.getLong(OVERRIDE_PREFIX + "write_lock_timeout_ms", config.write_lock_timeout_ms);
        validate(config);
    }

    private static AuthzConfig validate(AuthzConfig config)
    {
        if (StringUtils.isBlank(config.bootstrap_superuser))
            throw new InvalidRequestException("bootstrap_superuser must not be empty");
        if (config.closure_cache_max_entries < 0)
            throw new InvalidRequestException("closure_cache_max_entries must not be negative");
        if (config.write_lock_timeout_ms <= 0)
            throw new InvalidRequestException("write_lock_timeout_ms must be positive");
        if (config.reserved_role_prefix == null)
            config.reserved_role_prefix = "";
        if (config.createrole_self_grant == null)
            config.createrole_self_grant = new ArrayList<>();
        for (String option : config.createrole_self_grant)
        {
            String normalized = option.toLowerCase(Locale.US);
            if (!normalized.equals("set") && !normalized.equals("inherit"))
                throw new InvalidRequestException(String.format("Unrecognized createrole_self_grant option \"%s\"", option));
        }
        return config;
    }

    private static InputStream open(String location)
    {
        try
        {
            try
            {
                return new URL(location).openStream();
            }
            catch (MalformedURLException e)
            {
                return Files.newInputStream(Paths.get(location));
            }
        }
        catch (IOException e)
        {
            throw new InvalidRequestException(String.format("Cannot read configuration from %s: %s", location, e.getMessage()));
        }
    }
}
