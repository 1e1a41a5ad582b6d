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
package org.rolegraph.metrics;

import com.codahale.metrics.MetricRegistry;

/**
 * Process-wide registry every authorization metric is created in. Metric creation is
 * get-or-add, so any number of engines in one JVM share the same named metrics.
 */
public class AuthzMetricsRegistry extends MetricRegistry
{
    public static final AuthzMetricsRegistry Metrics = new AuthzMetricsRegistry();

    private static final String GROUP = "org.rolegraph.metrics";

    private AuthzMetricsRegistry()
    {
    }

    public static String metricName(String type, String name)
    {
        return MetricRegistry.name(GROUP, type, name);
    }
}
