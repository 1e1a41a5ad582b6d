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

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;

import static org.rolegraph.metrics.AuthzMetricsRegistry.Metrics;
import static org.rolegraph.metrics.AuthzMetricsRegistry.metricName;

/**
 * Metrics for the role closure cache, see {@link org.rolegraph.auth.cache.ClosureCache}
 */
public class ClosureCacheMetrics
{
    public final Meter hits;

    public final Meter misses;

    // entries found in the cache but computed from an older store generation
    public final Meter staleEntries;

    public final Timer computeLatency;

    public ClosureCacheMetrics(String identifier)
    {
        hits = Metrics.meter(metricName("ClosureCache", identifier + ".hits"));
        misses = Metrics.meter(metricName("ClosureCache", identifier + ".misses"));
        staleEntries = Metrics.meter(metricName("ClosureCache", identifier + ".staleEntries"));
        computeLatency = Metrics.timer(metricName("ClosureCache", identifier + ".computeLatency"));
    }
}
