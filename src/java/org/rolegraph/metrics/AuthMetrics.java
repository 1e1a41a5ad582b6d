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

import java.util.concurrent.TimeUnit;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;

import static org.rolegraph.metrics.AuthzMetricsRegistry.Metrics;
import static org.rolegraph.metrics.AuthzMetricsRegistry.metricName;

/**
 * Metrics about privilege checks and identity switches
 */
public class AuthMetrics
{
    public static final AuthMetrics instance = new AuthMetrics();

    /** Number and rate of privilege checks */
    private final Meter privilegeChecks;

    /** Number and rate of privilege checks that found no sufficient grant */
    private final Meter privilegeDenials;

    /** Number and rate of SET ROLE attempts rejected */
    private final Meter setRoleFailures;

    /** Number and rate of grants which went ahead for fewer privileges than requested */
    private final Meter partialGrants;

    /** Latency of privilege checks **/
    private final Timer privilegeCheckLatency;

    private AuthMetrics()
    {
        privilegeChecks = Metrics.meter(metricName("Auth", "PrivilegeChecks"));
        privilegeDenials = Metrics.meter(metricName("Auth", "PrivilegeDenials"));
        setRoleFailures = Metrics.meter(metricName("Auth", "SetRoleFailures"));
        partialGrants = Metrics.meter(metricName("Auth", "PartialGrants"));
        privilegeCheckLatency = Metrics.timer(metricName("Auth", "PrivilegeCheckLatency"));
    }

    public void markCheck(boolean granted, long latencyNanos)
    {
        privilegeChecks.mark();
        if (!granted)
            privilegeDenials.mark();
        privilegeCheckLatency.update(latencyNanos, TimeUnit.NANOSECONDS);
    }

    public void markSetRoleFailure()
    {
        setRoleFailures.mark();
    }

    public void markPartialGrant()
    {
        partialGrants.mark();
    }

    public long checkCount()
    {
        return privilegeChecks.getCount();
    }

    public long denialCount()
    {
        return privilegeDenials.getCount();
    }

    public long setRoleFailureCount()
    {
        return setRoleFailures.getCount();
    }
}
