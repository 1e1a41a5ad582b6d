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
package org.rolegraph.auth.membership;

/**
 * The options named in a membership grant. Options left null keep their current value on an
 * existing edge and take their default on a new one.
 */
public final class MembershipOptions
{
    private Boolean admin;
    private Boolean inherit;
    private Boolean set;

    public static MembershipOptions none()
    {
        return new MembershipOptions();
    }

    public MembershipOptions admin(boolean value)
    {
        this.admin = value;
        return this;
    }

    public MembershipOptions inherit(boolean value)
    {
        this.inherit = value;
        return this;
    }

    public MembershipOptions set(boolean value)
    {
        this.set = value;
        return this;
    }

    public Boolean getAdmin()
    {
        return admin;
    }

    public Boolean getInherit()
    {
        return inherit;
    }

    public Boolean getSet()
    {
        return set;
    }

    public String toString()
    {
        return String.format("{admin=%s, inherit=%s, set=%s}", admin, inherit, set);
    }
}
