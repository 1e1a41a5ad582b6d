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

import com.google.common.base.Objects;

/**
 * A privilege named in a grant or revoke which was skipped because the grantor lacked the
 * grant option, or, for a revoke, because there was nothing to remove. The rest of the
 * command still takes effect.
 */
public final class PartialGrantWarning
{
    private final ObjectRef object;
    private final Privilege privilege;
    private final String message;

    public PartialGrantWarning(ObjectRef object, Privilege privilege, String message)
    {
        this.object = object;
        this.privilege = privilege;
        this.message = message;
    }

    public ObjectRef getObject()
    {
        return object;
    }

    public Privilege getPrivilege()
    {
        return privilege;
    }

    public String getMessage()
    {
        return message;
    }

    public boolean equals(Object o)
    {
        if (this == o)
            return true;

        if (!(o instanceof PartialGrantWarning))
            return false;

        PartialGrantWarning w = (PartialGrantWarning) o;
        return Objects.equal(object, w.object) && privilege == w.privilege && Objects.equal(message, w.message);
    }

    public int hashCode()
    {
        return Objects.hashCode(object, privilege, message);
    }

    public String toString()
    {
        return message;
    }
}
