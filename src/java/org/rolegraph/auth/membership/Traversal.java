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
 * Which edges a closure over the membership graph follows.
 */
public enum Traversal
{
    /** edges whose privileges pass to the member without SET ROLE */
    INHERIT
    {
        public boolean follows(MembershipEdge edge)
        {
            return edge.hasInheritOption();
        }
    },

    /** edges the member may SET ROLE across */
    SET
    {
        public boolean follows(MembershipEdge edge)
        {
            return edge.hasSetOption();
        }
    },

    /** every edge, regardless of its options */
    ANY
    {
        public boolean follows(MembershipEdge edge)
        {
            return true;
        }
    };

    public abstract boolean follows(MembershipEdge edge);
}
