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
package org.rolegraph.store;

/**
 * The kinds of row kept in the backing store. Primary tables hold the records themselves,
 * keyed by their arena id; index tables map their key columns back to that id.
 */
public enum EntityType
{
    SEQUENCE,

    ROLE,
    ROLE_BY_NAME,
    ROLE_DB_SETTING,

    EDGE,
    EDGE_BY_ROLE,
    EDGE_BY_MEMBER,
    EDGE_BY_GRANTOR,
    EDGE_BY_PARENT,

    GRANT,
    GRANT_BY_OBJECT,
    GRANT_BY_GRANTEE,
    GRANT_BY_GRANTOR,
    GRANT_BY_PARENT
}
