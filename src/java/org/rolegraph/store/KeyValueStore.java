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
 * The transactional key-value contract the engine persists roles, memberships and grants to.
 *
 * Implementations must give a transaction a view that no concurrently committing writer can
 * invalidate before it commits, either by serializing writers or by aborting one of two
 * conflicting transactions. Waiting for that isolation must be bounded.
 */
public interface KeyValueStore
{
    /**
     * Opens a read-write transaction.
     *
     * @throws org.rolegraph.exceptions.StoreTimeoutException if write access could not be
     * obtained in time
     */
    Transaction begin();

    /**
     * @return a lock-free, read-only view of the last committed state
     */
    ReadView snapshot();

    long generation();
}
