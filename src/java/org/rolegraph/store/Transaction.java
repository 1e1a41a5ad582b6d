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
 * A unit of atomic change to the backing store. Either every write made through the
 * transaction becomes visible on {@link #commit()} or, if the transaction is closed without
 * committing, none of them do.
 */
public interface Transaction extends ReadView, AutoCloseable
{
    void put(StoreKey key, Object value);

    void delete(StoreKey key);

    void commit();

    /**
     * Discards the transaction if it has not been committed.
     */
    void close();
}
