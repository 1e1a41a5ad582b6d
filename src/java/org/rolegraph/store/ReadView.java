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

import java.util.SortedMap;

/**
 * A consistent view of the backing store. Views returned by {@link KeyValueStore#snapshot()}
 * never change; a {@link Transaction} is a view which also sees its own pending writes.
 */
public interface ReadView
{
    /**
     * @return the value stored under the key, or null if there is none
     */
    Object get(StoreKey key);

    /**
     * @return every row whose key starts with the supplied prefix, in key order. May be empty
     * but never null.
     */
    SortedMap<StoreKey, Object> scan(StoreKey prefix);

    /**
     * @return the commit generation this view was taken from
     */
    long generation();
}
