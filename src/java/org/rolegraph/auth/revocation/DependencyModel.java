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
package org.rolegraph.auth.revocation;

import java.util.List;

import org.rolegraph.store.ReadView;
import org.rolegraph.store.Transaction;

/**
 * Describes how rows of one kind (membership edges or privilege grants) depend on each other,
 * so that {@link DependencyEngine} can plan their removal without knowing what they are.
 *
 * A row depends on its parent, the row whose admin or grant option authorised its grantor to
 * create it. Rows without a parent were made by a superuser or an owner and never depend on
 * anything.
 */
public interface DependencyModel<T>
{
    long idOf(T row);

    /**
     * @return the id of the row which authorised this one, or null
     */
    Long parentOf(T row);

    T byId(ReadView view, long id);

    /**
     * @return the rows whose parent is the supplied row
     */
    List<T> dependentsOf(ReadView view, T row);

    /**
     * @return rows, other than the current parent, carrying the option that would equally
     * authorise the dependent's grantor to have made it
     */
    List<T> alternativeParents(ReadView view, T dependent);

    void remove(Transaction txn, T row);

    /**
     * Clears the option this row carries, keeping the row itself.
     */
    void strip(Transaction txn, T row);

    void reparent(Transaction txn, T row, T newParent);

    String describe(ReadView view, T row);
}
