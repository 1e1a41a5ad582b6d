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

/**
 * Role based authorization: roles, the membership graph between them, privileges on database
 * objects and the per-connection state that ties them together.
 *
 * Roles are identified by a stable {@link org.rolegraph.auth.RoleId}; names may change, ids never
 * do. A role becomes a member of another through a membership edge, which carries three
 * independent options: ADMIN (may grant and revoke the membership), INHERIT (uses the granted
 * role's privileges without switching) and SET (may switch to the granted role with SET ROLE).
 * Edges are recorded per grantor, and may apply globally or in a single database.
 *
 * {@link org.rolegraph.auth.RoleDirectory} holds role records, their attributes and their
 * configuration overrides.
 *
 * {@link org.rolegraph.auth.membership.MembershipGraph} stores membership edges, keeps the graph
 * acyclic and computes the closures privilege checks and SET ROLE rely on. Closures computed
 * from committed snapshots are kept in {@link org.rolegraph.auth.cache.ClosureCache}.
 *
 * {@link org.rolegraph.auth.privilege.PrivilegeManager} records privilege grants, selects the
 * grantor a grant is recorded as and answers privilege checks. Object ownership lives outside
 * this package, behind {@link org.rolegraph.auth.privilege.IObjectOwnership}.
 *
 * Both edges and grants form chains of authority: a row made through another row's admin or
 * grant option depends on it. {@link org.rolegraph.auth.revocation.DependencyEngine} plans what
 * a revoke removes, keeps or re-parents, for either kind of row.
 *
 * {@link org.rolegraph.auth.AuthorizationService} is the entry point for the administrative
 * commands, and {@link org.rolegraph.auth.SessionAuthorizationContext} for everything a single
 * connection asks.
 **/
package org.rolegraph.auth;
