/*
 * Copyright (C) 2026 The Lazygraph Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * This package contains the public API for Lazygraph, a small runtime that lazily constructs a
 * fixed set of named, interdependent values.
 *
 * <p>The entry point is {@link lazygraph.Injector#create}. It takes a dependency mapping (member
 * name to the names it depends on) and one {@link lazygraph.MemberProvider} per member. The graph
 * is checked for cycles up front according to {@link lazygraph.CycleCheck}; members are then
 * built on first access, in dependency order, and cached for the lifetime of the injector.
 */
package lazygraph;
