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

package lazygraph;

/**
 * Constructs the value of one member from the values of its declared dependencies.
 *
 * <p>A provider is invoked at most once per {@link Injector}. It must only read the dependencies
 * that were declared for its member; asking {@code dependencies} for any other name fails.
 *
 * @param <T> the type of the constructed member
 */
@FunctionalInterface
public interface MemberProvider<T> {
  /** Returns the member's value. Must not return null. */
  T provide(Dependencies dependencies);
}
