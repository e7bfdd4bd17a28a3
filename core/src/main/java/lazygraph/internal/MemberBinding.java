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

package lazygraph.internal;

import com.google.common.collect.ImmutableList;
import javax.inject.Provider;
import lazygraph.MemberProvider;

/**
 * Provides the value of a single member. Every call goes through the owning {@link Linker}, so the
 * member is constructed on the first call and served from its cache afterwards.
 */
public final class MemberBinding<T> implements Provider<T> {
  final String member;
  final ImmutableList<String> dependencies;
  final MemberProvider<T> provider;
  private final Linker linker;

  MemberBinding(
      String member,
      ImmutableList<String> dependencies,
      MemberProvider<T> provider,
      Linker linker) {
    this.member = member;
    this.dependencies = dependencies;
    this.provider = provider;
    this.linker = linker;
  }

  public String member() {
    return member;
  }

  /** The members this member depends on, in declaration order. */
  public ImmutableList<String> dependencies() {
    return dependencies;
  }

  @SuppressWarnings("unchecked") // The cached value for this member was returned by provider.
  @Override
  public T get() {
    return (T) linker.resolve(this);
  }

  @Override
  public String toString() {
    return "MemberBinding[member=\"" + member + "\", dependencies=" + dependencies + "]";
  }
}
