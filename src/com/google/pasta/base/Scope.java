/*
 * Copyright 2026 The Pasta Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.pasta.base;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.pasta.syntax.Node;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A lexical scope: the names bound in a module, function, class or lambda body. Scopes point
 * back to their parent; the outermost one is the {@link RootScope}.
 */
public class Scope {
  private final @Nullable Scope parent;
  private final Map<String, Name> names = new LinkedHashMap<>();

  Scope(@Nullable Scope parent) {
    this.parent = parent;
  }

  /** Returns the parent scope, or null if this is the root scope. */
  public @Nullable Scope getParent() {
    return parent;
  }

  /** The names bound in this scope itself, in order of first binding. */
  public ImmutableMap<String, Name> getNames() {
    return ImmutableMap.copyOf(names);
  }

  /** Binds {@code id} in this scope, recording {@code node} as a definition or a rebinding. */
  @CanIgnoreReturnValue
  public Name defineName(String id, Node node) {
    Name name = names.computeIfAbsent(id, Name::new);
    name.define(node);
    return name;
  }

  /**
   * Resolves {@code id} through this scope and its parents. A name found nowhere is created in the
   * root scope, without a definition.
   */
  public Name lookupName(String id) {
    Name name = names.get(id);
    if (name != null) {
      return name;
    }
    if (parent == null) {
      return names.computeIfAbsent(id, Name::new);
    }
    return parent.lookupName(id);
  }

  /**
   * Records {@code node} as a reference to the external module path {@code name}. With {@code
   * packages}, the path's enclosing packages are recorded as well.
   */
  public void addExternalReference(String name, Node node, boolean packages) {
    getRootScope().addExternalReference(name, node, packages);
  }

  public RootScope getRootScope() {
    Scope scope = this;
    while (scope.parent != null) {
      scope = scope.parent;
    }
    return (RootScope) scope;
  }

  @Override
  public String toString() {
    return "Scope" + names.keySet();
  }
}
