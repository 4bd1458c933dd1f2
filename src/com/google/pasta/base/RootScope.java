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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.pasta.syntax.Node;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The module scope. Besides the module's own names it holds the indexes built while analyzing the
 * tree: each node's parent, the {@link Name} each name read resolves to, and the nodes that refer
 * to each imported module path.
 */
public final class RootScope extends Scope {
  private static final Splitter DOT_SPLITTER = Splitter.on('.');

  private final ListMultimap<String, Node> externalReferences =
      MultimapBuilder.linkedHashKeys().arrayListValues().build();
  private final Map<Node, @Nullable Node> parents = new IdentityHashMap<>();
  private final Map<Node, Name> nodesToNames = new IdentityHashMap<>();

  RootScope() {
    super(null);
  }

  @Override
  public void addExternalReference(String name, Node node, boolean packages) {
    externalReferences.put(name, node);
    if (packages) {
      List<String> parts = DOT_SPLITTER.splitToList(name);
      for (int i = 1; i < parts.size(); i++) {
        externalReferences.put(String.join(".", parts.subList(0, i)), node);
      }
    }
  }

  @Override
  public RootScope getRootScope() {
    return this;
  }

  /** The nodes that refer to the module path {@code name}, in order of discovery. */
  public ImmutableList<Node> getExternalReferences(String name) {
    return ImmutableList.copyOf(externalReferences.get(name));
  }

  /** Every module path referred to, in order of first reference. */
  public ImmutableList<String> getExternalReferenceNames() {
    return ImmutableList.copyOf(externalReferences.keySet());
  }

  /**
   * Returns the parent of {@code node}, or null for the module.
   *
   * @throws IllegalArgumentException if {@code node} was not in the analyzed tree
   */
  public @Nullable Node parent(Node node) {
    checkArgument(parents.containsKey(node), "%s is not part of the analyzed tree", node);
    return parents.get(node);
  }

  /** Whether {@code node} was part of the tree when it was analyzed. */
  public boolean wasAnalyzed(Node node) {
    return parents.containsKey(node);
  }

  void setParent(Node node, @Nullable Node parent) {
    parents.put(node, parent);
  }

  /** The name a NAME or ATTRIBUTE read resolves to, or null if it was not resolved. */
  public @Nullable Name getNameForNode(Node node) {
    return nodesToNames.get(node);
  }

  void setNameForNode(Node node, Name name) {
    nodesToNames.put(node, name);
  }
}
