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

import com.google.common.collect.ImmutableList;
import com.google.pasta.syntax.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A named entity found by the {@link ScopeAnalyzer}: a variable, function, class, parameter or
 * imported module. Attribute names read off the entity ({@code a.b}) are tracked as nested names.
 */
public final class Name {
  private final String id;
  private @Nullable Node definition;
  private final List<Node> reads = new ArrayList<>();
  private final Map<String, Name> attrs = new LinkedHashMap<>();

  Name(String id) {
    this.id = id;
  }

  public String getId() {
    return id;
  }

  /** The node that first bound this name, or null if it was only ever read. */
  public @Nullable Node getDefinition() {
    return definition;
  }

  /** Every reference after the definition, reads and later bindings alike, in source order. */
  public ImmutableList<Node> getReads() {
    return ImmutableList.copyOf(reads);
  }

  /** The nested names of attributes read off this one, by attribute name. */
  public Map<String, Name> getAttrs() {
    return Collections.unmodifiableMap(attrs);
  }

  void addReference(Node node) {
    reads.add(node);
  }

  void define(Node node) {
    if (definition == null) {
      definition = node;
    } else {
      reads.add(node);
    }
  }

  /** Returns the nested name for {@code attr}, creating it on first use. */
  Name lookupName(String attr) {
    return attrs.computeIfAbsent(attr, Name::new);
  }

  @Override
  public String toString() {
    return "Name(" + id + ")";
  }
}
