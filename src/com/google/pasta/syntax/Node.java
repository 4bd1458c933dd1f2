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

package com.google.pasta.syntax;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A node of a Python syntax tree. The node's {@link Kind} fixes which child fields and payload
 * props it has. A node exclusively owns its children and holds no reference to its parent; use
 * the parent index built by the scope analysis to walk upwards.
 */
public final class Node {
  private final Kind kind;
  private final EnumMap<Field, @Nullable Node> singleChildren = new EnumMap<>(Field.class);
  private final EnumMap<Field, List<@Nullable Node>> listChildren = new EnumMap<>(Field.class);
  private final EnumMap<Prop, Object> props = new EnumMap<>(Prop.class);
  private @Nullable Formatting formatting;
  private int lineno = -1;
  private int charno = -1;

  public Node(Kind kind) {
    this.kind = checkNotNull(kind);
    for (Kind.FieldSpec spec : kind.getFields()) {
      if (spec.getArity().isList()) {
        listChildren.put(spec.getField(), new ArrayList<>());
      }
    }
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isKind(Kind kind) {
    return this.kind == kind;
  }

  /** Returns the child in a single-node field, or null if an optional field is empty. */
  public @Nullable Node getChild(Field field) {
    checkArgument(!specOf(field).getArity().isList(), "%s.%s is a list", kind, field);
    return singleChildren.get(field);
  }

  /** Returns the child in a field that must be filled. */
  public Node getRequiredChild(Field field) {
    Node child = getChild(field);
    checkState(child != null, "%s.%s is empty", kind, field);
    return child;
  }

  /**
   * Returns the live list of children in a list field. Edits to the returned list edit the tree.
   */
  public List<@Nullable Node> getChildren(Field field) {
    checkArgument(specOf(field).getArity().isList(), "%s.%s is not a list", kind, field);
    return listChildren.get(field);
  }

  /** Returns the children of a list field that does not allow null elements. */
  @SuppressWarnings("unchecked")
  public List<Node> getNonNullChildren(Field field) {
    checkArgument(specOf(field).getArity() == Kind.Arity.LIST, "%s.%s allows nulls", kind, field);
    return (List<Node>) (List<?>) listChildren.get(field);
  }

  @CanIgnoreReturnValue
  public Node setChild(Field field, @Nullable Node child) {
    Kind.Arity arity = specOf(field).getArity();
    checkArgument(!arity.isList(), "%s.%s is a list", kind, field);
    checkArgument(child != null || arity == Kind.Arity.OPTIONAL, "%s.%s is required", kind, field);
    singleChildren.put(field, child);
    return this;
  }

  @CanIgnoreReturnValue
  public Node addChild(Field field, @Nullable Node child) {
    Kind.Arity arity = specOf(field).getArity();
    checkArgument(arity.isList(), "%s.%s is not a list", kind, field);
    checkArgument(child != null || arity == Kind.Arity.NULLABLE_LIST,
        "%s.%s does not allow nulls", kind, field);
    listChildren.get(field).add(child);
    return this;
  }

  /** The number of children in {@code field}: its size for lists, zero or one otherwise. */
  public int childCount(Field field) {
    Kind.FieldSpec spec = kind.getFieldSpec(field);
    if (spec == null) {
      return 0;
    }
    if (spec.getArity().isList()) {
      return listChildren.get(field).size();
    }
    return singleChildren.get(field) == null ? 0 : 1;
  }

  /** All non-null children in schema order. */
  public ImmutableList<Node> children() {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Kind.FieldSpec spec : kind.getFields()) {
      if (spec.getArity().isList()) {
        for (Node child : listChildren.get(spec.getField())) {
          if (child != null) {
            result.add(child);
          }
        }
      } else {
        Node child = singleChildren.get(spec.getField());
        if (child != null) {
          result.add(child);
        }
      }
    }
    return result.build();
  }

  public @Nullable Object getProp(Prop prop) {
    checkArgument(kind.hasProp(prop), "%s has no prop %s", kind, prop);
    return props.get(prop);
  }

  public @Nullable String getString(Prop prop) {
    return (String) getProp(prop);
  }

  public int getInt(Prop prop) {
    Object value = getProp(prop);
    return value == null ? 0 : (Integer) value;
  }

  public boolean getBoolean(Prop prop) {
    return Boolean.TRUE.equals(getProp(prop));
  }

  @CanIgnoreReturnValue
  public Node setProp(Prop prop, @Nullable Object value) {
    checkArgument(kind.hasProp(prop), "%s has no prop %s", kind, prop);
    if (value == null) {
      props.remove(prop);
    } else {
      props.put(prop, value);
    }
    return this;
  }

  public @Nullable Formatting getFormatting() {
    return formatting;
  }

  public void setFormatting(@Nullable Formatting formatting) {
    checkArgument(formatting == null || formatting.getKind() == kind,
        "formatting for %s attached to %s", formatting, kind);
    this.formatting = formatting;
  }

  /** One-based line of the first token of this node, or -1 for nodes built in code. */
  public int getLineno() {
    return lineno;
  }

  /** Zero-based column of the first token of this node, or -1 for nodes built in code. */
  public int getCharno() {
    return charno;
  }

  @CanIgnoreReturnValue
  public Node setLinenoCharno(int lineno, int charno) {
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  private Kind.FieldSpec specOf(Field field) {
    Kind.FieldSpec spec = kind.getFieldSpec(field);
    checkArgument(spec != null, "%s has no field %s", kind, field);
    return spec;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(kind.toString());
    for (Map.Entry<Prop, Object> prop : props.entrySet()) {
      sb.append(' ').append(prop.getKey()).append('=').append(prop.getValue());
    }
    if (lineno > 0) {
      sb.append(" @").append(lineno).append(':').append(charno);
    }
    return sb.toString();
  }

  /** Renders the subtree rooted at this node, one node per line, for debugging. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    try {
      appendStringTree(sb);
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
    return sb.toString();
  }

  public void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, 0, appendable);
  }

  private static void toStringTreeHelper(Node n, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (Node child : n.children()) {
      toStringTreeHelper(child, level + 1, sb);
    }
  }
}
