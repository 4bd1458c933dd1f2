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

package com.google.pasta.refactoring;

import com.google.common.collect.ImmutableList;
import com.google.pasta.base.RootScope;
import com.google.pasta.syntax.Field;
import com.google.pasta.syntax.Kind;
import com.google.pasta.syntax.Node;
import java.util.List;

/** Helpers for structural edits of analyzed trees. */
public final class RefactoringUtils {

  /** The statement lists a statement can live in, in the order they are searched. */
  private static final ImmutableList<Field> BLOCK_FIELDS =
      ImmutableList.of(Field.BODY, Field.ORELSE, Field.FINALBODY);

  private RefactoringUtils() {}

  /** The position of a statement: its parent, the list field holding it and its index there. */
  public static final class BlockLocation {
    private final Node parent;
    private final Field field;
    private final int index;

    BlockLocation(Node parent, Field field, int index) {
      this.parent = parent;
      this.field = field;
      this.index = index;
    }

    public Node getParent() {
      return parent;
    }

    public Field getField() {
      return field;
    }

    public int getIndex() {
      return index;
    }

    /** The live list of statements the located node belongs to. */
    public List<Node> getBlock() {
      return parent.getNonNullChildren(field);
    }

    @Override
    public String toString() {
      return parent.getKind() + "." + field + "[" + index + "]";
    }
  }

  /**
   * Finds the statement list that holds {@code node}, using the parent index of {@code
   * rootScope}.
   *
   * @throws StructuralLookupException if no statement list of the recorded parent holds the node,
   *     or the node was added to the tree after it was analyzed
   */
  public static BlockLocation locateContainingBlock(RootScope rootScope, Node node) {
    if (!rootScope.wasAnalyzed(node)) {
      throw new StructuralLookupException(
          "Unable to find list containing " + node + ": it was not in the analyzed tree");
    }
    Node parent = rootScope.parent(node);
    if (parent != null) {
      for (Field field : BLOCK_FIELDS) {
        Kind.FieldSpec spec = parent.getKind().getFieldSpec(field);
        if (spec == null || spec.getArity() != Kind.Arity.LIST) {
          continue;
        }
        List<Node> block = parent.getNonNullChildren(field);
        int index = indexOf(block, node);
        if (index >= 0) {
          return new BlockLocation(parent, field, index);
        }
      }
    }
    throw new StructuralLookupException(
        "Unable to find list containing " + node + " on parent node " + parent);
  }

  /** Index of {@code node} by identity; equal-looking nodes are distinct statements. */
  private static int indexOf(List<Node> block, Node node) {
    for (int i = 0; i < block.size(); i++) {
      if (block.get(i) == node) {
        return i;
      }
    }
    return -1;
  }
}
