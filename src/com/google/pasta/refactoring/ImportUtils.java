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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.pasta.base.RootScope;
import com.google.pasta.syntax.Field;
import com.google.pasta.syntax.Kind;
import com.google.pasta.syntax.Node;
import com.google.pasta.syntax.Prop;
import java.util.List;
import java.util.logging.Logger;

/** Edits of import statements. */
public final class ImportUtils {

  private static final Logger logger = Logger.getLogger(ImportUtils.class.getName());

  private ImportUtils() {}

  /**
   * Moves {@code alias} out of {@code importNode} into a new import statement placed right after
   * it. A {@code from} import keeps its module and level in the new statement.
   *
   * <p>The new statement and the moved alias carry no formatting, so they are generated with
   * default spacing and the indentation of the block the statement is added to.
   *
   * @param rootScope the scopes of the whole tree, analyzed before the edit
   * @return the new import statement
   * @throws StructuralLookupException if {@code importNode} is not in a statement list of its
   *     recorded parent
   */
  public static Node splitImport(RootScope rootScope, Node importNode, Node alias) {
    checkArgument(
        importNode.isKind(Kind.IMPORT) || importNode.isKind(Kind.IMPORT_FROM),
        "not an import: %s",
        importNode);
    List<Node> names = importNode.getNonNullChildren(Field.NAMES);
    checkArgument(names.contains(alias), "%s is not imported by %s", alias, importNode);
    checkArgument(names.size() > 1, "%s imports nothing else", importNode);

    RefactoringUtils.BlockLocation location =
        RefactoringUtils.locateContainingBlock(rootScope, importNode);

    Node newImport = new Node(importNode.getKind());
    if (importNode.isKind(Kind.IMPORT_FROM)) {
      newImport
          .setProp(Prop.MODULE, importNode.getProp(Prop.MODULE))
          .setProp(Prop.LEVEL, importNode.getProp(Prop.LEVEL));
    }
    names.remove(alias);
    // Spacing captured inside the old statement may not fit the new one.
    alias.setFormatting(null);
    newImport.addChild(Field.NAMES, alias);
    location.getBlock().add(location.getIndex() + 1, newImport);

    logger.fine("Split " + alias.getString(Prop.NAME) + " out of import at " + location);
    return newImport;
  }
}
