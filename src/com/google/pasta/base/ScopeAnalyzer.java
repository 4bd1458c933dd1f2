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
import com.google.pasta.syntax.Context;
import com.google.pasta.syntax.Field;
import com.google.pasta.syntax.Kind;
import com.google.pasta.syntax.Node;
import com.google.pasta.syntax.Prop;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Builds the lexical scopes of a module in one pass over its tree. Function, class and lambda
 * bodies get scopes of their own; comprehensions share the scope they appear in.
 *
 * <p>The result describes the tree as it was analyzed. After a structural edit, analyze the tree
 * again.
 *
 * <p>This implementation is not thread-safe.
 */
public final class ScopeAnalyzer {
  private static final Splitter DOT_SPLITTER = Splitter.on('.');

  private final RootScope rootScope = new RootScope();
  private Scope scope = rootScope;
  private @Nullable Node parent;

  private ScopeAnalyzer() {}

  /** Analyzes the scopes of a module. Never fails on a well-formed tree. */
  public static RootScope analyze(Node tree) {
    checkArgument(tree.isKind(Kind.MODULE), "can only analyze modules, not %s", tree);
    ScopeAnalyzer analyzer = new ScopeAnalyzer();
    analyzer.visit(tree);
    return analyzer.rootScope;
  }

  private void visit(@Nullable Node n) {
    if (n == null) {
      return;
    }
    rootScope.setParent(n, parent);
    Node previous = parent;
    parent = n;
    try {
      scan(n);
    } finally {
      parent = previous;
    }
  }

  private void visitChildren(Node n) {
    for (Node child : n.children()) {
      visit(child);
    }
  }

  private void visitInOrder(Node n, Field... fields) {
    for (Field field : fields) {
      if (!n.getKind().hasField(field)) {
        continue;
      }
      if (n.getKind().getFieldSpec(field).getArity().isList()) {
        for (Node child : n.getChildren(field)) {
          visit(child);
        }
      } else {
        visit(n.getChild(field));
      }
    }
  }

  private void scan(Node n) {
    switch (n.getKind()) {
      case IMPORT:
        for (Node alias : n.getNonNullChildren(Field.NAMES)) {
          defineImport(alias);
        }
        visitChildren(n);
        return;

      case IMPORT_FROM:
        {
          String module = n.getString(Prop.MODULE);
          if (module != null) {
            scope.addExternalReference(module, n, true);
          }
          for (Node alias : n.getNonNullChildren(Field.NAMES)) {
            String asname = alias.getString(Prop.ASNAME);
            String name = alias.getString(Prop.NAME);
            scope.defineName(asname != null ? asname : name, alias);
            if (module != null) {
              scope.addExternalReference(module + "." + name, alias, false);
            }
          }
          visitChildren(n);
          return;
        }

      case NAME:
        {
          String id = n.getString(Prop.ID);
          Context context = (Context) n.getProp(Prop.CONTEXT);
          if (context == Context.STORE || context == Context.PARAM) {
            scope.defineName(id, n);
          } else if (context == Context.LOAD) {
            Name name = scope.lookupName(id);
            name.addReference(n);
            rootScope.setNameForNode(n, name);
          }
          return;
        }

      case FUNCTION_DEF:
        scope.defineName(n.getString(Prop.NAME), n);
        inNewScope(n, Field.DECORATOR_LIST, Field.ARGS, Field.RETURNS, Field.BODY);
        return;

      case CLASS_DEF:
        scope.defineName(n.getString(Prop.NAME), n);
        inNewScope(n, Field.DECORATOR_LIST, Field.BASES, Field.KEYWORDS, Field.BODY);
        return;

      case LAMBDA:
        inNewScope(n, Field.ARGS, Field.BODY);
        return;

      case ARGUMENTS:
        // Defaults are evaluated in the enclosing scope, before any parameter is bound.
        visitInOrder(
            n,
            Field.DEFAULTS,
            Field.KW_DEFAULTS,
            Field.ARGS,
            Field.VARARG,
            Field.KWONLYARGS,
            Field.KWARG);
        return;

      case ARG:
        scope.defineName(n.getString(Prop.ARG), n);
        visitChildren(n);
        return;

      case EXCEPT_HANDLER:
        visit(n.getChild(Field.TYPE));
        if (n.getString(Prop.NAME) != null) {
          scope.defineName(n.getString(Prop.NAME), n);
        }
        visitInOrder(n, Field.BODY);
        return;

      case ATTRIBUTE:
        {
          visitChildren(n);
          Name valueName = rootScope.getNameForNode(n.getRequiredChild(Field.VALUE));
          if (valueName != null) {
            Name name = valueName.lookupName(n.getString(Prop.ATTR));
            rootScope.setNameForNode(n, name);
            name.addReference(n);
          }
          return;
        }

      default:
        visitChildren(n);
    }
  }

  private void inNewScope(Node n, Field... fields) {
    Scope enclosing = scope;
    scope = new Scope(enclosing);
    try {
      visitInOrder(n, fields);
    } finally {
      scope = enclosing;
    }
  }

  private void defineImport(Node alias) {
    String dottedName = alias.getString(Prop.NAME);
    scope.addExternalReference(dottedName, alias, true);
    String asname = alias.getString(Prop.ASNAME);
    if (asname != null) {
      scope.defineName(asname, alias);
      return;
    }
    List<String> parts = DOT_SPLITTER.splitToList(dottedName);
    Name name = scope.defineName(parts.get(0), alias);
    for (String part : parts.subList(1, parts.size())) {
      name = name.lookupName(part);
      name.define(alias);
    }
  }
}
